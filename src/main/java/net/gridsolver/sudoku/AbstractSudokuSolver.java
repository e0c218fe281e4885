// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Common machinery for solving one puzzle: step counting, periodic progress logging, and
 * recording the solution in the puzzle. An instance is not meant to be shared between
 * threads; solve puzzles in parallel with one instance per puzzle.
 */
public abstract class AbstractSudokuSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSudokuSolver.class);
    final int logCheckSteps = 10000;
    protected final Sudoku puzzle;
    long stepCount;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public void setLogInterval(Duration interval) { logInterval = interval; }

    AbstractSudokuSolver(String name, Sudoku puzzle) {
        this.name = name;
        this.puzzle = puzzle;
    }

    private void start() {
        stopwatch.reset().start();
        stepCount = 0;
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    /**
     * Run the algorithm to completion. On success the solution is also recorded in the puzzle.
     *
     * @return the solved grid, or empty if the algorithm gave up or ran out of alternatives
     */
    public final Optional<int[][]> solve() {
        start();
        Optional<int[][]> outcome = search();
        stopwatch.stop();
        outcome.ifPresent(puzzle::setSolution);
        log.debug("%s %s after %d steps in %s", name, outcome.isPresent() ? "solved" : "gave up", stepCount, stopwatch);
        return outcome;
    }

    abstract Optional<int[][]> search();

    public long stepCount() { return stepCount; }

    public String name() { return name; }
}
