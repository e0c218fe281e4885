// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Depth-first search with naked-single propagation, MRV cell selection and LCV value
 * ordering. State changes are logged on a {@link Trail} and undone on backtrack, so no
 * search node copies the grid. Returns the first solution found.
 */
public class SearchEngine extends AbstractSudokuSolver {
    private static final Logger log = LogManager.getFormatterLogger();

    private enum State {
        PROPAGATE,  // run naked singles to a fixed point, then test for success
        BRANCH,     // choose a cell and a value and try it
        BACKTRACK,  // resume the newest choice point that has values left
    }

    /** A branching decision: the value being tried at a cell and the values not yet tried there. */
    private static final class ChoicePoint {
        final int cell;
        int value;
        int remaining;
        int mark;  // trail length just before the value was assigned

        ChoicePoint(int cell, int value, int remaining, int mark) {
            this.cell = cell;
            this.value = value;
            this.remaining = remaining;
            this.mark = mark;
        }
    }

    private final Propagator propagator = new Propagator();
    private final VariableSelector selector = new VariableSelector();
    private final ValueOrderer orderer = new ValueOrderer();
    private long branches = 0;
    private long backtracks = 0;

    public SearchEngine(Sudoku puzzle) {
        super("dfs", puzzle);
    }

    @Override
    Optional<int[][]> search() {
        final GridState g = new GridState(puzzle);
        final Trail trail = new Trail();
        final Deque<ChoicePoint> choices = new ArrayDeque<>();
        branches = backtracks = 0;
        propagator.reset();
        State state = State.PROPAGATE;
        while (true) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) {
                maybeReportProgress(() -> String.format("depth %d trail %d backtracks %d", choices.size(), trail.size(), backtracks));
            }
            switch (state) {
                case PROPAGATE:
                    if (!propagator.propagate(g, trail)) {
                        state = State.BACKTRACK;
                        continue;
                    }
                    if (g.isSolved()) {
                        log.debug("solved with %d branches, %d backtracks, %d forced moves",
                                branches, backtracks, propagator.forcedCount());
                        return Optional.of(g.toGrid());
                    }
                    state = State.BRANCH;
                    continue;
                case BRANCH: {
                    int cell = selector.select(g);
                    if (cell == VariableSelector.NONE) throw new IllegalStateException("unsolved grid has no empty cell");
                    int bits = g.candidates(cell);
                    if (bits == 0) {
                        state = State.BACKTRACK;
                        continue;
                    }
                    int value = orderer.choose(g, cell, bits);
                    choices.push(new ChoicePoint(cell, value, bits & ~(1 << (value - 1)), trail.size()));
                    ++branches;
                    if (log.isTraceEnabled()) log.trace("level %d: trying %d @ %d,%d", choices.size(), value, cell / g.size(), cell % g.size());
                    state = g.assign(cell, value, trail, null) ? State.PROPAGATE : State.BACKTRACK;
                    continue;
                }
                case BACKTRACK:
                    if (!backtrack(g, trail, choices)) {
                        log.debug("no choice points left after %d branches", branches);
                        return Optional.empty();
                    }
                    state = State.PROPAGATE;
            }
        }
    }

    /**
     * Unwind to the newest choice point with an untried value and assign that value, discarding
     * exhausted choice points on the way.
     *
     * @return false if every choice point is exhausted
     */
    private boolean backtrack(GridState g, Trail trail, Deque<ChoicePoint> choices) {
        ++backtracks;
        while (!choices.isEmpty()) {
            ChoicePoint cp = choices.pop();
            trail.undoTo(cp.mark, g);
            if (cp.remaining == 0) continue;
            // The ban is logged before the new mark, so it lasts until this choice point is discarded.
            g.ban(cp.cell, cp.value, trail);
            cp.value = orderer.choose(g, cp.cell, cp.remaining);
            cp.remaining &= ~(1 << (cp.value - 1));
            cp.mark = trail.size();
            choices.push(cp);
            if (log.isTraceEnabled()) log.trace("level %d: retrying @ %d,%d with %d", choices.size(), cp.cell / g.size(), cp.cell % g.size(), cp.value);
            if (g.assign(cp.cell, cp.value, trail, null)) return true;
        }
        return false;
    }

    public long branches() { return branches; }

    public long backtracks() { return backtracks; }

    public long forcedMoves() { return propagator.forcedCount(); }
}
