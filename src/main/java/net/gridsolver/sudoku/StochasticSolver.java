// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Randomized local repair. Boxes are filled in row-major order, each empty cell receiving a
 * value drawn uniformly from those its row, column and box still allow. When a cell has no
 * such value the current box is cleared and refilled; a box that has used up its attempts is
 * cleared and the previous box is retried instead. Running out of attempts on the first box
 * starts the whole fill over. The number of restarts is bounded, so this solver can give up
 * on puzzles that do have a solution.
 */
public class StochasticSolver extends AbstractSudokuSolver {
    private static final Logger log = LogManager.getFormatterLogger();
    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final int DEFAULT_MAX_RESTARTS = 10000;

    private final Random random;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private int maxRestarts = DEFAULT_MAX_RESTARTS;
    private int restarts = 0;

    public StochasticSolver(Sudoku puzzle) {
        this(puzzle, new Random());
    }

    public StochasticSolver(Sudoku puzzle, long seed) {
        this(puzzle, new Random(seed));
    }

    public StochasticSolver(Sudoku puzzle, Random random) {
        super("stochastic", puzzle);
        this.random = random;
    }

    /** @param attempts how many fills of a single box are tried before moving back to the previous box */
    public StochasticSolver setMaxAttempts(int attempts) {
        checkArgument(attempts > 0, "attempts must be positive: %s", attempts);
        maxAttempts = attempts;
        return this;
    }

    /** @param restarts how many times the fill may start over from the first box before giving up */
    public StochasticSolver setMaxRestarts(int restarts) {
        checkArgument(restarts >= 0, "restarts must be nonnegative: %s", restarts);
        maxRestarts = restarts;
        return this;
    }

    public int restarts() { return restarts; }

    @Override
    Optional<int[][]> search() {
        final BoxShape shape = puzzle.shape();
        final int n = shape.size();
        final int[][] grid = puzzle.getInitial();
        final int[] attempts = new int[n];
        restarts = 0;
        int box = 0;
        while (true) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) {
                final int b = box;
                maybeReportProgress(() -> String.format("box %d restarts %d", b, restarts));
            }
            box = rewind(grid, attempts, box);
            if (box < 0) {
                if (++restarts > maxRestarts) {
                    log.debug("giving up after %d restarts", maxRestarts);
                    return Optional.empty();
                }
                Arrays.fill(attempts, 0);
                box = rewind(grid, attempts, 0);
            }
            box = fill(grid, box);
            if (box == n) {
                // Givens that contradict one another survive every fill, so check the result.
                return Sudoku.isValidSolution(shape, grid) ? Optional.of(grid) : Optional.empty();
            }
        }
    }

    /**
     * Clear boxes from {@code box} backwards until one with attempts left is found, and charge
     * it an attempt. Attempt counts of the boxes after it start over.
     *
     * @return the box to fill next, or -1 if even the first box is out of attempts
     */
    private int rewind(int[][] grid, int[] attempts, int box) {
        for (int t = box; t >= 0; --t) {
            clearBox(grid, t);
            if (attempts[t] < maxAttempts) {
                ++attempts[t];
                Arrays.fill(attempts, t + 1, attempts.length, 0);
                return t;
            }
        }
        return -1;
    }

    /**
     * Fill the empty cells of boxes {@code from}, {@code from}+1, ... at random.
     *
     * @return N if every box was filled, otherwise the box holding a cell with no legal value
     */
    private int fill(int[][] grid, int from) {
        final BoxShape shape = puzzle.shape();
        final int n = shape.size();
        final int full = shape.fullMask();
        for (int b = from; b < n; ++b) {
            final int r0 = boxRow(b);
            final int c0 = boxColumn(b);
            for (int r = r0; r < r0 + shape.boxRows(); ++r) {
                for (int c = c0; c < c0 + shape.boxCols(); ++c) {
                    if (grid[r][c] != 0) continue;
                    int taken = 0;
                    for (int k = 0; k < n; ++k) taken |= bit(grid[r][k]) | bit(grid[k][c]);
                    for (int rr = r0; rr < r0 + shape.boxRows(); ++rr) {
                        for (int cc = c0; cc < c0 + shape.boxCols(); ++cc) taken |= bit(grid[rr][cc]);
                    }
                    int candidates = full & ~taken;
                    if (candidates == 0) return b;
                    grid[r][c] = nthValue(candidates, random.nextInt(Integer.bitCount(candidates)));
                }
            }
        }
        return n;
    }

    private void clearBox(int[][] grid, int b) {
        final BoxShape shape = puzzle.shape();
        final int r0 = boxRow(b);
        final int c0 = boxColumn(b);
        for (int r = r0; r < r0 + shape.boxRows(); ++r) {
            for (int c = c0; c < c0 + shape.boxCols(); ++c) grid[r][c] = puzzle.given(r, c);
        }
    }

    private int boxRow(int b) {
        final BoxShape shape = puzzle.shape();
        return (b / (shape.size() / shape.boxCols())) * shape.boxRows();
    }

    private int boxColumn(int b) {
        final BoxShape shape = puzzle.shape();
        return (b % (shape.size() / shape.boxCols())) * shape.boxCols();
    }

    private static int bit(int v) { return v == 0 ? 0 : 1 << (v - 1); }

    /** @return the value whose bit is the k-th (from zero) set bit of mask */
    private static int nthValue(int mask, int k) {
        for (int i = 0; i < k; ++i) mask &= mask - 1;
        return Integer.numberOfTrailingZeros(mask) + 1;
    }
}
