// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;

/**
 * Solves puzzles with a chosen algorithm behind one contract: validate the givens, run the
 * algorithm, and either return the solution (also recorded in the puzzle) or throw.
 */
public class SolverEngine {
    public enum Kind {
        DFS(SearchEngine::new),
        STOCHASTIC(StochasticSolver::new);

        private final Function<Sudoku, AbstractSudokuSolver> factory;

        Kind(Function<Sudoku, AbstractSudokuSolver> factory) {
            this.factory = factory;
        }

        public static Kind parse(String name) {
            try {
                return valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown algorithm: " + name, e);
            }
        }
    }

    private final Function<Sudoku, AbstractSudokuSolver> factory;
    private Duration logInterval = Duration.ofMillis(1000);

    public SolverEngine(Kind kind) {
        this(kind.factory);
    }

    /**
     * @param factory creates a fresh solver for each puzzle, e.g. {@code s -> new StochasticSolver(s, seed)}
     */
    public SolverEngine(Function<Sudoku, AbstractSudokuSolver> factory) {
        this.factory = factory;
    }

    public SolverEngine setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /**
     * @return the solved grid
     * @throws InvalidPuzzleException if two givens share a value within a row, column or box
     * @throws UnsolvableException if the algorithm finds no solution
     */
    public int[][] solve(Sudoku sudoku) throws UnsolvableException {
        sudoku.checkGivens();
        AbstractSudokuSolver solver = factory.apply(sudoku);
        solver.setLogInterval(logInterval);
        return solver.solve().orElseThrow(() -> new UnsolvableException(
                String.format("%s found no solution after %d steps", solver.name(), solver.stepCount())));
    }
}
