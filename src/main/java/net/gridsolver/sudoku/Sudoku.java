// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import com.google.common.base.CharMatcher;

import java.util.Arrays;
import java.util.Optional;

/**
 * A puzzle: the initial grid of givens (0 for an empty cell) together with the solution,
 * once some solver has produced one. Grids are indexed [row][column].
 */
public class Sudoku {
    private static final CharMatcher ignored = CharMatcher.whitespace().or(CharMatcher.anyOf("|-+"));

    private final BoxShape shape;
    private final int[][] init;
    private int[][] solution = null;

    /**
     * @param init a 9×9 grid with 3×3 boxes; 0 marks an empty cell
     */
    public Sudoku(int[][] init) {
        this(BoxShape.STANDARD, init);
    }

    public Sudoku(BoxShape shape, int[][] init) {
        this.shape = shape;
        final int n = shape.size();
        if (init.length != n) {
            throw new InvalidPuzzleException(String.format("expected %d rows for %s boxes, got %d", n, shape, init.length));
        }
        this.init = new int[n][];
        for (int r = 0; r < n; ++r) {
            if (init[r].length != n) {
                throw new InvalidPuzzleException(String.format("row %d has %d cells, expected %d", r, init[r].length, n));
            }
            for (int c = 0; c < n; ++c) {
                int v = init[r][c];
                if (v < 0 || v > n) {
                    throw new InvalidPuzzleException(String.format("value %d @ %d,%d is outside [0..%d]", v, r, c, n));
                }
            }
            this.init[r] = init[r].clone();
        }
    }

    public static Sudoku fromBoardString(String boardString) {
        return fromBoardString(BoxShape.STANDARD, boardString);
    }

    /**
     * Construct a puzzle from a board string. The string gives the cells in row by row, left
     * to right order. A '.' or '0' is an empty cell; the digits 1-9 and then the letters A, B,
     * ... (in either case) stand for the values 1..N. Whitespace and the characters "|-+" may
     * be used for layout and are ignored. A 9×9 board might begin: "..3 .1. ... 415" (etc.)
     *
     * @param shape box dimensions of the grid
     * @param boardString board representation with empty cells recorded as '.'
     * @return a puzzle with no solution recorded yet
     */
    public static Sudoku fromBoardString(BoxShape shape, String boardString) {
        final int n = shape.size();
        int[][] grid = new int[n][n];
        int p = 0;
        for (int j = 0; j < boardString.length(); ++j) {
            char ch = boardString.charAt(j);
            if (ignored.matches(ch)) continue;
            int v = symbolValue(ch);
            if (v < 0 || v > n) {
                throw new InvalidPuzzleException(String.format("unexpected '%c' at position %d of board string", ch, j));
            }
            if (p >= n * n) {
                throw new InvalidPuzzleException(String.format("board string has more than %d cells", n * n));
            }
            grid[p / n][p % n] = v;
            ++p;
        }
        if (p != n * n) {
            throw new InvalidPuzzleException(String.format("board string has %d cells, expected %d", p, n * n));
        }
        return new Sudoku(shape, grid);
    }

    private static int symbolValue(char ch) {
        if (ch == '.' || ch == '0') return 0;
        if (ch > '0' && ch <= '9') return ch - '0';
        if (ch >= 'A' && ch <= 'Z') return ch - 'A' + 10;
        if (ch >= 'a' && ch <= 'z') return ch - 'a' + 10;
        return -1;
    }

    private static char symbol(int v) {
        if (v == 0) return '.';
        return v <= 9 ? (char) ('0' + v) : (char) ('A' + v - 10);
    }

    public BoxShape shape() { return shape; }

    public int size() { return shape.size(); }

    /** @return the given at r,c, or 0 if the cell starts out empty */
    public int given(int r, int c) { return init[r][c]; }

    public int[][] getInitial() { return copyOf(init); }

    public Optional<int[][]> getSolution() {
        return Optional.ofNullable(solution).map(Sudoku::copyOf);
    }

    void setSolution(int[][] grid) {
        if (grid.length != shape.size()) throw new IllegalArgumentException("solution has the wrong dimensions");
        solution = copyOf(grid);
    }

    /**
     * Verify that no value is given twice in the same row, column or box.
     *
     * @throws InvalidPuzzleException naming the first repeated given found in row-major order
     */
    public void checkGivens() {
        final int n = shape.size();
        int[] rows = new int[n];
        int[] columns = new int[n];
        int[] boxes = new int[n];
        for (int r = 0; r < n; ++r) {
            for (int c = 0; c < n; ++c) {
                int v = init[r][c];
                if (v == 0) continue;
                int mask = 1 << (v - 1);
                int b = shape.boxIndex(r, c);
                if (((rows[r] | columns[c] | boxes[b]) & mask) != 0) {
                    throw new InvalidPuzzleException(String.format("uniqueness violation for given %d @ %d,%d", v, r, c));
                }
                rows[r] |= mask;
                columns[c] |= mask;
                boxes[b] |= mask;
            }
        }
    }

    /**
     * @return true if a solution has been recorded and it passes {@link #isValidSolution}
     */
    public boolean check() {
        return solution != null && isValidSolution(shape, solution);
    }

    /**
     * Checks every row, column and box of the grid for being a permutation of 1..N. This looks
     * only at the grid and not at any solver's bookkeeping.
     *
     * @param shape box dimensions
     * @param grid candidate solution
     * @return true if the grid is a complete, valid solution
     */
    public static boolean isValidSolution(BoxShape shape, int[][] grid) {
        final int n = shape.size();
        if (grid.length != n) return false;
        int[] rows = new int[n];
        int[] columns = new int[n];
        int[] boxes = new int[n];
        for (int r = 0; r < n; ++r) {
            if (grid[r].length != n) return false;
            for (int c = 0; c < n; ++c) {
                int v = grid[r][c];
                if (v < 1 || v > n) return false;
                int mask = 1 << (v - 1);
                int b = shape.boxIndex(r, c);
                if (((rows[r] | columns[c] | boxes[b]) & mask) != 0) return false;
                rows[r] |= mask;
                columns[c] |= mask;
                boxes[b] |= mask;
            }
        }
        // n distinct values in each of n units means every unit holds all of 1..n.
        return true;
    }

    /**
     * Render a grid in the board string format: each row as groups of boxCols symbols, with
     * single spaces between groups and between rows.
     */
    public static String toBoardString(BoxShape shape, int[][] grid) {
        StringBuilder sb = new StringBuilder();
        for (int[] row : grid) {
            for (int c = 0; c < row.length; ++c) {
                if (c > 0 && c % shape.boxCols() == 0) sb.append(' ');
                sb.append(symbol(row[c]));
            }
            sb.append(' ');
        }
        return sb.toString().trim();
    }

    static int[][] copyOf(int[][] grid) {
        return Arrays.stream(grid).map(int[]::clone).toArray(int[][]::new);
    }

    @Override
    public String toString() {
        int[][] grid = solution != null ? solution : init;
        StringBuilder sb = new StringBuilder();
        for (int[] row : grid) {
            for (int v : row) sb.append(symbol(v)).append(' ');
            sb.setLength(sb.length() - 1);
            sb.append('\n');
        }
        return sb.toString();
    }
}
