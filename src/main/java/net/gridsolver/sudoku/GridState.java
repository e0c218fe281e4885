// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.TIntStack;

import javax.annotation.Nullable;

/**
 * Working state of a search: the cell values, a mask per unit of the values already placed
 * there, and per cell the mask of values it may not take together with the number it may.
 * Cells are addressed by index r * N + c. All mutation goes through {@link #assign},
 * {@link #ban} and {@link #restore}, and the first two log what they overwrite on a
 * {@link Trail}.
 */
final class GridState {
    private final BoxShape shape;
    private final int n;
    private final int full;
    private final int[] cells;       // 0 or the value placed at each cell
    private final int[] rowTaken;    // values present in row i
    private final int[] colTaken;    // values present in column j
    private final int[] boxTaken;    // values present in box k
    private final int[] forbidden;   // values cell p may not take: its units' values plus any local bans
    private final int[] available;   // popcount of the complement of forbidden[p]; meaningful only for empty cells
    private final int[][] peers;     // distinct cells sharing a row, column or box with p, excluding p
    private int emptyCount = 0;

    GridState(Sudoku puzzle) {
        shape = puzzle.shape();
        n = shape.size();
        full = shape.fullMask();
        final int cellCount = n * n;
        cells = new int[cellCount];
        rowTaken = new int[n];
        colTaken = new int[n];
        boxTaken = new int[n];
        forbidden = new int[cellCount];
        available = new int[cellCount];
        peers = peersOf(shape);

        for (int r = 0; r < n; ++r) {
            for (int c = 0; c < n; ++c) {
                int v = puzzle.given(r, c);
                if (v == 0) {
                    ++emptyCount;
                    continue;
                }
                int mask = 1 << (v - 1);
                int b = shape.boxIndex(r, c);
                if (((rowTaken[r] | colTaken[c] | boxTaken[b]) & mask) != 0) {
                    throw new InvalidPuzzleException(String.format("uniqueness violation for given %d @ %d,%d", v, r, c));
                }
                cells[r * n + c] = v;
                rowTaken[r] |= mask;
                colTaken[c] |= mask;
                boxTaken[b] |= mask;
            }
        }
        for (int p = 0; p < cellCount; ++p) {
            int r = p / n;
            int c = p % n;
            forbidden[p] = rowTaken[r] | colTaken[c] | boxTaken[shape.boxIndex(r, c)];
            available[p] = Integer.bitCount(full & ~forbidden[p]);
        }
    }

    private static int[][] peersOf(BoxShape shape) {
        final int n = shape.size();
        int[][] peers = new int[n * n][];
        boolean[] seen = new boolean[n * n];
        TIntArrayList buf = new TIntArrayList();
        for (int p = 0; p < n * n; ++p) {
            int r = p / n;
            int c = p % n;
            int r0 = (r / shape.boxRows()) * shape.boxRows();
            int c0 = (c / shape.boxCols()) * shape.boxCols();
            buf.resetQuick();
            for (int k = 0; k < n; ++k) {
                buf.add(r * n + k);
                buf.add(k * n + c);
            }
            for (int rr = r0; rr < r0 + shape.boxRows(); ++rr) {
                for (int cc = c0; cc < c0 + shape.boxCols(); ++cc) buf.add(rr * n + cc);
            }
            TIntArrayList distinct = new TIntArrayList();
            for (int i = 0; i < buf.size(); ++i) {
                int q = buf.get(i);
                if (q != p && !seen[q]) {
                    seen[q] = true;
                    distinct.add(q);
                }
            }
            for (int i = 0; i < distinct.size(); ++i) seen[distinct.get(i)] = false;
            distinct.sort();
            peers[p] = distinct.toArray();
        }
        return peers;
    }

    int size() { return n; }
    int cellCount() { return n * n; }

    int value(int cell) { return cells[cell]; }
    boolean isEmpty(int cell) { return cells[cell] == 0; }

    int forbidden(int r, int c) { return forbidden[r * n + c]; }
    int available(int r, int c) { return available[r * n + c]; }
    int forbidden(int cell) { return forbidden[cell]; }
    int available(int cell) { return available[cell]; }

    /** @return mask of the values still legal at the cell */
    int candidates(int cell) { return full & ~forbidden[cell]; }

    int rowTaken(int r) { return rowTaken[r]; }
    int colTaken(int c) { return colTaken[c]; }
    int boxTaken(int b) { return boxTaken[b]; }

    int[] peers(int cell) { return peers[cell]; }

    boolean isSolved() { return emptyCount == 0; }

    int[][] toGrid() {
        int[][] grid = new int[n][n];
        for (int r = 0; r < n; ++r) System.arraycopy(cells, r * n, grid[r], 0, n);
        return grid;
    }

    /**
     * Place a value in an empty cell and strike it from the candidates of the cell's empty
     * peers. Stops at the first peer left with no candidates; everything done up to that
     * point is on the trail.
     *
     * @param cell index of an empty cell
     * @param value a candidate of that cell in [1..N]
     * @param trail receives an entry for every overwritten value
     * @param singles if not null, receives each peer whose count drops to exactly one
     * @return false if some peer was left with no candidates
     */
    boolean assign(int cell, int value, Trail trail, @Nullable TIntStack singles) {
        final int bit = 1 << (value - 1);
        final int r = cell / n;
        final int c = cell % n;
        final int b = shape.boxIndex(r, c);
        trail.record(Trail.Op.CELL, cell, cells[cell]);
        cells[cell] = value;
        --emptyCount;
        trail.record(Trail.Op.ROW, r, rowTaken[r]);
        rowTaken[r] |= bit;
        trail.record(Trail.Op.COLUMN, c, colTaken[c]);
        colTaken[c] |= bit;
        trail.record(Trail.Op.BOX, b, boxTaken[b]);
        boxTaken[b] |= bit;
        for (int p : peers[cell]) {
            if (cells[p] != 0 || (forbidden[p] & bit) != 0) continue;
            trail.record(Trail.Op.FORBIDDEN, p, forbidden[p]);
            forbidden[p] |= bit;
            if (--available[p] == 0) return false;
            if (available[p] == 1 && singles != null) singles.push(p);
        }
        return true;
    }

    /**
     * Exclude a value from an empty cell's candidates after the branch that tried it failed.
     */
    void ban(int cell, int value, Trail trail) {
        final int bit = 1 << (value - 1);
        if ((forbidden[cell] & bit) != 0) return;
        trail.record(Trail.Op.FORBIDDEN, cell, forbidden[cell]);
        forbidden[cell] |= bit;
        --available[cell];
    }

    void restore(Trail.Op op, int location, int previous) {
        switch (op) {
            case CELL:
                if (cells[location] != 0 && previous == 0) ++emptyCount;
                else if (cells[location] == 0 && previous != 0) --emptyCount;
                cells[location] = previous;
                break;
            case ROW:
                rowTaken[location] = previous;
                break;
            case COLUMN:
                colTaken[location] = previous;
                break;
            case BOX:
                boxTaken[location] = previous;
                break;
            case FORBIDDEN:
                forbidden[location] = previous;
                available[location] = Integer.bitCount(full & ~previous);
                break;
        }
    }
}
