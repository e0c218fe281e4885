// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import gnu.trove.list.array.TIntArrayList;

/**
 * Log of reversible mutations to a {@link GridState}. Each entry names what was written
 * (a cell, a unit mask or a forbidden mask), where, and the value it held before, so that
 * undoing the entries in reverse order restores the state exactly.
 */
final class Trail {
    enum Op {
        CELL,       // location is a cell index; previous is the cell value
        ROW,        // location is a row; previous is its taken mask
        COLUMN,     // location is a column; previous is its taken mask
        BOX,        // location is a box; previous is its taken mask
        FORBIDDEN,  // location is a cell index; previous is its forbidden mask (the count is derived from it)
    }

    private static final Op[] OPS = Op.values();

    // Reading the trail as a stack of (op, location, previous) triples would require boxing.
    // Instead, we implement it as three parallel lists of primitive ints.
    private final TIntArrayList ops = new TIntArrayList();
    private final TIntArrayList locations = new TIntArrayList();
    private final TIntArrayList previous = new TIntArrayList();

    /** @return the current length, usable as a mark for {@link #undoTo} */
    int size() {
        return ops.size();
    }

    void record(Op op, int location, int prior) {
        ops.add(op.ordinal());
        locations.add(location);
        previous.add(prior);
    }

    /**
     * Undo entries, newest first, until only {@code mark} entries remain.
     */
    void undoTo(int mark, GridState state) {
        final int n = ops.size();
        if (mark < 0 || mark > n) throw new IllegalArgumentException(String.format("mark %d outside trail of length %d", mark, n));
        for (int i = n - 1; i >= mark; --i) {
            state.restore(OPS[ops.get(i)], locations.get(i), previous.get(i));
        }
        ops.remove(mark, n - mark);
        locations.remove(mark, n - mark);
        previous.remove(mark, n - mark);
    }
}
