// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;

/**
 * Naked-single propagation: while some empty cell has exactly one candidate, place it.
 * Hidden singles and larger locked sets are not looked for.
 */
final class Propagator {
    private final TIntStack worklist = new TIntArrayStack();
    private long forced = 0;

    /**
     * @return false if some empty cell was found, or left, with no candidates
     */
    boolean propagate(GridState g, Trail trail) {
        worklist.clear();
        for (int cell = 0; cell < g.cellCount(); ++cell) {
            if (!g.isEmpty(cell)) continue;
            int a = g.available(cell);
            if (a == 0) return false;
            if (a == 1) worklist.push(cell);
        }
        while (worklist.size() > 0) {
            int cell = worklist.pop();
            // The cell may have been filled, or lost its last candidate, since it was queued.
            if (!g.isEmpty(cell)) continue;
            int a = g.available(cell);
            if (a == 0) return false;
            if (a != 1) continue;
            int value = Integer.numberOfTrailingZeros(g.candidates(cell)) + 1;
            ++forced;
            if (!g.assign(cell, value, trail, worklist)) return false;
        }
        return true;
    }

    /** Start counting forced moves from zero, as at the beginning of a new search. */
    void reset() {
        forced = 0;
    }

    /** @return number of assignments made by propagation since the last reset */
    long forcedCount() {
        return forced;
    }
}
