// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

/**
 * Chooses the cell to branch on: the empty cell with the fewest candidates (MRV). Among
 * those, the cell with more empty peers is preferred, then the one whose empty peers have
 * the smaller total number of candidates, then the earliest in row-major order.
 */
final class VariableSelector {
    static final int NONE = -1;

    /**
     * @return index of the chosen cell, or NONE if no cell is empty. The chosen cell may have
     * no candidates, in which case the caller should backtrack.
     */
    int select(GridState g) {
        int best = NONE;
        int bestCount = Integer.MAX_VALUE;
        int bestPeers = -1;
        int bestPeerSum = Integer.MAX_VALUE;
        for (int cell = 0; cell < g.cellCount(); ++cell) {
            if (!g.isEmpty(cell)) continue;
            int count = g.available(cell);
            if (count > bestCount) continue;
            int emptyPeers = 0;
            int peerSum = 0;
            for (int p : g.peers(cell)) {
                if (g.isEmpty(p)) {
                    ++emptyPeers;
                    peerSum += g.available(p);
                }
            }
            if (count < bestCount
                    || emptyPeers > bestPeers
                    || (emptyPeers == bestPeers && peerSum < bestPeerSum)) {
                best = cell;
                bestCount = count;
                bestPeers = emptyPeers;
                bestPeerSum = peerSum;
            }
        }
        return best;
    }
}
