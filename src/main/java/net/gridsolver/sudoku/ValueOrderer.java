// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

/**
 * Least-constraining-value ordering. A value scores one point for each empty peer that has
 * already excluded it, since placing it costs that peer nothing; the highest score wins.
 */
final class ValueOrderer {

    /**
     * @param cell an empty cell
     * @param bits nonempty mask of the values to choose among
     * @return the chosen value in [1..N]; ties go to the smallest value
     */
    int choose(GridState g, int cell, int bits) {
        if (bits == 0) throw new IllegalArgumentException("no values to choose from at cell " + cell);
        int best = 0;
        int maxScore = -1;
        // Scan from the highest value down so that the last of equal scores is the smallest.
        for (int rest = bits; rest != 0; ) {
            int bit = Integer.highestOneBit(rest);
            rest &= ~bit;
            int s = score(g, cell, bit);
            if (s >= maxScore) {
                maxScore = s;
                best = Integer.numberOfTrailingZeros(bit) + 1;
            }
        }
        return best;
    }

    int score(GridState g, int cell, int bit) {
        int s = 0;
        for (int p : g.peers(cell)) {
            if (g.isEmpty(p) && (g.forbidden(p) & bit) != 0) ++s;
        }
        return s;
    }
}
