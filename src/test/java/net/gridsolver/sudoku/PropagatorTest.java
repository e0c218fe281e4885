// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import org.junit.Test;

import static net.gridsolver.sudoku.TestPuzzles.FIXTURE;
import static net.gridsolver.sudoku.TestPuzzles.FIXTURE_SOLUTION;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class PropagatorTest {

    @Test
    public void nakedSinglesSolveTheFixture() {
        GridState g = new GridState(new Sudoku(FIXTURE));
        Propagator p = new Propagator();
        assertThat(p.propagate(g, new Trail()), is(true));
        assertThat(g.isSolved(), is(true));
        assertThat(g.toGrid(), is(FIXTURE_SOLUTION));
        assertThat(p.forcedCount(), is(43L));
    }

    @Test
    public void propagationIsUndoable() {
        GridState g = new GridState(new Sudoku(FIXTURE));
        Trail trail = new Trail();
        new Propagator().propagate(g, trail);
        trail.undoTo(0, g);
        assertThat(g.toGrid(), is(FIXTURE));
    }

    @Test
    public void nothingForcedOnEmptyBoard() {
        GridState g = new GridState(new Sudoku(TestPuzzles.empty(9)));
        Trail trail = new Trail();
        assertThat(new Propagator().propagate(g, trail), is(true));
        assertThat(trail.size(), is(0));
        assertThat(g.isSolved(), is(false));
    }

    @Test
    public void missingCellIsFilled() {
        int[][] grid = Sudoku.copyOf(FIXTURE_SOLUTION);
        for (int c = 0; c < 9; ++c) grid[3][c] = 0;
        GridState g = new GridState(new Sudoku(grid));
        assertThat(new Propagator().propagate(g, new Trail()), is(true));
        assertThat(g.toGrid(), is(FIXTURE_SOLUTION));
    }

    @Test
    public void cellWithoutCandidatesFailsInitialScan() {
        GridState g = new GridState(new Sudoku(TestPuzzles.deadCell()));
        Trail trail = new Trail();
        assertThat(new Propagator().propagate(g, trail), is(false));
        assertThat(trail.size(), is(0));
    }

    @Test
    public void competingSinglesFail() {
        GridState g = new GridState(new Sudoku(TestPuzzles.twoCellsNeedNine()));
        assertThat(g.candidates(7), is(1 << 8));
        assertThat(g.candidates(8), is(1 << 8));
        assertThat(new Propagator().propagate(g, new Trail()), is(false));
    }
}
