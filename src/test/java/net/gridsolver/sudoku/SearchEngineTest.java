// Copyright 2018 Colin Smith. MIT License.
package net.gridsolver.sudoku;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static net.gridsolver.sudoku.TestPuzzles.FIXTURE;
import static net.gridsolver.sudoku.TestPuzzles.FIXTURE_SOLUTION;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.isIn;
import static org.junit.Assert.assertThat;

public class SearchEngineTest {

    private static Optional<String> solutionOf(BoxShape shape, String board) {
        return new SearchEngine(Sudoku.fromBoardString(shape, board)).solve()
                .map(g -> Sudoku.toBoardString(shape, g));
    }

    private static Optional<String> solutionOf(String board) {
        return solutionOf(BoxShape.STANDARD, board);
    }

    private static void assertSolves(Sudoku s) {
        Optional<int[][]> solution = new SearchEngine(s).solve();
        assertThat(solution, isPresent());
        int[][] g = solution.get();
        assertThat(Sudoku.isValidSolution(s.shape(), g), is(true));
        for (int r = 0; r < s.size(); ++r) {
            for (int c = 0; c < s.size(); ++c) {
                if (s.given(r, c) != 0) assertThat(g[r][c], is(s.given(r, c)));
            }
        }
        assertThat(s.check(), is(true));
    }

    @Test
    public void fixture() {
        Sudoku s = new Sudoku(FIXTURE);
        assertThat(new SearchEngine(s).solve().get(), is(FIXTURE_SOLUTION));
        assertThat(s.getSolution().get(), is(FIXTURE_SOLUTION));
        assertThat(s.check(), is(true));
    }

    @Test
    public void ex28aSolution() {
        String ex28a = "..3 .1. ... " +
                "415 ... .9. " +
                "2.6 5.. 3.. " +
                "5.. .8. ..9 " +
                ".7. 9.. .32 " +
                ".38 ..4 .6. " +
                "... 26. 4.3 " +
                "... 3.. ..8 " +
                "32. ..7 95. ";
        assertThat(solutionOf(ex28a), isPresentAndIs(
                "793 412 685 415 638 297 286 579 314 562 183 749 174 956 832 938 724 561 859 261 473 647 395 128 321 847 956"));
    }

    @Test
    public void ex28bSolution() {
        String ex28b = "... ... 3.." +
                "1.. 4.. ... " +
                "... ... 1.5 " +
                "9.. ... ... " +
                "... ..2 6.. " +
                "... .53 ... " +
                ".5. 8.. ... " +
                "... 9.. .7. " +
                ".83 ... .4. ";
        assertThat(solutionOf(ex28b), isPresentAndIs(
                "597 218 364 132 465 897 864 379 125 915 684 732 348 792 651 276 153 489 659 847 213 421 936 578 783 521 946"));
    }

    @Test
    public void ex28cHasTwoSolutionsAndOneIsFound() {
        String ex28c = ".3. .1. ... " +
                "... 4.. 1.." +
                ".5. ... .9." +
                "2.. ... 6.4" +
                "... .35 ..." +
                "1.. ... ..." +
                "4.. 6.. ..." +
                "... ... .5." +
                ".9. ... ...";
        assertThat(solutionOf(ex28c).get(), isIn(ImmutableList.of(
                "934 518 267 762 493 185 851 762 493 285 971 634 649 235 718 173 846 529 418 659 372 327 184 956 596 327 841",
                "934 517 268 862 493 175 751 862 493 275 981 634 649 235 817 183 746 529 417 659 382 328 174 956 596 328 741")));
    }

    @Test
    public void supposedlyHardOnes() {
        String h = "..4 8.. ..7 .5. .1. .9. 1.. ..9 6.. 3.. ..4 5.. .4. .8. .3. ..8 2.. ..9 ..6 1.. ..4 .2. .3. .6. 5.. ..6 2..";
        assertThat(solutionOf(h), isPresentAndIs(
                "694 825 317 853 617 492 172 349 685 319 764 528 245 981 736 768 253 149 936 172 854 427 538 961 581 496 273"));
        assertThat(solutionOf(TestPuzzles.HARDEST), isPresentAndIs(TestPuzzles.HARDEST_SOLUTION));
    }

    @Test
    public void emptyBoards() {
        assertSolves(new Sudoku(TestPuzzles.empty(9)));
        assertSolves(new Sudoku(BoxShape.of(2, 3), TestPuzzles.empty(6)));
        assertSolves(new Sudoku(BoxShape.of(3, 2), TestPuzzles.empty(6)));
        assertSolves(new Sudoku(BoxShape.of(2, 2), TestPuzzles.empty(4)));
        assertSolves(new Sudoku(BoxShape.of(4, 4), TestPuzzles.empty(16)));
    }

    @Test
    public void sixBySix() {
        assertThat(solutionOf(BoxShape.of(2, 3), TestPuzzles.SIX), isPresentAndIs(TestPuzzles.SIX_SOLUTION));
        assertSolves(Sudoku.fromBoardString(BoxShape.of(2, 3), TestPuzzles.SIX));
    }

    @Test
    public void deterministic() {
        int[][] first = new SearchEngine(new Sudoku(TestPuzzles.empty(9))).solve().get();
        int[][] second = new SearchEngine(new Sudoku(TestPuzzles.empty(9))).solve().get();
        assertThat(second, is(first));
        SearchEngine engine = new SearchEngine(Sudoku.fromBoardString(TestPuzzles.HARDEST));
        String once = Sudoku.toBoardString(BoxShape.STANDARD, engine.solve().get());
        long steps = engine.stepCount();
        String twice = Sudoku.toBoardString(BoxShape.STANDARD, engine.solve().get());
        assertThat(twice, is(once));
        assertThat(engine.stepCount(), is(steps));
    }

    @Test
    public void exhaustsSearchWhenNoSolutionExists() {
        SearchEngine engine = new SearchEngine(Sudoku.fromBoardString(TestPuzzles.HARDEST_BROKEN));
        assertThat(engine.solve(), isEmpty());
        assertThat(engine.backtracks(), greaterThan(1L));
    }

    @Test
    public void contradictionBeforeAnyBranch() {
        Sudoku s = new Sudoku(TestPuzzles.twoCellsNeedNine());
        SearchEngine engine = new SearchEngine(s);
        assertThat(engine.solve(), isEmpty());
        assertThat(engine.branches(), is(0L));
        assertThat(s.getSolution(), isEmpty());
        assertThat(new SearchEngine(new Sudoku(TestPuzzles.deadCell())).solve(), isEmpty());
    }

    @Test(expected = InvalidPuzzleException.class)
    public void repeatedGivenIsNeverSolved() {
        int[][] grid = TestPuzzles.empty(9);
        grid[0][0] = 5;
        grid[0][1] = 5;
        new SearchEngine(new Sudoku(grid)).solve();
    }

    @Test
    public void countersStartOverOnEachSolve() {
        SearchEngine engine = new SearchEngine(new Sudoku(FIXTURE));
        assertThat(engine.solve(), isPresent());
        assertThat(engine.forcedMoves(), is(43L));
        assertThat(engine.solve(), isPresent());
        assertThat(engine.forcedMoves(), is(43L));
        assertThat(engine.branches(), is(0L));
        assertThat(engine.backtracks(), is(0L));
    }
}
