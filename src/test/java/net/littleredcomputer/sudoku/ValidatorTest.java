package net.littleredcomputer.sudoku;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ValidatorTest {
    private static final String ex28a = "..3 .1. ... 415 ... .9. 2.6 5.. 3.. 5.. .8. ..9 .7. 9.. .32 " +
            ".38 ..4 .6. ... 26. 4.3 ... 3.. ..8 32. ..7 95.";

    private static int[][] board(String s) {
        return Grid.fromBoardString(s).toArray();
    }

    private static int[][] copy(int[][] b) {
        return Arrays.stream(b).map(int[]::clone).toArray(int[][]::new);
    }

    private static Optional<SudokuError.Kind> kindOf(int[][] cells) {
        return Validator.validate(Validator.asRows(cells)).map(SudokuError::kind);
    }

    @Test
    public void consistentPuzzleIsAccepted() {
        assertThat(Validator.validate(Validator.asRows(board(ex28a))), isEmpty());
    }

    @Test
    public void repeatedDigitInColumn() {
        int[][] b = new int[9][9];
        b[0][4] = 7;
        b[8][4] = 7;
        assertThat(kindOf(b), isPresentAndIs(SudokuError.Kind.CONFLICT));
    }

    @Test
    public void repeatedDigitInBoxOnly() {
        int[][] b = new int[9][9];
        b[3][3] = 2;
        b[5][5] = 2;
        assertThat(kindOf(b), isPresentAndIs(SudokuError.Kind.CONFLICT));
    }

    @Test
    public void sameDigitInDifferentUnitsIsFine() {
        int[][] b = new int[9][9];
        b[0][0] = 2;
        b[1][3] = 2;
        b[2][6] = 2;
        assertThat(kindOf(b), isEmpty());
    }

    @Test
    public void conflictCheckLeavesBoardUntouched() {
        int[][] consistent = board(ex28a);
        int[][] before = copy(consistent);
        assertThat(Validator.hasConflict(consistent), is(false));
        assertThat(Arrays.deepEquals(consistent, before), is(true));

        int[][] conflicted = board(ex28a);
        conflicted[8][8] = 9;  // row 8 already has a 9
        int[][] conflictedBefore = copy(conflicted);
        assertThat(Validator.hasConflict(conflicted), is(true));
        assertThat(Arrays.deepEquals(conflicted, conflictedBefore), is(true));
    }

    @Test
    public void validatingTwiceGivesTheSameVerdict() {
        int[][] good = board(ex28a);
        int[][] bad = board(ex28a);
        bad[0][0] = 3;
        for (int[][] b : Arrays.asList(good, bad)) {
            int[][] before = copy(b);
            List<List<Integer>> rows = Validator.asRows(b);
            Optional<SudokuError> first = Validator.validate(rows);
            Optional<SudokuError> second = Validator.validate(rows);
            assertThat(second, is(first));
            assertThat(Arrays.deepEquals(b, before), is(true));
        }
    }

    @Test
    public void rangeIsCheckedBeforeConflicts() {
        int[][] b = new int[9][9];
        b[0][0] = 5;
        b[0][1] = 5;
        b[8][8] = 10;
        assertThat(kindOf(b), isPresentAndIs(SudokuError.Kind.RANGE));
    }

    @Test
    public void firstShortRowIsReported() {
        int[][] b = new int[9][9];
        b[4] = new int[10];
        b[6] = new int[3];
        SudokuError e = Validator.validate(Validator.asRows(b)).get();
        assertThat(e.row().getAsInt(), is(5));
        assertThat(e.message(), is("wrong column count: row 5 has 10 values, expected 9"));
    }

    @Test
    public void tenRows() {
        int[][] b = new int[10][9];
        SudokuError e = Validator.validate(Validator.asRows(b)).get();
        assertThat(e.kind(), is(SudokuError.Kind.SHAPE));
        assertThat(e.message(), is("wrong row count: puzzle has 10 rows, expected 9"));
        assertThat(e.row().isPresent(), is(false));
    }

    @Test
    public void outOfRangeNamesTheCell() {
        int[][] b = new int[9][9];
        b[2][6] = -1;
        SudokuError e = Validator.validate(Validator.asRows(b)).get();
        assertThat(e.message(), is("value out of range: -1 at row 3, column 7"));
    }
}
