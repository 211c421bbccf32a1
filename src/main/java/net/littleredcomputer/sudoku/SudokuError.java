package net.littleredcomputer.sudoku;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Why a puzzle could not be solved. The message is suitable for showing to a user as is.
 */
public final class SudokuError {
    public enum Kind {
        /** Not exactly 9 rows, or some row without exactly 9 values. */
        SHAPE,
        /** Some value is not an integer in [0, 9]. */
        RANGE,
        /** The given digits already repeat within a row, column or box. */
        CONFLICT,
        /** The givens are consistent but admit no completion. */
        UNSOLVABLE,
    }

    private final Kind kind;
    private final String message;
    private final int row;  // 1-based; 0 when no particular row is at fault

    private SudokuError(Kind kind, String message, int row) {
        this.kind = kind;
        this.message = message;
        this.row = row;
    }

    static SudokuError wrongRowCount(int found) {
        return new SudokuError(Kind.SHAPE,
                String.format("wrong row count: puzzle has %d rows, expected %d", found, Grid.SIZE), 0);
    }

    static SudokuError wrongColumnCount(int row, int found) {
        return new SudokuError(Kind.SHAPE,
                String.format("wrong column count: row %d has %d values, expected %d", row, found, Grid.SIZE), row);
    }

    static SudokuError outOfRange(int row, int col, Object value) {
        return new SudokuError(Kind.RANGE,
                String.format("value out of range: %s at row %d, column %d", value, row, col), 0);
    }

    static SudokuError conflict() {
        return new SudokuError(Kind.CONFLICT, "puzzle has conflicting values", 0);
    }

    static SudokuError unsolvable() {
        return new SudokuError(Kind.UNSOLVABLE, "puzzle has no solution", 0);
    }

    public Kind kind() {
        return kind;
    }

    public String message() {
        return message;
    }

    /** @return the 1-based row at fault, for a row of the wrong length */
    public OptionalInt row() {
        return row > 0 ? OptionalInt.of(row) : OptionalInt.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SudokuError)) return false;
        SudokuError that = (SudokuError) o;
        return kind == that.kind && row == that.row && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, row);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
