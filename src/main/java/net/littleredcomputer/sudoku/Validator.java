// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.primitives.Ints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Rejects malformed puzzles before any search is attempted. The checks run in order
 * (row count, row lengths, value range, conflicts among the givens) and stop at the
 * first failure.
 */
final class Validator {
    private static final Logger log = LogManager.getFormatterLogger(Validator.class);

    private Validator() {}

    /**
     * @param rows the puzzle; not modified
     * @return the first problem found, or empty if the puzzle may be searched
     */
    static Optional<SudokuError> validate(List<? extends List<? extends Number>> rows) {
        checkNotNull(rows, "rows");
        if (rows.size() != Grid.SIZE) return Optional.of(SudokuError.wrongRowCount(rows.size()));
        for (int i = 0; i < Grid.SIZE; ++i) {
            List<? extends Number> row = rows.get(i);
            int found = row == null ? 0 : row.size();
            if (found != Grid.SIZE) return Optional.of(SudokuError.wrongColumnCount(i + 1, found));
        }
        for (int i = 0; i < Grid.SIZE; ++i) {
            List<? extends Number> row = rows.get(i);
            for (int j = 0; j < Grid.SIZE; ++j) {
                Number value = row.get(j);
                if (!digitOf(value).isPresent()) return Optional.of(SudokuError.outOfRange(i + 1, j + 1, value));
            }
        }
        if (hasConflict(copyOf(rows))) return Optional.of(SudokuError.conflict());
        return Optional.empty();
    }

    /**
     * Checks each given digit against the rest of the board by clearing its cell, asking
     * whether the digit could be placed there, and putting it back. The board is left
     * as it was found.
     *
     * @param board a 9x9 board of digits 0-9
     * @return true if some digit repeats within a row, column or box
     */
    static boolean hasConflict(int[][] board) {
        for (int r = 0; r < Grid.SIZE; ++r) {
            for (int c = 0; c < Grid.SIZE; ++c) {
                int n = board[r][c];
                if (n == 0) continue;
                board[r][c] = 0;
                boolean legal = Constraints.isLegal(board, r, c, n);
                board[r][c] = n;
                if (!legal) {
                    log.debug("given %d at %d,%d conflicts with another given", n, r + 1, c + 1);
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @param rows a puzzle that has passed {@link #validate}
     * @return a new board holding the same digits
     */
    static int[][] copyOf(List<? extends List<? extends Number>> rows) {
        int[][] board = new int[Grid.SIZE][Grid.SIZE];
        for (int i = 0; i < Grid.SIZE; ++i) {
            for (int j = 0; j < Grid.SIZE; ++j) {
                board[i][j] = digitOf(rows.get(i).get(j)).getAsInt();
            }
        }
        return board;
    }

    /** Views an array board as rows, without copying. Null rows stay null. */
    static List<List<Integer>> asRows(int[][] cells) {
        checkNotNull(cells, "cells");
        List<List<Integer>> rows = new ArrayList<>(cells.length);
        for (int[] row : cells) rows.add(row == null ? null : Ints.asList(row));
        return rows;
    }

    /** @return the digit the value represents exactly, or empty if it is not an integer in [0, 9] */
    private static OptionalInt digitOf(Number value) {
        if (value == null) return OptionalInt.empty();
        if (value instanceof BigDecimal) {
            BigDecimal d = ((BigDecimal) value).stripTrailingZeros();
            if (d.scale() > 0) return OptionalInt.empty();
            return digitOf(d.toBigInteger());
        }
        if (value instanceof BigInteger) {
            BigInteger b = (BigInteger) value;
            if (b.signum() < 0 || b.compareTo(BigInteger.valueOf(Grid.SIZE)) > 0) return OptionalInt.empty();
            return OptionalInt.of(b.intValue());
        }
        double d = value.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) return OptionalInt.empty();
        if (d < 0 || d > Grid.SIZE) return OptionalInt.empty();
        // Integral types wider than a double's mantissa must agree with their double view.
        if (value.longValue() != (long) d) return OptionalInt.empty();
        return OptionalInt.of((int) d);
    }
}
