// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable 9x9 sudoku board. Cells hold the digits 1-9, or 0 for an empty cell.
 */
public final class Grid {
    public static final int SIZE = 9;
    static final int CELLS = SIZE * SIZE;

    private final int[][] board;

    private Grid(int[][] board) {
        this.board = board;
    }

    /**
     * Wraps a board the caller has finished with. No copy is made, so the array
     * must not be reachable from anywhere else.
     */
    static Grid adopt(int[][] board) {
        return new Grid(board);
    }

    /**
     * @param cells 9 rows of 9 digits each, 0 for an empty cell
     * @return a grid holding a copy of the cells
     * @throws IllegalArgumentException if the shape or any value is wrong
     */
    public static Grid of(int[][] cells) {
        checkNotNull(cells, "cells");
        checkArgument(cells.length == SIZE, "expected %s rows, found %s", SIZE, cells.length);
        int[][] copy = new int[SIZE][];
        for (int i = 0; i < SIZE; ++i) {
            checkArgument(cells[i] != null && cells[i].length == SIZE, "row %s must have %s values", i + 1, SIZE);
            for (int j = 0; j < SIZE; ++j) {
                int n = cells[i][j];
                checkArgument(n >= 0 && n <= SIZE, "value %s out of range at %s,%s", n, i + 1, j + 1);
            }
            copy[i] = cells[i].clone();
        }
        return new Grid(copy);
    }

    /**
     * Construct a grid from a board string. The string uses the digits 1-9 in
     * row by row, left to right order. A '.' indicates an empty cell. Other
     * characters are ignored. Knuth's example 28(a) would begin:
     * "..3 .1. ... 415" (etc.)
     *
     * @param boardString board representation with empty spaces recorded as '.'
     * @return the grid described
     * @throws IllegalArgumentException if the string does not describe exactly 81 cells
     */
    public static Grid fromBoardString(String boardString) {
        int[][] board = new int[SIZE][SIZE];
        int p = 0;
        for (int j = 0; j < boardString.length(); ++j) {
            char ch = boardString.charAt(j);
            if ((ch > '0' && ch <= '9') || ch == '.') {
                if (p >= CELLS) throw new IllegalArgumentException("board string has more than " + CELLS + " cells");
                if (ch != '.') board[p / SIZE][p % SIZE] = ch - '0';
                ++p;
            }
        }
        if (p != CELLS) throw new IllegalArgumentException("board string has " + p + " cells, expected " + CELLS);
        return new Grid(board);
    }

    public int get(int row, int col) {
        checkElementIndex(row, SIZE, "row");
        checkElementIndex(col, SIZE, "col");
        return board[row][col];
    }

    /** @return true if no cell is empty */
    public boolean isComplete() {
        for (int[] row : board) {
            for (int n : row) {
                if (n == 0) return false;
            }
        }
        return true;
    }

    public int filledCount() {
        int count = 0;
        for (int[] row : board) {
            for (int n : row) {
                if (n != 0) ++count;
            }
        }
        return count;
    }

    /** @return a fresh copy of the cells, which the caller may modify */
    public int[][] toArray() {
        int[][] copy = new int[SIZE][];
        for (int i = 0; i < SIZE; ++i) copy[i] = board[i].clone();
        return copy;
    }

    public List<List<Integer>> rows() {
        ImmutableList.Builder<List<Integer>> rows = ImmutableList.builder();
        for (int[] row : board) rows.add(ImmutableList.copyOf(Ints.asList(row)));
        return rows.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid)) return false;
        return Arrays.deepEquals(board, ((Grid) o).board);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(board);
    }

    /**
     * @return the cells in row-major order, in groups of three separated by spaces,
     * with '.' for an empty cell: "793 412 685 415 638 297 ..."
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < SIZE; ++i) {
            for (int j = 0; j < SIZE; ++j) {
                int n = board[i][j];
                sb.append(n == 0 ? '.' : (char) ('0' + n));
                if (j % 3 == 2) sb.append(' ');
            }
        }
        return sb.toString();
    }
}
