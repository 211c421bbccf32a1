package net.littleredcomputer.sudoku;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class ParsedPuzzle {
    private final ImmutableList<List<Integer>> rows;
    private final ImmutableList<String> errors;

    ParsedPuzzle(ImmutableList<List<Integer>> rows, ImmutableList<String> errors) {
        this.rows = rows;
        this.errors = errors;
    }

    public List<List<Integer>> rows() {
        return rows;
    }

    public List<String> errors() {
        return errors;
    }

    public boolean isWellFormed() {
        return errors.isEmpty();
    }
}
