package net.littleredcomputer.sudoku;

public class SudokuException extends RuntimeException {
    private final SudokuError error;

    SudokuException(SudokuError error) {
        super(error.message());
        this.error = error;
    }

    public SudokuError getError() {
        return error;
    }
}
