package net.littleredcomputer.sudoku;

public final class LoadedPuzzle {
    private final PuzzleEntry entry;
    private final ParsedPuzzle puzzle;

    LoadedPuzzle(PuzzleEntry entry, ParsedPuzzle puzzle) {
        this.entry = entry;
        this.puzzle = puzzle;
    }

    public PuzzleEntry getEntry() {
        return entry;
    }

    public ParsedPuzzle getPuzzle() {
        return puzzle;
    }
}
