package net.littleredcomputer.sudoku;

import java.util.Objects;

/**
 * One line of a puzzle directory's manifest: the puzzle's display name and its file
 * name within the directory.
 */
public final class PuzzleEntry {
    private final String name;
    private final String file;

    public PuzzleEntry(String name, String file) {
        this.name = name;
        this.file = file;
    }

    public String getName() {
        return name;
    }

    public String getFile() {
        return file;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PuzzleEntry)) return false;
        PuzzleEntry that = (PuzzleEntry) o;
        return Objects.equals(name, that.name) && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, file);
    }

    @Override
    public String toString() {
        return name + " (" + file + ")";
    }
}
