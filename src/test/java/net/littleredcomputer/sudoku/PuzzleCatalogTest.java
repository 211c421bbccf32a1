// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class PuzzleCatalogTest {
    private static final String SOLVABLE = "0 0 3 0 1 0 0 0 0\n4 1 5 0 0 0 0 9 0\n2 0 6 5 0 0 3 0 0\n" +
            "5 0 0 0 8 0 0 0 9\n0 7 0 9 0 0 0 3 2\n0 3 8 0 0 4 0 6 0\n" +
            "0 0 0 2 6 0 4 0 3\n0 0 0 3 0 0 0 0 8\n3 2 0 0 0 7 9 5 0\n";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();
    private Path dir;
    private PuzzleCatalog catalog;

    private void write(String name, String contents) throws IOException {
        Files.write(dir.resolve(name), contents.getBytes(StandardCharsets.UTF_8));
    }

    private static List<String> names(List<PuzzleEntry> entries) {
        return entries.stream().map(PuzzleEntry::getName).collect(Collectors.toList());
    }

    @Before
    public void setUp() throws IOException {
        dir = folder.newFolder("sudokus").toPath();
        catalog = new PuzzleCatalog(dir);
    }

    @Test
    public void numberedPuzzlesSortNumerically() throws IOException {
        for (String n : ImmutableList.of("10", "2", "1", "b", "a", "3-hard")) write(n + ".txt", SOLVABLE);
        write("notes.md", "not a puzzle");
        Files.createDirectory(dir.resolve("old.txt"));
        assertThat(names(catalog.scan()), is(ImmutableList.of("1", "2", "3-hard", "10", "a", "b")));
    }

    @Test
    public void namesSortAlphabeticallyBeforeByCase() {
        List<PuzzleEntry> entries = new ArrayList<>();
        for (String n : ImmutableList.of("b", "B", "a", "A")) entries.add(new PuzzleEntry(n, n + ".txt"));
        entries.sort(PuzzleCatalog.DISPLAY_ORDER);
        assertThat(names(entries), is(ImmutableList.of("a", "A", "b", "B")));
    }

    @Test
    public void indexFormat() throws IOException {
        write("2.txt", SOLVABLE);
        write("1.txt", SOLVABLE);
        List<PuzzleEntry> written = catalog.writeIndex();
        assertThat(written, is(ImmutableList.of(new PuzzleEntry("1", "1.txt"), new PuzzleEntry("2", "2.txt"))));
        String json = new String(Files.readAllBytes(dir.resolve(PuzzleCatalog.INDEX_FILE)), StandardCharsets.UTF_8);
        assertThat(json, is("[\n" +
                "  {\n" +
                "    \"name\": \"1\",\n" +
                "    \"file\": \"1.txt\"\n" +
                "  },\n" +
                "  {\n" +
                "    \"name\": \"2\",\n" +
                "    \"file\": \"2.txt\"\n" +
                "  }\n" +
                "]\n"));
        assertThat(catalog.readIndex(), is(written));
    }

    @Test
    public void emptyDirectory() throws IOException {
        assertThat(catalog.writeIndex().isEmpty(), is(true));
        assertThat(catalog.readIndex().isEmpty(), is(true));
    }

    @Test
    public void loadAllFollowsTheManifest() throws IOException {
        write("1.txt", SOLVABLE);
        write("2.txt", "1 2 3\n");
        catalog.writeIndex();
        List<LoadedPuzzle> loaded = catalog.loadAll();
        assertThat(loaded.size(), is(2));
        assertThat(loaded.get(0).getEntry().getName(), is("1"));
        assertThat(loaded.get(0).getPuzzle().isWellFormed(), is(true));
        assertThat(loaded.get(1).getPuzzle().errors(), is(ImmutableList.of(
                "Row 1 has 3 values, expected 9.",
                "Puzzle has 1 rows, expected 9.")));
    }

    @Test(expected = IOException.class)
    public void missingManifest() throws IOException {
        catalog.readIndex();
    }

    @Test(expected = IOException.class)
    public void malformedManifest() throws IOException {
        write(PuzzleCatalog.INDEX_FILE, "{ not json");
        catalog.readIndex();
    }

    @Test(expected = IOException.class)
    public void manifestNamesMissingFile() throws IOException {
        write(PuzzleCatalog.INDEX_FILE, "[{\"name\": \"gone\", \"file\": \"gone.txt\"}]");
        catalog.loadAll();
    }
}
