package net.littleredcomputer.sudoku;

import com.google.common.reflect.TypeToken;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A directory of puzzle files ({@code *.txt}), indexed by a manifest file
 * {@value #INDEX_FILE} listing them in display order.
 */
public class PuzzleCatalog {
    public static final String INDEX_FILE = "index.json";
    private static final String PUZZLE_SUFFIX = ".txt";
    private static final Logger log = LogManager.getFormatterLogger(PuzzleCatalog.class);
    private static final Type ENTRIES_TYPE = new TypeToken<List<PuzzleEntry>>(){}.getType();
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private static final Pattern leadingIntegerRe = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final Collator nameCollator = Collator.getInstance(Locale.ROOT);

    /**
     * Puzzles whose names both start with a number are ordered by that number ("2" before
     * "10"); any other pair is ordered by name, alphabetically first ("a" before "B").
     */
    static final Comparator<PuzzleEntry> DISPLAY_ORDER = (a, b) -> {
        Optional<BigInteger> an = leadingInteger(a.getName());
        Optional<BigInteger> bn = leadingInteger(b.getName());
        if (an.isPresent() && bn.isPresent()) return an.get().compareTo(bn.get());
        int c = nameCollator.compare(a.getName(), b.getName());
        return c != 0 ? c : a.getName().compareTo(b.getName());
    };

    private final Path directory;

    public PuzzleCatalog(Path directory) {
        this.directory = checkNotNull(directory, "directory");
    }

    public Path indexPath() {
        return directory.resolve(INDEX_FILE);
    }

    /** @return entries for the puzzle files now present in the directory, in display order */
    public List<PuzzleEntry> scan() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(f -> f.getFileName().toString())
                    .filter(f -> f.endsWith(PUZZLE_SUFFIX))
                    .map(f -> new PuzzleEntry(f.substring(0, f.length() - PUZZLE_SUFFIX.length()), f))
                    .sorted(DISPLAY_ORDER)
                    .collect(Collectors.toList());
        }
    }

    /**
     * Replaces the manifest with one describing the puzzle files now present.
     * @return the entries written
     */
    public List<PuzzleEntry> writeIndex() throws IOException {
        List<PuzzleEntry> entries = scan();
        Path index = indexPath();
        Files.write(index, (gson.toJson(entries, ENTRIES_TYPE) + "\n").getBytes(StandardCharsets.UTF_8));
        log.info("Wrote %d puzzle entries to %s", entries.size(), index);
        return entries;
    }

    public List<PuzzleEntry> readIndex() throws IOException {
        Path index = indexPath();
        try (Reader r = Files.newBufferedReader(index, StandardCharsets.UTF_8)) {
            List<PuzzleEntry> entries = gson.fromJson(r, ENTRIES_TYPE);
            if (entries == null) throw new IOException("empty manifest: " + index);
            for (PuzzleEntry e : entries) {
                if (e == null || e.getName() == null || e.getFile() == null) {
                    throw new IOException("malformed entry in " + index + ": " + e);
                }
            }
            return entries;
        } catch (JsonParseException e) {
            throw new IOException("malformed manifest: " + index, e);
        }
    }

    /** @return every puzzle named in the manifest, parsed, in manifest order */
    public List<LoadedPuzzle> loadAll() throws IOException {
        List<LoadedPuzzle> puzzles = new ArrayList<>();
        for (PuzzleEntry e : readIndex()) {
            puzzles.add(load(e));
        }
        log.debug("loaded %d puzzles from %s", puzzles.size(), directory);
        return puzzles;
    }

    public LoadedPuzzle load(PuzzleEntry entry) throws IOException {
        String text = new String(Files.readAllBytes(directory.resolve(entry.getFile())), StandardCharsets.UTF_8);
        return new LoadedPuzzle(entry, PuzzleParser.parse(text));
    }

    private static Optional<BigInteger> leadingInteger(String name) {
        Matcher m = leadingIntegerRe.matcher(name);
        return m.find() ? Optional.of(new BigInteger(m.group(1))) : Optional.empty();
    }
}
