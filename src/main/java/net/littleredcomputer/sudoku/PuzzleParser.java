package net.littleredcomputer.sudoku;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads puzzles written one row per line, e.g.
 * <pre>
 * 0 0 3 0 1 0 0 0 0
 * 4 1 5 0 0 0 0 9 0
 * ...
 * </pre>
 * Every run of decimal digits on a line is one value, so separators are free-form.
 * Blank lines and lines without any digits are skipped. Problems with the shape are
 * collected as messages rather than thrown; the rows are kept regardless so that the
 * solver can report on them too.
 */
public final class PuzzleParser {
    private static final Splitter lineSplitter = Splitter.onPattern("\r?\n").trimResults().omitEmptyStrings();
    private static final Pattern numberRe = Pattern.compile("\\d+");

    private PuzzleParser() {}

    public static ParsedPuzzle parse(String text) {
        ImmutableList.Builder<List<Integer>> rows = ImmutableList.builder();
        ImmutableList.Builder<String> errors = ImmutableList.builder();
        int lineNumber = 0;
        int rowCount = 0;
        for (String line : lineSplitter.split(text)) {
            ++lineNumber;
            List<Integer> numbers = numbersIn(line);
            if (numbers.isEmpty()) continue;
            if (numbers.size() != Grid.SIZE) {
                errors.add(String.format("Row %d has %d values, expected %d.", lineNumber, numbers.size(), Grid.SIZE));
            }
            rows.add(numbers);
            ++rowCount;
        }
        if (rowCount != Grid.SIZE) {
            errors.add(String.format("Puzzle has %d rows, expected %d.", rowCount, Grid.SIZE));
        }
        return new ParsedPuzzle(rows.build(), errors.build());
    }

    private static List<Integer> numbersIn(String line) {
        ImmutableList.Builder<Integer> numbers = ImmutableList.builder();
        Matcher m = numberRe.matcher(line);
        while (m.find()) {
            // Too many digits for an int is still just out of range.
            Integer n = Ints.tryParse(m.group());
            numbers.add(n != null ? n : Integer.MAX_VALUE);
        }
        return numbers.build();
    }
}
