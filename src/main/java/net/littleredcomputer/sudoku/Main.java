package net.littleredcomputer.sudoku;

import com.google.common.base.Joiner;
import com.google.common.io.CharStreams;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public class Main {
    private static Joiner spaceJoiner = Joiner.on(' ');

    private static Options options() {
        return new Options()
                .addOption("task", true, "what to do: solve, index or solveall")
                .addOption("board", true, "sudoku board [1-9.]{81}")
                .addOption("problem", true, "filename of puzzle text, one row per line, or - for stdin")
                .addOption("dir", true, "directory of puzzle files")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -board or -problem");
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(new InputStreamReader(
                p.equals("-") ? System.in : new FileInputStream(p), StandardCharsets.UTF_8));
    }

    private static PuzzleCatalog catalog(CommandLine cmd) {
        if (!cmd.hasOption("dir")) throw new IllegalArgumentException("Must specify -dir");
        return new PuzzleCatalog(Paths.get(cmd.getOptionValue("dir")));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    static String describe(SolveOutcome outcome) {
        return outcome.solution()
                .map(Grid::toString)
                .orElseGet(() -> outcome.error().map(SudokuError::message).orElse(""));
    }

    static void run(String[] args, PrintStream out) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        SudokuSolver solver = new SudokuSolver(logInterval(cmd));
        switch (task) {
            case "solve": {
                if (cmd.hasOption("board")) {
                    out.println(describe(solver.solve(Grid.fromBoardString(cmd.getOptionValue("board")))));
                    break;
                }
                ParsedPuzzle puzzle;
                try (Reader r = problem(cmd)) {
                    puzzle = PuzzleParser.parse(CharStreams.toString(r));
                }
                if (!puzzle.isWellFormed()) out.println(spaceJoiner.join(puzzle.errors()));
                out.println(describe(solver.solve(puzzle.rows())));
                break;
            }
            case "index": {
                PuzzleCatalog c = catalog(cmd);
                out.println(c.writeIndex().size() + " puzzles in " + c.indexPath());
                break;
            }
            case "solveall": {
                PuzzleCatalog c = catalog(cmd);
                Path index = c.indexPath();
                if (!Files.exists(index)) c.writeIndex();
                for (LoadedPuzzle p : c.loadAll()) {
                    out.println(p.getEntry().getName() + ": " + describe(solver.solve(p.getPuzzle().rows())));
                }
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }

    public static void main(String[] args) throws ParseException, IOException {
        run(args, System.out);
    }
}
