// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Solves 9x9 sudoku puzzles by validating the givens and then running a plain
 * backtracking search. When a puzzle has more than one solution, the first one in
 * row-major, ascending-digit order is returned; uniqueness is not checked.
 * <p>
 * Instances hold no per-puzzle state and may be shared between threads. The argument
 * to {@code solve} is never modified.
 */
public class SudokuSolver {
    private static final Logger log = LogManager.getFormatterLogger(SudokuSolver.class);
    private final Duration logInterval;

    public SudokuSolver() {
        this(Duration.ofMillis(1000));
    }

    /** @param logInterval minimum time between progress reports from a long search */
    public SudokuSolver(Duration logInterval) {
        this.logInterval = checkNotNull(logInterval, "logInterval");
    }

    /**
     * @param rows 9 rows of 9 integers each, 0 for an empty cell
     * @return the solved grid, or the reason there is none
     */
    public SolveOutcome solve(List<? extends List<? extends Number>> rows) {
        Optional<SudokuError> invalid = Validator.validate(rows);
        if (invalid.isPresent()) {
            log.debug("rejected puzzle: %s", invalid.get());
            return SolveOutcome.failed(invalid.get());
        }
        int[][] board = Validator.copyOf(rows);
        BacktrackingSearch search = new BacktrackingSearch(board).setLogInterval(logInterval);
        boolean solved = search.run();
        log.debug("%s after %d steps in %s", solved ? "solved" : "exhausted", search.steps(), search.elapsed());
        return solved
                ? SolveOutcome.solved(Grid.adopt(board))
                : SolveOutcome.failed(SudokuError.unsolvable());
    }

    /**
     * @param cells 9 rows of 9 integers each, 0 for an empty cell. Rows may be null or
     *              of the wrong length; these are reported as errors.
     */
    public SolveOutcome solve(int[][] cells) {
        return solve(Validator.asRows(cells));
    }

    public SolveOutcome solve(Grid grid) {
        return solve(checkNotNull(grid, "grid").rows());
    }
}
