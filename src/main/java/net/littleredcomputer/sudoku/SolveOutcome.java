package net.littleredcomputer.sudoku;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The result of one call to {@link SudokuSolver#solve}: either a completed grid or an error, never both.
 */
public final class SolveOutcome {
    private final Grid solution;
    private final SudokuError error;

    private SolveOutcome(Grid solution, SudokuError error) {
        this.solution = solution;
        this.error = error;
    }

    static SolveOutcome solved(Grid solution) {
        return new SolveOutcome(checkNotNull(solution), null);
    }

    static SolveOutcome failed(SudokuError error) {
        return new SolveOutcome(null, checkNotNull(error));
    }

    public boolean isSolved() {
        return solution != null;
    }

    public Optional<Grid> solution() {
        return Optional.ofNullable(solution);
    }

    public Optional<SudokuError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * @return the solution
     * @throws SudokuException carrying the error, if there is no solution
     */
    public Grid orElseThrow() {
        if (solution == null) throw new SudokuException(error);
        return solution;
    }

    @Override
    public String toString() {
        return solution != null ? solution.toString() : error.toString();
    }
}
