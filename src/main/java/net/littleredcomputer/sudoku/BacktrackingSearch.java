// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Depth-first search for a completion of a sudoku board. Empty cells are visited in
 * row-major order and the digits 1-9 are tried in ascending order, so the solution
 * found is the first one in that order. The board is filled in place.
 */
class BacktrackingSearch {
    private static final Logger log = LogManager.getFormatterLogger(BacktrackingSearch.class);
    private static final int logCheckSteps = 10000;

    private final int[][] board;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();
    private long stepCount = 0;
    private long lastStepCount = 0;

    /**
     * @param board working board, which the search owns and modifies. It must be free of
     *              conflicts among the digits already present.
     */
    BacktrackingSearch(int[][] board) {
        this.board = board;
    }

    BacktrackingSearch setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    /**
     * @return true if the board has been completed; false if no completion exists, in which
     * case the board is back in its original state
     */
    boolean run() {
        stopwatch.start();
        lastLogTime = Instant.now();
        try {
            return search(0);
        } finally {
            stopwatch.stop();
        }
    }

    /** @return the number of digits placed on the board so far, including those later undone */
    long steps() {
        return stepCount;
    }

    Duration elapsed() {
        return stopwatch.elapsed();
    }

    private boolean search(int p) {
        while (p < Grid.CELLS && board[p / Grid.SIZE][p % Grid.SIZE] != 0) ++p;
        if (p == Grid.CELLS) return true;
        final int r = p / Grid.SIZE;
        final int c = p % Grid.SIZE;
        for (int n = 1; n <= Grid.SIZE; ++n) {
            if (!Constraints.isLegal(board, r, c, n)) continue;
            board[r][c] = n;
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(r, c);
            if (search(p + 1)) return true;
            board[r][c] = 0;
        }
        return false;
    }

    private void maybeReportProgress(int r, int c) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        final long total = stepCount;
        final long millis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        log.info(() -> new FormattedMessage("%d steps %d ms %.0f/sec at %d,%d %s",
                total, millis, perSec, r + 1, c + 1, Grid.adopt(board)));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
