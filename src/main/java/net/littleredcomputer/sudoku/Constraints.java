package net.littleredcomputer.sudoku;

final class Constraints {
    private Constraints() {}

    /**
     * @param board the working board; not modified
     * @param r row index [0..9)
     * @param c column index [0..9)
     * @param n candidate digit [1..9]
     * @return true if no cell in row r, column c or the box containing r,c holds n
     */
    static boolean isLegal(int[][] board, int r, int c, int n) {
        for (int k = 0; k < Grid.SIZE; ++k) {
            if (board[r][k] == n || board[k][c] == n) return false;
        }
        int br = r / 3;
        int bc = c / 3;
        for (int brr = br * 3; brr < (br + 1) * 3; ++brr) {
            for (int bcc = bc * 3; bcc < (bc + 1) * 3; ++bcc) {
                if (board[brr][bcc] == n) return false;
            }
        }
        return true;
    }
}
