package com.chessvision;

/**
 * A square in chess terms: file 0-7 (a-h) and rank 0-7 (1-8).
 */
public final class BoardCoordinate {

    private final int file;
    private final int rank;

    public BoardCoordinate(int file, int rank) {
        if (file < 0 || file > 7 || rank < 0 || rank > 7) {
            throw new IllegalArgumentException("Coordinate off the board: file=" + file + ", rank=" + rank);
        }
        this.file = file;
        this.rank = rank;
    }

    // Handles Uppercase (F4) and lowercase (f4)
    public static BoardCoordinate parse(String square) {
        if (square == null || square.length() != 2) {
            throw new IllegalArgumentException("Not a square: " + square);
        }
        String lower = square.toLowerCase();
        int file = lower.charAt(0) - 'a';
        int rank = lower.charAt(1) - '1';
        return new BoardCoordinate(file, rank);
    }

    public int getFile() {
        return file;
    }

    public int getRank() {
        return rank;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoardCoordinate)) return false;
        BoardCoordinate that = (BoardCoordinate) o;
        return file == that.file && rank == that.rank;
    }

    @Override
    public int hashCode() {
        return rank * 8 + file;
    }

    @Override
    public String toString() {
        return "" + (char) ('a' + file) + (char) ('1' + rank);
    }
}
