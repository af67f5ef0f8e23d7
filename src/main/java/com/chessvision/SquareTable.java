package com.chessvision;

/**
 * Maps the 1-64 tile index of the canonical image to board coordinates and back.
 * Tile 1 is the top-left tile and indices run left to right, then top to bottom.
 */
public final class SquareTable {

    private final BoardOrientation orientation;

    public SquareTable(BoardOrientation orientation) {
        if (orientation == null) {
            throw new IllegalArgumentException("orientation is required");
        }
        this.orientation = orientation;
    }

    public BoardOrientation getOrientation() {
        return orientation;
    }

    public BoardCoordinate coordinate(int squareIndex) {
        if (squareIndex < 1 || squareIndex > 64) {
            throw new IllegalArgumentException("Square index out of range: " + squareIndex);
        }
        int col = (squareIndex - 1) % 8;
        int row = (squareIndex - 1) / 8;
        if (orientation == BoardOrientation.WHITE_AT_BOTTOM) {
            return new BoardCoordinate(col, 7 - row);
        }
        return new BoardCoordinate(7 - col, row);
    }

    public int index(BoardCoordinate coordinate) {
        int row, col;
        if (orientation == BoardOrientation.WHITE_AT_BOTTOM) {
            row = 7 - coordinate.getRank();
            col = coordinate.getFile();
        } else {
            row = coordinate.getRank();
            col = 7 - coordinate.getFile();
        }
        return row * 8 + col + 1;
    }

    /** Column (0-7, left to right) of the tile holding {@code coordinate}. */
    public int column(BoardCoordinate coordinate) {
        return (index(coordinate) - 1) % 8;
    }

    /** Row (0-7, top to bottom) of the tile holding {@code coordinate}. */
    public int row(BoardCoordinate coordinate) {
        return (index(coordinate) - 1) / 8;
    }
}
