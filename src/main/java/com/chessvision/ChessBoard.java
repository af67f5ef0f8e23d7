package com.chessvision;

import javafx.geometry.Pos;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.StackPane;
import javafx.scene.paint.Color;
import javafx.scene.shape.Rectangle;

import java.util.Map;

/**
 * Board diagram of the tracked game, drawn from {@link ChessGameTracker#getBoardArray()}.
 */
public class ChessBoard {

    private static final double SQUARE_SIZE = 60;

    private static final Map<Integer, String> GLYPHS = Map.ofEntries(
            Map.entry(ChessGameTracker.W_KING, "♔"),
            Map.entry(ChessGameTracker.W_QUEEN, "♕"),
            Map.entry(ChessGameTracker.W_ROOK, "♖"),
            Map.entry(ChessGameTracker.W_BISHOP, "♗"),
            Map.entry(ChessGameTracker.W_KNIGHT, "♘"),
            Map.entry(ChessGameTracker.W_PAWN, "♙"),
            Map.entry(ChessGameTracker.B_KING, "♚"),
            Map.entry(ChessGameTracker.B_QUEEN, "♛"),
            Map.entry(ChessGameTracker.B_ROOK, "♜"),
            Map.entry(ChessGameTracker.B_BISHOP, "♝"),
            Map.entry(ChessGameTracker.B_KNIGHT, "♞"),
            Map.entry(ChessGameTracker.B_PAWN, "♟"));

    private final GridPane grid = new GridPane();
    private final StackPane[][] squares = new StackPane[8][8];
    private final Color lightSquareColor = Color.web("#F0D9B5");
    private final Color darkSquareColor = Color.web("#B58863");

    private BoardOrientation orientation = BoardOrientation.WHITE_AT_BOTTOM;
    private int[][] lastBoard;

    public ChessBoard() {
        grid.setAlignment(Pos.CENTER);
        for (int row = 0; row < 8; row++) {
            for (int col = 0; col < 8; col++) {
                StackPane square = new StackPane();
                Rectangle bg = new Rectangle(SQUARE_SIZE, SQUARE_SIZE);
                bg.setFill((row + col) % 2 == 0 ? lightSquareColor : darkSquareColor);
                square.getChildren().add(bg);
                squares[row][col] = square;
                grid.add(square, col, row);
            }
        }
    }

    public Node getBoardUI() {
        return grid;
    }

    public BoardOrientation getOrientation() {
        return orientation;
    }

    public void setOrientation(BoardOrientation orientation) {
        this.orientation = orientation;
        if (lastBoard != null) {
            updateBoard(lastBoard);
        }
    }

    /**
     * Redraws pieces from a {@code [rank][file]} array, rank 0 being rank 1.
     */
    public void updateBoard(int[][] board) {
        this.lastBoard = board;
        SquareTable table = new SquareTable(orientation);
        for (int rank = 0; rank < 8; rank++) {
            for (int file = 0; file < 8; file++) {
                BoardCoordinate coord = new BoardCoordinate(file, rank);
                int row = table.row(coord);
                int col = table.column(coord);
                StackPane square = squares[row][col];

                // keep the background rectangle
                square.getChildren().remove(1, square.getChildren().size());

                String glyph = GLYPHS.get(board[rank][file]);
                if (glyph != null) {
                    Label piece = new Label(glyph);
                    piece.setStyle("-fx-font-size: 40px; -fx-text-fill: black;");
                    square.getChildren().add(piece);
                }
                addCoordinates(square, coord, row, col);
            }
        }
    }

    private void addCoordinates(StackPane square, BoardCoordinate coord, int row, int col) {
        String style = "-fx-text-fill: " + ((row + col) % 2 == 0 ? "#B58863" : "#F0D9B5")
                + "; -fx-font-size: 10px; -fx-padding: 2px;";
        if (row == 7) {
            Label file = new Label(String.valueOf((char) ('a' + coord.getFile())));
            StackPane.setAlignment(file, Pos.BOTTOM_RIGHT);
            file.setStyle(style);
            square.getChildren().add(file);
        }
        if (col == 0) {
            Label rank = new Label(String.valueOf(coord.getRank() + 1));
            StackPane.setAlignment(rank, Pos.TOP_LEFT);
            rank.setStyle(style);
            square.getChildren().add(rank);
        }
    }
}
