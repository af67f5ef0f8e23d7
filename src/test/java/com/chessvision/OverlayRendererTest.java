package com.chessvision;

import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;

import static org.junit.jupiter.api.Assertions.*;

class OverlayRendererTest {

    @Test
    void squareCentersFollowOrientation() {
        BoardCoordinate e2 = BoardCoordinate.parse("e2");

        assertEquals(new Point(288, 416), OverlayRenderer.squareCenter(e2, new SquareTable(BoardOrientation.WHITE_AT_BOTTOM), 512));
        assertEquals(new Point(224, 96), OverlayRenderer.squareCenter(e2, new SquareTable(BoardOrientation.BLACK_AT_BOTTOM), 512));
    }

    @Test
    void arrowIsDrawnBetweenTheMoveSquares() {
        Mat board = BoardImages.emptyBoard(512, 512);
        LegalMove move = new LegalMove(BoardCoordinate.parse("e2"), BoardCoordinate.parse("e4"), "e2e4", "fen");

        OverlayRenderer.drawMoveArrow(board, move, new SquareTable(BoardOrientation.WHITE_AT_BOTTOM), OverlayRenderer.ENGINE_MOVE_COLOR);

        // midpoint between e2 and e4 lies on e3
        double[] pixel = board.get(352, 288);
        assertTrue(pixel[1] > 150, "green channel " + pixel[1]);
        assertTrue(pixel[0] < 50 && pixel[2] < 50);
    }

    @Test
    void gridChangesOnlyTileEdges() {
        Mat board = BoardImages.emptyBoard(512, 512);
        Mat before = board.clone();

        OverlayRenderer.drawGrid(board, OverlayRenderer.GRID_COLOR, 1);

        assertTrue(Core.norm(before, board, Core.NORM_INF) > 0);
        assertArrayEquals(before.get(32, 32), board.get(32, 32));
    }
}
