package com.chessvision;

import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import java.time.Instant;
import java.util.List;

/**
 * Synthetic board pictures: a flat gray board with bright blobs standing in for pieces.
 */
final class BoardImages {

    static final int SIDE = 512;
    static final double BACKGROUND = 100;
    static final double PIECE = 200;

    static {
        OpenCV.loadLocally();
    }

    private BoardImages() {
    }

    static Mat emptyBoard(int width, int height) {
        return new Mat(height, width, CvType.CV_8UC3, new Scalar(BACKGROUND, BACKGROUND, BACKGROUND));
    }

    /** A canonical board with one blob centered in each listed tile. */
    static Mat boardWithPieces(int... tileIndices) {
        Mat board = emptyBoard(SIDE, SIDE);
        for (int index : tileIndices) {
            drawPiece(board, index);
        }
        return board;
    }

    static void drawPiece(Mat canonical, int tileIndex) {
        int tile = canonical.cols() / 8;
        int margin = tile / 5;
        int col = (tileIndex - 1) % 8;
        int row = (tileIndex - 1) / 8;
        Rect blob = new Rect(col * tile + margin, row * tile + margin, tile - 2 * margin, tile - 2 * margin);
        canonical.submat(blob).setTo(new Scalar(PIECE, PIECE, PIECE));
    }

    static BoardFrame frame(Mat image) {
        return new BoardFrame(image, Instant.EPOCH);
    }

    /** Corners that map a full {@link #SIDE} frame onto itself. */
    static List<Point> identityCorners() {
        return List.of(new Point(0, 0), new Point(SIDE, 0), new Point(0, SIDE), new Point(SIDE, SIDE));
    }
}
