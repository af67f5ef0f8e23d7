package com.chessvision;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Draws guides on board images: the square grid, move arrows and calibration corners.
 * All methods draw in place.
 */
public final class OverlayRenderer {

    public static final Scalar GRID_COLOR = new Scalar(0, 255, 0);
    public static final Scalar ENGINE_MOVE_COLOR = new Scalar(0, 200, 0);
    public static final Scalar DETECTED_MOVE_COLOR = new Scalar(0, 0, 255);
    public static final Scalar CORNER_COLOR = new Scalar(255, 255, 0);

    private OverlayRenderer() {
    }

    public static void drawGrid(Mat canonical, Scalar color, int thickness) {
        int side = canonical.cols();
        double step = side / 8.0;
        for (int i = 0; i <= 8; i++) {
            int pos = (int) Math.min(side - 1, Math.round(i * step));
            Imgproc.line(canonical, new Point(pos, 0), new Point(pos, side - 1), color, thickness);
            Imgproc.line(canonical, new Point(0, pos), new Point(side - 1, pos), color, thickness);
        }
    }

    /** Pixel center of the tile holding {@code square} on a canonical image of {@code side} pixels. */
    public static Point squareCenter(BoardCoordinate square, SquareTable table, int side) {
        double tile = side / 8.0;
        return new Point(table.column(square) * tile + tile / 2, table.row(square) * tile + tile / 2);
    }

    public static void drawMoveArrow(Mat canonical, LegalMove move, SquareTable table, Scalar color) {
        int side = canonical.cols();
        Point from = squareCenter(move.getOrigin(), table, side);
        Point to = squareCenter(move.getDestination(), table, side);
        Imgproc.arrowedLine(canonical, from, to, color, 4, Imgproc.LINE_AA, 0, 0.25);
    }

    public static void drawCorners(Mat rawFrame, List<Point> corners) {
        String[] labels = {"TL", "TR", "BL", "BR"};
        for (int i = 0; i < corners.size(); i++) {
            Point p = corners.get(i);
            Imgproc.circle(rawFrame, p, 6, CORNER_COLOR, 2);
            if (i < labels.length) {
                Imgproc.putText(rawFrame, labels[i], new Point(p.x + 8, p.y - 8),
                        Imgproc.FONT_HERSHEY_SIMPLEX, 0.6, CORNER_COLOR, 2);
            }
        }
    }
}
