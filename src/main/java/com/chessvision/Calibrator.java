package com.chessvision;

import nu.pattern.OpenCV;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns four user-clicked corners into a reusable {@link CalibrationTransform}.
 * Corners must arrive as top-left, top-right, bottom-left, bottom-right.
 */
public class Calibrator {

    private static final Logger log = LoggerFactory.getLogger(Calibrator.class);

    // Twice the triangle area, in squared pixels, below which three corners count as collinear
    private static final double COLLINEAR_EPSILON = 1e-6;

    static {
        OpenCV.loadLocally();
    }

    private final int canonicalSize;

    public Calibrator(int canonicalSize) {
        if (canonicalSize <= 0 || canonicalSize % 8 != 0) {
            throw new IllegalArgumentException("canonicalSize must be a positive multiple of 8: " + canonicalSize);
        }
        this.canonicalSize = canonicalSize;
    }

    public Calibrator(DetectorConfig config) {
        this(config.getCanonicalSize());
    }

    public CalibrationTransform calibrate(List<Point> corners, Size frameSize) {
        if (corners == null || corners.size() < 4) {
            throw new CalibrationException("four corners are required, got " + (corners == null ? 0 : corners.size()));
        }
        if (corners.size() > 4) {
            throw new CalibrationException("exactly four corners are required, got " + corners.size());
        }
        if (frameSize == null || frameSize.width <= 0 || frameSize.height <= 0) {
            throw new CalibrationException("frame size is unknown");
        }
        for (Point p : corners) {
            if (p == null) {
                throw new CalibrationException("corner is missing");
            }
            if (p.x < 0 || p.y < 0 || p.x > frameSize.width || p.y > frameSize.height) {
                throw new CalibrationException("corner " + p + " lies outside the " + frameSize + " frame");
            }
        }

        Point tl = corners.get(CalibrationTransform.TOP_LEFT);
        Point tr = corners.get(CalibrationTransform.TOP_RIGHT);
        Point bl = corners.get(CalibrationTransform.BOTTOM_LEFT);
        Point br = corners.get(CalibrationTransform.BOTTOM_RIGHT);

        Point[] all = {tl, tr, bl, br};
        for (int i = 0; i < 4; i++) {
            for (int j = i + 1; j < 4; j++) {
                for (int k = j + 1; k < 4; k++) {
                    if (Math.abs(cross(all[i], all[j], all[k])) < COLLINEAR_EPSILON) {
                        throw new CalibrationException("corners " + all[i] + ", " + all[j] + ", " + all[k] + " are collinear");
                    }
                }
            }
        }

        // A convex, correctly ordered board has diagonals TL-BR and TR-BL crossing inside both
        if (!segmentsCross(tl, br, tr, bl)) {
            throw new CalibrationException("corners form a self-intersecting shape; click TL, TR, BL, BR in order");
        }

        Point[] dstPoints = new Point[]{
                new Point(0, 0),
                new Point(canonicalSize, 0),
                new Point(0, canonicalSize),
                new Point(canonicalSize, canonicalSize)
        };

        Mat srcMat = new MatOfPoint2f(tl, tr, bl, br);
        Mat dstMat = new MatOfPoint2f(dstPoints);
        Mat perspectiveMatrix = Imgproc.getPerspectiveTransform(srcMat, dstMat);
        srcMat.release();
        dstMat.release();

        CalibrationTransform transform = new CalibrationTransform(corners, frameSize, canonicalSize, perspectiveMatrix);
        log.info("Calibrated board: {}", transform);
        return transform;
    }

    private static double cross(Point o, Point a, Point b) {
        return (a.x - o.x) * (b.y - o.y) - (a.y - o.y) * (b.x - o.x);
    }

    private static boolean segmentsCross(Point p1, Point p2, Point q1, Point q2) {
        double d1 = cross(q1, q2, p1);
        double d2 = cross(q1, q2, p2);
        double d3 = cross(p1, p2, q1);
        double d4 = cross(p1, p2, q2);
        return ((d1 > 0 && d2 < 0) || (d1 < 0 && d2 > 0))
                && ((d3 > 0 && d4 < 0) || (d3 < 0 && d4 > 0));
    }
}
