package com.chessvision;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Four board corners clicked on the raw camera frame, ordered TL, TR, BL, BR,
 * and the perspective matrix that maps them onto the canonical square.
 * Instances are produced by {@link Calibrator} and never mutated afterwards.
 */
public final class CalibrationTransform {

    public static final int TOP_LEFT = 0;
    public static final int TOP_RIGHT = 1;
    public static final int BOTTOM_LEFT = 2;
    public static final int BOTTOM_RIGHT = 3;

    private final List<Point> corners;
    private final Size sourceSize;
    private final int canonicalSize;
    private final Mat perspectiveMatrix;

    CalibrationTransform(List<Point> corners, Size sourceSize, int canonicalSize, Mat perspectiveMatrix) {
        List<Point> copy = new ArrayList<>(corners.size());
        for (Point p : corners) {
            copy.add(p.clone());
        }
        this.corners = Collections.unmodifiableList(copy);
        this.sourceSize = sourceSize.clone();
        this.canonicalSize = canonicalSize;
        this.perspectiveMatrix = perspectiveMatrix;
    }

    /** Copies of the corners, TL, TR, BL, BR. */
    public List<Point> getCorners() {
        List<Point> copy = new ArrayList<>(corners.size());
        for (Point p : corners) {
            copy.add(p.clone());
        }
        return copy;
    }

    /** Raw frame size the corners were picked on. */
    public Size getSourceSize() {
        return sourceSize.clone();
    }

    public int getCanonicalSize() {
        return canonicalSize;
    }

    /** A copy of the 3x3 raw-to-canonical matrix. */
    public Mat getPerspectiveMatrix() {
        return perspectiveMatrix.clone();
    }

    Mat matrix() {
        return perspectiveMatrix;
    }

    @Override
    public String toString() {
        return "CalibrationTransform{corners=" + corners + ", source=" + sourceSize
                + ", canonical=" + canonicalSize + "}";
    }
}
