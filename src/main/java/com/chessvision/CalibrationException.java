package com.chessvision;

/**
 * Thrown when four clicked corners cannot describe a board: too few points,
 * collinear points, or a self-intersecting quadrilateral.
 */
public class CalibrationException extends RuntimeException {
    public CalibrationException(String message) {
        super("Calibration failed: " + message);
    }
}
