package com.chessvision;

import org.junit.jupiter.api.Test;
import org.opencv.core.Point;
import org.opencv.core.Size;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CalibratorTest {

    private final Calibrator calibrator = new Calibrator(512);
    private final Size frame = new Size(640, 480);

    @Test
    void acceptsConvexCornersInOrder() {
        List<Point> corners = List.of(new Point(100, 50), new Point(540, 60), new Point(90, 430), new Point(550, 440));

        CalibrationTransform transform = calibrator.calibrate(corners, frame);

        assertEquals(512, transform.getCanonicalSize());
        assertEquals(corners, transform.getCorners());
        assertEquals(frame, transform.getSourceSize());
        assertEquals(3, transform.getPerspectiveMatrix().rows());
        assertEquals(3, transform.getPerspectiveMatrix().cols());
    }

    @Test
    void cornersAreCopiedOnRead() {
        List<Point> corners = List.of(new Point(100, 50), new Point(540, 60), new Point(90, 430), new Point(550, 440));
        CalibrationTransform transform = calibrator.calibrate(corners, frame);

        transform.getCorners().get(0).x = 999;

        assertEquals(new Point(100, 50), transform.getCorners().get(0));
    }

    @Test
    void rejectsFewerThanFourCorners() {
        List<Point> corners = List.of(new Point(0, 0), new Point(100, 0), new Point(0, 100));

        CalibrationException e = assertThrows(CalibrationException.class, () -> calibrator.calibrate(corners, frame));
        assertTrue(e.getMessage().startsWith("Calibration failed: "));
    }

    @Test
    void rejectsNullCorners() {
        assertThrows(CalibrationException.class, () -> calibrator.calibrate(null, frame));
    }

    @Test
    void rejectsCollinearCorners() {
        List<Point> corners = List.of(new Point(0, 0), new Point(100, 0), new Point(200, 0), new Point(300, 300));

        assertThrows(CalibrationException.class, () -> calibrator.calibrate(corners, frame));
    }

    @Test
    void rejectsCornersClickedOutOfOrder() {
        // BL and BR swapped: the outline crosses itself
        List<Point> corners = List.of(new Point(100, 50), new Point(540, 60), new Point(550, 440), new Point(90, 430));

        assertThrows(CalibrationException.class, () -> calibrator.calibrate(corners, frame));
    }

    @Test
    void rejectsCornerOutsideFrame() {
        List<Point> corners = List.of(new Point(100, 50), new Point(700, 60), new Point(90, 430), new Point(550, 440));

        assertThrows(CalibrationException.class, () -> calibrator.calibrate(corners, frame));
    }

    @Test
    void rejectsCanonicalSizeNotDivisibleByEight() {
        assertThrows(IllegalArgumentException.class, () -> new Calibrator(500));
    }
}
