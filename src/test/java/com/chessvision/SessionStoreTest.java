package com.chessvision;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Core;
import org.opencv.core.Point;
import org.opencv.core.Size;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionStoreTest {

    private final Calibrator calibrator = new Calibrator(512);

    @Test
    void emptyDirectoryHasNothingToResume(@TempDir Path dir) {
        SessionStore store = new SessionStore(dir.resolve("session"));

        assertTrue(store.loadCalibration(calibrator).isEmpty());
        assertTrue(store.loadReference().isEmpty());
    }

    @Test
    void calibrationSurvivesSaveAndLoad(@TempDir Path dir) {
        SessionStore store = new SessionStore(dir.resolve("session"));
        List<Point> corners = List.of(new Point(100.5, 50), new Point(540, 60), new Point(90, 430), new Point(550, 440.25));
        CalibrationTransform saved = calibrator.calibrate(corners, new Size(640, 480));

        store.saveCalibration(saved);
        CalibrationTransform loaded = store.loadCalibration(calibrator).orElseThrow();

        assertEquals(saved.getCorners(), loaded.getCorners());
        assertEquals(saved.getSourceSize(), loaded.getSourceSize());
        assertEquals(0.0, Core.norm(saved.getPerspectiveMatrix(), loaded.getPerspectiveMatrix(), Core.NORM_INF), 1e-9);
    }

    @Test
    void referenceImageIsStoredLosslessly(@TempDir Path dir) {
        SessionStore store = new SessionStore(dir);
        BoardFrame frame = BoardImages.frame(BoardImages.boardWithPieces(1, 53, 64));

        store.saveReference(frame);
        BoardFrame loaded = store.loadReference().orElseThrow();

        assertEquals(512, loaded.size());
        assertEquals(0.0, Core.norm(frame.copyImage(), loaded.copyImage(), Core.NORM_INF));
    }

    @Test
    void incompleteCalibrationFileIsRejected(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(SessionStore.CALIBRATION_FILE), "{\"frameWidth\": 640}");
        SessionStore store = new SessionStore(dir);

        assertThrows(CalibrationException.class, () -> store.loadCalibration(calibrator));
    }

    @Test
    void savedCornersAreValidatedAgain(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(SessionStore.CALIBRATION_FILE),
                "{\"frameWidth\": 640, \"frameHeight\": 480, \"corners\": [[0,0],[100,0],[200,0],[300,300]]}");
        SessionStore store = new SessionStore(dir);

        assertThrows(CalibrationException.class, () -> store.loadCalibration(calibrator));
    }
}
