package com.chessvision;

import nu.pattern.OpenCV;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.time.Clock;
import java.time.Instant;

/**
 * Warps a raw camera frame into the canonical top-down board square.
 */
public class Rectifier {

    static {
        OpenCV.loadLocally();
    }

    private final Clock clock;

    public Rectifier() {
        this(Clock.systemUTC());
    }

    public Rectifier(Clock clock) {
        this.clock = clock;
    }

    public BoardFrame rectify(Mat rawFrame, CalibrationTransform transform) {
        Instant capturedAt = clock.instant();
        if (rawFrame == null || rawFrame.empty()) {
            throw new RectificationException("raw frame is empty");
        }
        Size expected = transform.getSourceSize();
        if (rawFrame.cols() != (int) expected.width || rawFrame.rows() != (int) expected.height) {
            throw new RectificationException("frame is " + rawFrame.cols() + "x" + rawFrame.rows()
                    + " but calibration was done on " + (int) expected.width + "x" + (int) expected.height);
        }

        int side = transform.getCanonicalSize();
        Mat warped = new Mat();
        Imgproc.warpPerspective(rawFrame, warped, transform.matrix(), new Size(side, side), Imgproc.INTER_LINEAR);
        return new BoardFrame(warped, capturedAt);
    }
}
