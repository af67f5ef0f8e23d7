package com.chessvision;

import org.opencv.core.Mat;

import java.time.Instant;

/**
 * A rectified, top-down board image plus the time the raw frame was captured.
 * The image is owned by the frame; callers get copies.
 */
public final class BoardFrame {

    private final Mat image;
    private final Instant capturedAt;

    public BoardFrame(Mat image, Instant capturedAt) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Board frame image is empty");
        }
        this.image = image;
        this.capturedAt = capturedAt;
    }

    /** Copy of the canonical image, safe to draw on. */
    public Mat copyImage() {
        return image.clone();
    }

    Mat image() {
        return image;
    }

    public int size() {
        return image.cols();
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public void release() {
        image.release();
    }

    @Override
    public String toString() {
        return "BoardFrame{" + image.cols() + "x" + image.rows() + ", capturedAt=" + capturedAt + "}";
    }
}
