package com.chessvision;

import org.opencv.core.Mat;

/**
 * A camera, or anything else that hands out raw color frames.
 */
public interface FrameSource {

    /** Opens the device. Calling it on an open source does nothing. */
    void open();

    boolean isOpened();

    /**
     * Blocks until the next frame is available.
     *
     * @throws CameraIOException if the source is closed or the read fails
     */
    Mat read();

    void release();
}
