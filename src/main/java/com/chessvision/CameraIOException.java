package com.chessvision;

/**
 * Camera device could not be opened or a frame could not be read.
 */
public class CameraIOException extends RuntimeException {
    public CameraIOException(String message) {
        super("Camera error: " + message);
    }

    public CameraIOException(String message, Throwable cause) {
        super("Camera error: " + message, cause);
    }
}
