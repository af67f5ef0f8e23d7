package com.chessvision;

import nu.pattern.OpenCV;
import org.opencv.core.Mat;
import org.opencv.videoio.VideoCapture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FrameSource} backed by an OpenCV {@link VideoCapture} device.
 * Reads are serialized so the live preview and the detection thread can share one device.
 */
public class OpenCvCamera implements FrameSource {

    private static final Logger log = LoggerFactory.getLogger(OpenCvCamera.class);

    static {
        OpenCV.loadLocally();
    }

    private final int deviceIndex;
    private VideoCapture capture;

    public OpenCvCamera(int deviceIndex) {
        this.deviceIndex = deviceIndex;
    }

    @Override
    public synchronized void open() {
        if (capture != null && capture.isOpened()) {
            return;
        }
        capture = new VideoCapture(deviceIndex);
        if (!capture.isOpened()) {
            capture.release();
            capture = null;
            throw new CameraIOException("cannot open camera " + deviceIndex);
        }
        log.info("Camera {} opened", deviceIndex);
    }

    @Override
    public synchronized boolean isOpened() {
        return capture != null && capture.isOpened();
    }

    @Override
    public synchronized Mat read() {
        if (!isOpened()) {
            throw new CameraIOException("camera " + deviceIndex + " is not open");
        }
        Mat frame = new Mat();
        if (!capture.read(frame) || frame.empty()) {
            frame.release();
            throw new CameraIOException("could not read a frame from camera " + deviceIndex);
        }
        return frame;
    }

    @Override
    public synchronized void release() {
        if (capture != null) {
            capture.release();
            capture = null;
            log.info("Camera {} released", deviceIndex);
        }
    }
}
