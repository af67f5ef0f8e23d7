package com.chessvision;

import org.opencv.core.Mat;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Frame source fed by the test. Hands out queued frames in order and keeps
 * returning the last one once the queue is drained.
 */
class FakeCamera implements FrameSource {

    private final Deque<Mat> frames = new ArrayDeque<>();
    private Mat last;
    private volatile boolean opened;
    private volatile boolean released;
    private volatile boolean failNextRead;

    synchronized void enqueue(Mat frame) {
        frames.addLast(frame);
    }

    void failNextRead() {
        failNextRead = true;
    }

    boolean wasReleased() {
        return released;
    }

    @Override
    public void open() {
        opened = true;
        released = false;
    }

    @Override
    public boolean isOpened() {
        return opened;
    }

    @Override
    public synchronized Mat read() {
        if (!opened) {
            throw new CameraIOException("camera is not open");
        }
        if (failNextRead) {
            failNextRead = false;
            throw new CameraIOException("simulated read failure");
        }
        if (!frames.isEmpty()) {
            last = frames.pollFirst();
        }
        if (last == null) {
            throw new CameraIOException("no frame queued");
        }
        return last.clone();
    }

    @Override
    public void release() {
        opened = false;
        released = true;
    }
}
