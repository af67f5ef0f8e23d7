package com.chessvision;

public enum DetectionState {
    /** No session: nothing calibrated. */
    IDLE,
    /** Transform installed, no reference frame yet. */
    CALIBRATED,
    /** Reference captured; waiting for a detection request. */
    ARMED,
    DETECTING,
    CONFIRMED,
    FAILED
}
