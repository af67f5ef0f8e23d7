package com.chessvision;

public enum FailureReason {
    /** Every contrast setting was tried without a legal move. */
    NO_LEGAL_MOVE,
    RECTIFICATION_ERROR,
    CAMERA_IO_ERROR,
    CANCELLED
}
