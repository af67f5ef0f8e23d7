package com.chessvision;

/**
 * Receives session events. Callbacks run on the detection thread;
 * UI code must hop to its own thread before touching widgets.
 */
public interface DetectionListener {

    default void onCalibrationComplete(CalibrationTransform transform) {
    }

    default void onReferenceUpdated(BoardFrame frame) {
    }

    default void onMoveDetected(DetectedMove move) {
    }

    default void onDetectionFailed(DetectionFailure failure) {
    }

    default void onStateChanged(DetectionState state) {
    }
}
