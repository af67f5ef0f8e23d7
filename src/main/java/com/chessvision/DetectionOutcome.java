package com.chessvision;

import java.util.Optional;

/**
 * Result of one detection request: either a move or a failure.
 */
public final class DetectionOutcome {

    private final DetectedMove move;
    private final DetectionFailure failure;

    private DetectionOutcome(DetectedMove move, DetectionFailure failure) {
        this.move = move;
        this.failure = failure;
    }

    public static DetectionOutcome detected(DetectedMove move) {
        return new DetectionOutcome(move, null);
    }

    public static DetectionOutcome failed(DetectionFailure failure) {
        return new DetectionOutcome(null, failure);
    }

    public boolean isDetected() {
        return move != null;
    }

    public Optional<DetectedMove> getMove() {
        return Optional.ofNullable(move);
    }

    public Optional<DetectionFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return move != null ? "Detected " + move : "Failed " + failure;
    }
}
