package com.chessvision;

import java.util.Comparator;

/**
 * Change magnitude measured on one of the 64 tiles of the canonical image.
 * Magnitudes are only comparable within a single comparison.
 */
public final class SquareDifference {

    /** Highest magnitude first; equal magnitudes by lower square index. */
    public static final Comparator<SquareDifference> BY_MAGNITUDE =
            Comparator.comparingDouble(SquareDifference::getMagnitude).reversed()
                    .thenComparingInt(SquareDifference::getSquareIndex);

    private final int squareIndex;
    private final double magnitude;

    public SquareDifference(int squareIndex, double magnitude) {
        if (squareIndex < 1 || squareIndex > 64) {
            throw new IllegalArgumentException("Square index out of range: " + squareIndex);
        }
        this.squareIndex = squareIndex;
        this.magnitude = magnitude;
    }

    public int getSquareIndex() {
        return squareIndex;
    }

    public double getMagnitude() {
        return magnitude;
    }

    @Override
    public String toString() {
        return String.format("#%d=%.2f", squareIndex, magnitude);
    }
}
