package com.chessvision;

/**
 * An origin/destination hypothesis built from two changed squares.
 */
public final class MoveCandidate {

    private final SquareDifference origin;
    private final SquareDifference destination;

    public MoveCandidate(SquareDifference origin, SquareDifference destination) {
        this.origin = origin;
        this.destination = destination;
    }

    public SquareDifference getOrigin() {
        return origin;
    }

    public SquareDifference getDestination() {
        return destination;
    }

    public MoveCandidate reversed() {
        return new MoveCandidate(destination, origin);
    }

    @Override
    public String toString() {
        return origin + "->" + destination;
    }
}
