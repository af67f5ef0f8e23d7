package com.chessvision;

/**
 * A move the rules oracle accepted for the current position.
 */
public final class LegalMove {

    private final BoardCoordinate origin;
    private final BoardCoordinate destination;
    private final String uci;
    private final String resultingFen;

    public LegalMove(BoardCoordinate origin, BoardCoordinate destination, String uci, String resultingFen) {
        this.origin = origin;
        this.destination = destination;
        this.uci = uci;
        this.resultingFen = resultingFen;
    }

    public BoardCoordinate getOrigin() {
        return origin;
    }

    public BoardCoordinate getDestination() {
        return destination;
    }

    /** UCI notation, e.g. {@code e2e4} or {@code e7e8q}. */
    public String getUci() {
        return uci;
    }

    public String getResultingFen() {
        return resultingFen;
    }

    @Override
    public String toString() {
        return uci;
    }
}
