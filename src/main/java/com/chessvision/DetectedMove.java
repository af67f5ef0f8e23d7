package com.chessvision;

/**
 * A move seen on the board and accepted by the oracle.
 */
public final class DetectedMove {

    private final ResolvedMove resolved;
    private final ContrastSetting setting;
    private final int attempts;

    public DetectedMove(ResolvedMove resolved, ContrastSetting setting, int attempts) {
        this.resolved = resolved;
        this.setting = setting;
        this.attempts = attempts;
    }

    public LegalMove getMove() {
        return resolved.getMove();
    }

    public String getUci() {
        return resolved.getMove().getUci();
    }

    public MoveCandidate getCandidate() {
        return resolved.getCandidate();
    }

    /** Contrast setting the move was found at. */
    public ContrastSetting getSetting() {
        return setting;
    }

    /** Number of contrast settings tried, including the successful one. */
    public int getAttempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return getUci() + " at " + setting + " after " + attempts + " attempt(s)";
    }
}
