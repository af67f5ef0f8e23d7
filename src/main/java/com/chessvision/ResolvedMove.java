package com.chessvision;

/**
 * A candidate the oracle accepted, with the oracle's answer.
 */
public final class ResolvedMove {

    private final MoveCandidate candidate;
    private final LegalMove move;

    public ResolvedMove(MoveCandidate candidate, LegalMove move) {
        this.candidate = candidate;
        this.move = move;
    }

    public MoveCandidate getCandidate() {
        return candidate;
    }

    public LegalMove getMove() {
        return move;
    }

    @Override
    public String toString() {
        return move.getUci() + " (" + candidate + ")";
    }
}
