package com.chessvision;

import java.util.Optional;

/**
 * Chess rules for the game being watched. The detection pipeline only asks;
 * the surrounding application decides when a move is applied.
 */
public interface LegalMoveOracle {

    /**
     * Checks whether moving the piece on {@code origin} to {@code destination} is legal
     * for the side to move. Must not change the position.
     */
    Optional<LegalMove> tryMove(BoardCoordinate origin, BoardCoordinate destination);

    /** Plays a move previously returned by {@link #tryMove}. */
    void apply(LegalMove move);

    /** Current position in Forsyth-Edwards notation. */
    String fen();
}
