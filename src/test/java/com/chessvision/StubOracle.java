package com.chessvision;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Oracle that accepts a fixed set of moves and records every question it was asked.
 */
class StubOracle implements LegalMoveOracle {

    private final Set<String> legal;
    final List<String> asked = new ArrayList<>();

    StubOracle(String... legalMoves) {
        this.legal = Set.of(legalMoves);
    }

    @Override
    public synchronized Optional<LegalMove> tryMove(BoardCoordinate origin, BoardCoordinate destination) {
        String uci = origin.toString() + destination;
        asked.add(uci);
        return legal.contains(uci) ? Optional.of(new LegalMove(origin, destination, uci, "after " + uci)) : Optional.empty();
    }

    @Override
    public void apply(LegalMove move) {
        throw new UnsupportedOperationException();
    }

    @Override
    public String fen() {
        return ChessGameTracker.START_FEN;
    }
}
