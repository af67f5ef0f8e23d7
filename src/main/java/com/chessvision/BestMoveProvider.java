package com.chessvision;

import java.util.concurrent.CompletableFuture;

/**
 * Chess engine used for the computer's turn.
 */
public interface BestMoveProvider {

    /**
     * @param fen   position to search
     * @param depth search depth; lower plays weaker
     */
    CompletableFuture<EngineSuggestion> bestMove(String fen, int depth);
}
