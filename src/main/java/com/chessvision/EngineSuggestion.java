package com.chessvision;

/**
 * Best move returned by the engine, with its evaluation as reported.
 */
public final class EngineSuggestion {

    private final String bestMove;
    private final String evaluation;

    public EngineSuggestion(String bestMove, String evaluation) {
        this.bestMove = bestMove;
        this.evaluation = evaluation;
    }

    /** UCI notation, e.g. {@code g8f6}. */
    public String getBestMove() {
        return bestMove;
    }

    public String getEvaluation() {
        return evaluation;
    }

    @Override
    public String toString() {
        return bestMove + " (eval " + evaluation + ")";
    }
}
