package com.chessvision;

public enum GameStatus {
    ONGOING,
    CHECK,
    CHECKMATE,
    STALEMATE,
    FIFTY_MOVE_DRAW,
    THREEFOLD_REPETITION,
    INSUFFICIENT_MATERIAL;

    public boolean isOver() {
        return this != ONGOING && this != CHECK;
    }
}
