package com.chessvision;

public class RectificationException extends RuntimeException {
    public RectificationException(String message) {
        super("Rectification failed: " + message);
    }
}
