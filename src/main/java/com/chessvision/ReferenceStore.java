package com.chessvision;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the last confirmed board image of a session.
 * Frames are swapped whole, so a reader never sees a half-updated reference.
 * Replaced frames are not released here: a display may still hold them.
 */
public class ReferenceStore {

    private final AtomicReference<BoardFrame> current = new AtomicReference<>();

    public Optional<BoardFrame> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isSet() {
        return current.get() != null;
    }

    /** Installs {@code frame} and returns the frame it replaced, if any. */
    public Optional<BoardFrame> replace(BoardFrame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("Reference frame must not be null");
        }
        return Optional.ofNullable(current.getAndSet(frame));
    }

    public void clear() {
        current.set(null);
    }
}
