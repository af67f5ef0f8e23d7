package com.chessvision;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * What one contrast search produced: the move (if any), the setting that found it,
 * and every setting tried on the way.
 */
public final class ContrastSearchResult {

    private final ResolvedMove move;
    private final ContrastSetting winningSetting;
    private final List<ContrastSetting> tried;
    private final boolean cancelled;
    private final boolean timedOut;

    ContrastSearchResult(ResolvedMove move, ContrastSetting winningSetting, List<ContrastSetting> tried,
                         boolean cancelled, boolean timedOut) {
        this.move = move;
        this.winningSetting = winningSetting;
        this.tried = Collections.unmodifiableList(tried);
        this.cancelled = cancelled;
        this.timedOut = timedOut;
    }

    public Optional<ResolvedMove> getMove() {
        return Optional.ofNullable(move);
    }

    public Optional<ContrastSetting> getWinningSetting() {
        return Optional.ofNullable(winningSetting);
    }

    public List<ContrastSetting> getTried() {
        return tried;
    }

    public int getAttempts() {
        return tried.size();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
