package com.chessvision;

import java.util.Collections;
import java.util.List;

public final class DetectionFailure {

    private final FailureReason reason;
    private final String message;
    private final List<ContrastSetting> tried;

    public DetectionFailure(FailureReason reason, String message, List<ContrastSetting> tried) {
        this.reason = reason;
        this.message = message;
        this.tried = Collections.unmodifiableList(tried);
    }

    public DetectionFailure(FailureReason reason, String message) {
        this(reason, message, List.of());
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public List<ContrastSetting> getTried() {
        return tried;
    }

    @Override
    public String toString() {
        return reason + ": " + message;
    }
}
