package com.flagship.reconciliation_engine.exception;

import java.util.Map;

/**
 * A workflow transition was requested that the document's current state does not allow.
 */
public class InvalidTransitionException extends EngineException {

    private final String fromStatus;
    private final String toStatus;

    public InvalidTransitionException(Enum<?> from, Enum<?> to, String reason) {
        super(ErrorCode.INVALID_TRANSITION,
            String.format("Invalid transition %s -> %s: %s", from, to, reason),
            Map.of("from", String.valueOf(from), "to", String.valueOf(to), "reason", reason));
        this.fromStatus = String.valueOf(from);
        this.toStatus = String.valueOf(to);
    }

    public String getFromStatus() {
        return fromStatus;
    }

    public String getToStatus() {
        return toStatus;
    }
}
