package io.stackwarden.orchestrator.domain;

import java.util.Objects;

/**
 * Rejection of a lifecycle command, raised before the operation has any side effect.
 */
public abstract class StackOperationException extends RuntimeException {
    private final ReasonCode reason;

    protected StackOperationException(ReasonCode reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public ReasonCode reason() {
        return reason;
    }

    public boolean retryable() {
        return reason.retryable();
    }
}
