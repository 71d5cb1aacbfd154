package io.stackwarden.orchestrator.domain;

/**
 * Stable machine-readable reason attached to every rejected or failed operation.
 */
public enum ReasonCode {
    DEPENDENCY_CYCLE(FailureClass.FIX_INPUT),
    DEPENDENCY_MISSING(FailureClass.FIX_INPUT),
    INGRESS_NOT_FOUND(FailureClass.FIX_INPUT),
    DUPLICATE_SERVICE(FailureClass.FIX_INPUT),
    NETWORK_NOT_DECLARED(FailureClass.FIX_INPUT),
    INIT_ORDER_VIOLATION(FailureClass.FIX_INPUT),
    STACK_NOT_FOUND(FailureClass.FIX_INPUT),
    OPERATION_IN_PROGRESS(FailureClass.RETRY_LATER),
    INVALID_TRANSITION(FailureClass.NEEDS_OPERATOR),
    ROLLBACK_UNAVAILABLE(FailureClass.NEEDS_OPERATOR),
    RUNTIME_FAILURE(FailureClass.NEEDS_OPERATOR),
    CANCELLED(FailureClass.NEEDS_OPERATOR);

    private final FailureClass failureClass;

    ReasonCode(FailureClass failureClass) {
        this.failureClass = failureClass;
    }

    public FailureClass failureClass() {
        return failureClass;
    }

    public boolean retryable() {
        return failureClass == FailureClass.RETRY_LATER;
    }
}
