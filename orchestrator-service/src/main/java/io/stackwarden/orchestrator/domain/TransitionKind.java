package io.stackwarden.orchestrator.domain;

/**
 * The lifecycle operation that produced a stack's current mode.
 */
public enum TransitionKind {
    NONE,
    DEPLOY,
    UPGRADE,
    DOWNGRADE,
    ROLLBACK,
    MAINTENANCE,
    STOP,
    REMOVE;

    /**
     * Whether a failure of this transition leaves the stack eligible for rollback.
     */
    public boolean rollbackEligible() {
        return this == UPGRADE || this == ROLLBACK;
    }
}
