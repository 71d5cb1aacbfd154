package io.stackwarden.orchestrator.domain;

/**
 * Authoritative indicator of planned versus unplanned disruption of a stack. Only the
 * operation-mode controller moves a stack between modes.
 */
public enum OperationMode {
    NORMAL,
    MIGRATING,
    MAINTENANCE,
    STOPPED,
    FAILED;

    public boolean canTransitionTo(OperationMode next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case NORMAL -> next == MIGRATING || next == MAINTENANCE || next == STOPPED || next == FAILED;
            case MIGRATING, MAINTENANCE, STOPPED -> next == NORMAL || next == FAILED;
            case FAILED -> next == MIGRATING || next == NORMAL;
        };
    }
}
