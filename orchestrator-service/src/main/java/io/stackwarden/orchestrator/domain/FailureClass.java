package io.stackwarden.orchestrator.domain;

/**
 * What a caller should do about a rejected or failed operation.
 */
public enum FailureClass {
    FIX_INPUT,
    RETRY_LATER,
    NEEDS_OPERATOR
}
