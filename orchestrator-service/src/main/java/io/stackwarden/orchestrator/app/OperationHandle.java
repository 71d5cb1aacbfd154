package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.StackKey;

/**
 * Returned as soon as an operation has been accepted; progress is followed through the journal.
 */
public record OperationHandle(String operationId, StackKey stack, boolean accepted) {
}
