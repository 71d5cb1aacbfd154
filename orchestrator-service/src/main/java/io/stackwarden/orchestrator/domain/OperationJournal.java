package io.stackwarden.orchestrator.domain;

import io.stackwarden.stack.model.DeploymentResult;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Records progress and outcome of lifecycle operations so callers can follow them after the
 * command returned.
 */
public interface OperationJournal {

    void start(OperationRecord record);

    void append(String operationId, ProgressEvent event);

    void complete(String operationId, OperationStatus status, DeploymentResult result, ReasonCode reason,
                  Instant finishedAt);

    /**
     * Forgets an operation that was accepted but never handed to the executor.
     */
    void discard(String operationId);

    Optional<OperationRecord> find(String operationId);

    /**
     * Operations of a stack, most recent first.
     */
    List<OperationRecord> forStack(StackKey key);
}
