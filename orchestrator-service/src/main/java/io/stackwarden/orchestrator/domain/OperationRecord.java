package io.stackwarden.orchestrator.domain;

import io.stackwarden.stack.model.DeploymentResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Journal entry of one lifecycle operation: its ordered progress events and, once finished, its result.
 */
public record OperationRecord(String operationId,
                              StackKey stack,
                              OperationKind kind,
                              OperationStatus status,
                              Instant startedAt,
                              Instant finishedAt,
                              List<ProgressEvent> events,
                              DeploymentResult result,
                              ReasonCode reason) {
    public OperationRecord {
        Objects.requireNonNull(operationId, "operationId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static OperationRecord started(String operationId, StackKey stack, OperationKind kind, Instant startedAt) {
        return new OperationRecord(operationId, stack, kind, OperationStatus.RUNNING, startedAt, null, List.of(),
            null, null);
    }

    public OperationRecord withEvent(ProgressEvent event) {
        List<ProgressEvent> next = new ArrayList<>(events);
        next.add(event);
        return new OperationRecord(operationId, stack, kind, status, startedAt, finishedAt, next, result, reason);
    }

    public OperationRecord finished(OperationStatus finalStatus, DeploymentResult outcome, ReasonCode failureReason,
                                    Instant at) {
        return new OperationRecord(operationId, stack, kind, finalStatus, startedAt, at, events, outcome,
            failureReason);
    }
}
