package io.stackwarden.orchestrator.infra;

import io.stackwarden.orchestrator.config.OrchestratorProperties;
import io.stackwarden.orchestrator.domain.OperationJournal;
import io.stackwarden.orchestrator.domain.OperationRecord;
import io.stackwarden.orchestrator.domain.OperationStatus;
import io.stackwarden.orchestrator.domain.ProgressEvent;
import io.stackwarden.orchestrator.domain.ReasonCode;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.stack.model.DeploymentResult;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Keeps every running operation plus the most recent finished ones of each stack. Pruning runs
 * whenever an operation of the stack completes.
 */
@Component
public class InMemoryOperationJournal implements OperationJournal {
    private static final Logger log = LoggerFactory.getLogger(InMemoryOperationJournal.class);

    static final int DEFAULT_MAX_PER_STACK = 50;

    private final Map<String, OperationRecord> operations = new ConcurrentHashMap<>();
    private final int maxFinishedPerStack;

    public InMemoryOperationJournal() {
        this(DEFAULT_MAX_PER_STACK);
    }

    @Autowired
    public InMemoryOperationJournal(OrchestratorProperties properties) {
        this(properties.getJournal().getMaxOperationsPerStack());
    }

    public InMemoryOperationJournal(int maxFinishedPerStack) {
        if (maxFinishedPerStack < 1) {
            throw new IllegalArgumentException("maxFinishedPerStack must be at least 1");
        }
        this.maxFinishedPerStack = maxFinishedPerStack;
    }

    @Override
    public void start(OperationRecord record) {
        operations.put(record.operationId(), record);
    }

    @Override
    public void append(String operationId, ProgressEvent event) {
        OperationRecord updated = operations.computeIfPresent(operationId, (id, record) -> record.withEvent(event));
        if (updated == null) {
            log.warn("Dropping {} event for unknown operation {}", event.phase(), operationId);
            return;
        }
        log.debug("[{}] {} {} {}: {}", operationId, event.step(), event.phase(), event.outcome(), event.message());
    }

    @Override
    public void complete(String operationId, OperationStatus status, DeploymentResult result, ReasonCode reason,
                         Instant finishedAt) {
        OperationRecord finished = operations.computeIfPresent(operationId,
            (id, record) -> record.finished(status, result, reason, finishedAt));
        if (finished != null) {
            prune(finished.stack());
        }
    }

    @Override
    public void discard(String operationId) {
        if (operations.remove(operationId) != null) {
            log.debug("Discarded operation {}", operationId);
        }
    }

    @Override
    public Optional<OperationRecord> find(String operationId) {
        return Optional.ofNullable(operations.get(operationId));
    }

    @Override
    public List<OperationRecord> forStack(StackKey key) {
        return operations.values().stream()
            .filter(record -> key.equals(record.stack()))
            .sorted(Comparator.comparing(OperationRecord::startedAt).reversed())
            .toList();
    }

    private void prune(StackKey key) {
        List<OperationRecord> finished = forStack(key).stream()
            .filter(record -> record.status().terminal())
            .toList();
        if (finished.size() <= maxFinishedPerStack) {
            return;
        }
        List<OperationRecord> expired = finished.subList(maxFinishedPerStack, finished.size());
        expired.forEach(record -> operations.remove(record.operationId()));
        log.debug("Pruned {} finished operation(s) of {}", expired.size(), key);
    }
}
