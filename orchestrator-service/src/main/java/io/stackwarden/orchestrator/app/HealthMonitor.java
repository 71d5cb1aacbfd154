package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.EnvironmentHealthSummary;
import io.stackwarden.orchestrator.domain.HealthHistory;
import io.stackwarden.orchestrator.domain.HealthSnapshot;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.orchestrator.domain.StackNotFoundException;
import io.stackwarden.orchestrator.domain.StackRuntimeRecord;
import io.stackwarden.orchestrator.domain.StackStateStore;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Polls every known stack on a fixed cadence and answers health queries from the recorded
 * history. Polling never takes the environment lock.
 */
public class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final StackStateStore store;
    private final HealthAggregator aggregator;
    private final HealthHistory history;

    public HealthMonitor(StackStateStore store, HealthAggregator aggregator, HealthHistory history) {
        this.store = Objects.requireNonNull(store, "store");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.history = Objects.requireNonNull(history, "history");
    }

    @Scheduled(fixedDelayString = "${stackwarden.orchestrator.health.poll-interval:PT30S}",
        initialDelayString = "${stackwarden.orchestrator.health.poll-interval:PT30S}")
    public void poll() {
        for (StackRuntimeRecord record : store.all()) {
            try {
                history.append(aggregator.capture(record));
            } catch (RuntimeException e) {
                log.warn("Health poll of stack {} failed: {}", record.key(), e.getMessage(), e);
            }
        }
    }

    /**
     * Captures and records a snapshot now instead of waiting for the next poll.
     */
    public HealthSnapshot refresh(StackKey key) {
        StackRuntimeRecord record = store.find(key).orElseThrow(() -> StackNotFoundException.stack(key));
        HealthSnapshot snapshot = aggregator.capture(record);
        history.append(snapshot);
        return snapshot;
    }

    public Optional<HealthSnapshot> latest(StackKey key) {
        return history.latest(key);
    }

    public List<HealthSnapshot> since(StackKey key, Instant since) {
        return history.since(key, since);
    }

    public EnvironmentHealthSummary environment(String environmentId) {
        return EnvironmentHealthSummary.of(environmentId, history.latestForEnvironment(environmentId));
    }
}
