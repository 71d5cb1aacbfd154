package io.stackwarden.orchestrator.infra;

import io.stackwarden.orchestrator.config.OrchestratorProperties;
import io.stackwarden.orchestrator.domain.HealthHistory;
import io.stackwarden.orchestrator.domain.HealthSnapshot;
import io.stackwarden.orchestrator.domain.StackKey;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Per-stack deque of snapshots, pruned on every append by age (relative to the newest snapshot)
 * and by count.
 */
@Component
public class InMemoryHealthHistory implements HealthHistory {
    private final Map<StackKey, Deque<HealthSnapshot>> history = new ConcurrentHashMap<>();
    private final Duration retention;
    private final int maxEntries;

    @Autowired
    public InMemoryHealthHistory(OrchestratorProperties properties) {
        this(properties.getHealth().getRetention(), properties.getHealth().getMaxEntries());
    }

    public InMemoryHealthHistory(Duration retention, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1");
        }
        this.retention = retention;
        this.maxEntries = maxEntries;
    }

    @Override
    public void append(HealthSnapshot snapshot) {
        Deque<HealthSnapshot> snapshots = history.computeIfAbsent(snapshot.key(), key -> new ArrayDeque<>());
        synchronized (snapshots) {
            snapshots.addLast(snapshot);
            Instant cutoff = snapshot.capturedAt().minus(retention);
            while (!snapshots.isEmpty() && snapshots.peekFirst().capturedAt().isBefore(cutoff)) {
                snapshots.removeFirst();
            }
            while (snapshots.size() > maxEntries) {
                snapshots.removeFirst();
            }
        }
    }

    @Override
    public Optional<HealthSnapshot> latest(StackKey key) {
        Deque<HealthSnapshot> snapshots = history.get(key);
        if (snapshots == null) {
            return Optional.empty();
        }
        synchronized (snapshots) {
            return Optional.ofNullable(snapshots.peekLast());
        }
    }

    @Override
    public List<HealthSnapshot> since(StackKey key, Instant since) {
        Deque<HealthSnapshot> snapshots = history.get(key);
        if (snapshots == null) {
            return List.of();
        }
        synchronized (snapshots) {
            List<HealthSnapshot> result = new ArrayList<>();
            for (HealthSnapshot snapshot : snapshots) {
                if (since == null || !snapshot.capturedAt().isBefore(since)) {
                    result.add(snapshot);
                }
            }
            return result;
        }
    }

    @Override
    public List<HealthSnapshot> latestForEnvironment(String environmentId) {
        List<HealthSnapshot> latest = new ArrayList<>();
        history.forEach((key, snapshots) -> {
            if (key.environmentId().equals(environmentId)) {
                latest(key).ifPresent(latest::add);
            }
        });
        latest.sort(Comparator.comparing(HealthSnapshot::stackName));
        return latest;
    }

    @Override
    public void forget(StackKey key) {
        history.remove(key);
    }
}
