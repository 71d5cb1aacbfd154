package io.stackwarden.orchestrator.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, time-ordered health history per stack. Snapshots are only appended and pruned.
 */
public interface HealthHistory {

    void append(HealthSnapshot snapshot);

    Optional<HealthSnapshot> latest(StackKey key);

    /**
     * Snapshots captured at or after {@code since}, oldest first.
     */
    List<HealthSnapshot> since(StackKey key, Instant since);

    List<HealthSnapshot> latestForEnvironment(String environmentId);

    void forget(StackKey key);
}
