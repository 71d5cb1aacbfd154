package io.stackwarden.orchestrator.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One step transition of a running operation. {@code step} is the context name, or the network
 * name for {@link ProgressPhase#NETWORK} events.
 */
public record ProgressEvent(String step,
                            ProgressPhase phase,
                            ProgressOutcome outcome,
                            String message,
                            Instant timestamp) {
    public ProgressEvent {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
