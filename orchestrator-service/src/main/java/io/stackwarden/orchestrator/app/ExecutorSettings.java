package io.stackwarden.orchestrator.app;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of container lifecycle steps.
 *
 * @param verifyLiveness       whether a started container must be observed running before the step succeeds
 * @param livenessTimeout      how long to wait for that observation
 * @param livenessPollInterval delay between inspections while waiting
 * @param stopTimeout          grace period given to a container before the runtime kills it
 * @param initTimeout          how long an init container may run before its step fails
 */
public record ExecutorSettings(boolean verifyLiveness,
                               Duration livenessTimeout,
                               Duration livenessPollInterval,
                               Duration stopTimeout,
                               Duration initTimeout) {

    public static final Duration DEFAULT_INIT_TIMEOUT = Duration.ofMinutes(5);

    public ExecutorSettings {
        Objects.requireNonNull(livenessTimeout, "livenessTimeout");
        Objects.requireNonNull(livenessPollInterval, "livenessPollInterval");
        Objects.requireNonNull(stopTimeout, "stopTimeout");
        Objects.requireNonNull(initTimeout, "initTimeout");
    }

    public ExecutorSettings(boolean verifyLiveness,
                            Duration livenessTimeout,
                            Duration livenessPollInterval,
                            Duration stopTimeout) {
        this(verifyLiveness, livenessTimeout, livenessPollInterval, stopTimeout, DEFAULT_INIT_TIMEOUT);
    }

    public static ExecutorSettings defaults() {
        return new ExecutorSettings(true, Duration.ofSeconds(30), Duration.ofMillis(500), Duration.ofSeconds(30),
            DEFAULT_INIT_TIMEOUT);
    }

    int livenessPolls() {
        long interval = Math.max(1, livenessPollInterval.toMillis());
        return (int) Math.max(1, livenessTimeout.toMillis() / interval);
    }

    int initPolls() {
        long interval = Math.max(1, livenessPollInterval.toMillis());
        return (int) Math.max(1, initTimeout.toMillis() / interval);
    }
}
