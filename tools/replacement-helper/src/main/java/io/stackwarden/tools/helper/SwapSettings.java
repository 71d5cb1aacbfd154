package io.stackwarden.tools.helper;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of a swap. {@code stopGrace} is how long the old container gets to exit on its own before
 * it is stopped; {@code stopTimeout} is what the runtime waits before killing it.
 */
public record SwapSettings(Duration stopGrace, Duration stopTimeout, Duration startTimeout, Duration pollInterval) {

    public SwapSettings {
        Objects.requireNonNull(stopGrace, "stopGrace");
        Objects.requireNonNull(stopTimeout, "stopTimeout");
        Objects.requireNonNull(startTimeout, "startTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must not be negative");
        }
    }

    int polls(Duration window) {
        if (pollInterval.isZero()) {
            return (int) Math.max(1, window.toMillis());
        }
        return (int) Math.max(1, window.toMillis() / pollInterval.toMillis());
    }
}
