package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Watches an external source and switches the stack into or out of maintenance when the observed
 * value matches {@code maintenanceValue} or {@code normalValue}. Values compare case-insensitively
 * after trimming. Without {@code normalValue} anything but the maintenance value means normal;
 * with it, any third value is reported as a failed check and leaves the mode alone.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MaintenanceObserverDefinition(Duration pollInterval,
                                            String maintenanceValue,
                                            String normalValue,
                                            ObserverSettings settings) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);

    public MaintenanceObserverDefinition {
        pollInterval = pollInterval == null ? DEFAULT_POLL_INTERVAL : pollInterval;
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("observer pollInterval must be positive");
        }
        if (maintenanceValue == null || maintenanceValue.isBlank()) {
            throw new IllegalArgumentException("observer maintenanceValue must not be blank");
        }
        normalValue = normalValue == null || normalValue.isBlank() ? null : normalValue;
        Objects.requireNonNull(settings, "observer settings");
    }

    public boolean isMaintenanceValue(String observed) {
        return matches(observed, maintenanceValue);
    }

    public boolean isNormalValue(String observed) {
        return normalValue == null || matches(observed, normalValue);
    }

    private static boolean matches(String observed, String expected) {
        return observed != null
            && observed.trim().toLowerCase(Locale.ROOT).equals(expected.trim().toLowerCase(Locale.ROOT));
    }
}
