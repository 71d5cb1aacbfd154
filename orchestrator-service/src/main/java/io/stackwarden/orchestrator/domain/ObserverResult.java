package io.stackwarden.orchestrator.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one maintenance observer check. A failed check carries an error and never asks for a
 * mode change.
 */
public record ObserverResult(String observedValue,
                             boolean maintenanceRequired,
                             boolean success,
                             String error,
                             Instant checkedAt) {
    public ObserverResult {
        Objects.requireNonNull(checkedAt, "checkedAt");
        if (!success && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("failed observer result needs an error");
        }
        if (!success && maintenanceRequired) {
            throw new IllegalArgumentException("failed observer result cannot require maintenance");
        }
    }

    public static ObserverResult maintenance(String observedValue, Instant checkedAt) {
        return new ObserverResult(observedValue, true, true, null, checkedAt);
    }

    public static ObserverResult normal(String observedValue, Instant checkedAt) {
        return new ObserverResult(observedValue, false, true, null, checkedAt);
    }

    public static ObserverResult failed(String observedValue, String error, Instant checkedAt) {
        return new ObserverResult(observedValue, false, false, error, checkedAt);
    }
}
