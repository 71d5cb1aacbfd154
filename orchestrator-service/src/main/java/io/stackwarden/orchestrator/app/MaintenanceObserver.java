package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.ObserverResult;
import io.stackwarden.stack.model.MaintenanceObserverDefinition;

/**
 * Reads one external value and decides whether its stack should be in maintenance.
 */
public interface MaintenanceObserver {

    MaintenanceObserverDefinition definition();

    /**
     * Never throws; problems reading the value come back as a failed result.
     */
    ObserverResult check();
}
