package io.stackwarden.orchestrator.app;

import io.stackwarden.stack.model.MaintenanceObserverDefinition;

public interface MaintenanceObserverFactory {

    MaintenanceObserver create(MaintenanceObserverDefinition definition);
}
