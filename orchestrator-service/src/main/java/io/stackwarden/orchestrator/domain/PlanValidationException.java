package io.stackwarden.orchestrator.domain;

import java.util.List;

/**
 * Structural problem in a stack description; fixing the input is the only remedy.
 */
public class PlanValidationException extends StackOperationException {
    private final List<String> services;

    public PlanValidationException(ReasonCode reason, String message, List<String> services) {
        super(reason, message);
        this.services = services == null ? List.of() : List.copyOf(services);
    }

    /**
     * Services the problem was detected on.
     */
    public List<String> services() {
        return services;
    }
}
