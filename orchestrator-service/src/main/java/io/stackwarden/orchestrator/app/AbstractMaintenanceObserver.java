package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.ObserverResult;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.stack.model.MaintenanceObserverDefinition;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw value read by a subclass into an {@link ObserverResult}.
 */
public abstract class AbstractMaintenanceObserver implements MaintenanceObserver {
    private static final Logger log = LoggerFactory.getLogger(AbstractMaintenanceObserver.class);

    private final MaintenanceObserverDefinition definition;
    private final Clock clock;

    protected AbstractMaintenanceObserver(MaintenanceObserverDefinition definition, Clock clock) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public MaintenanceObserverDefinition definition() {
        return definition;
    }

    @Override
    public final ObserverResult check() {
        String value;
        try {
            value = readValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ObserverResult.failed(null, "observer check interrupted", clock.now());
        } catch (Exception e) {
            log.debug("Observer {} could not read its value", definition.settings().describe(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return ObserverResult.failed(null, definition.settings().describe() + ": " + message, clock.now());
        }
        return evaluate(definition, value, clock);
    }

    static ObserverResult evaluate(MaintenanceObserverDefinition definition, String value, Clock clock) {
        if (definition.isMaintenanceValue(value)) {
            return ObserverResult.maintenance(value, clock.now());
        }
        if (definition.isNormalValue(value)) {
            return ObserverResult.normal(value, clock.now());
        }
        return ObserverResult.failed(value, "Unexpected value: " + value, clock.now());
    }

    /**
     * Reads the current value from the watched source.
     */
    protected abstract String readValue() throws Exception;
}
