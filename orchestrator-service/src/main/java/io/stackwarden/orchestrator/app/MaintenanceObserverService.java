package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.ObserverResult;
import io.stackwarden.orchestrator.domain.OperationMode;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.orchestrator.domain.StackNotFoundException;
import io.stackwarden.orchestrator.domain.StackOperationException;
import io.stackwarden.orchestrator.domain.StackRuntimeRecord;
import io.stackwarden.orchestrator.domain.StackStateStore;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.stack.model.DeploymentPlan;
import io.stackwarden.stack.model.MaintenanceObserverDefinition;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Runs the maintenance observers of deployed stacks and moves stacks between {@code NORMAL} and
 * {@code MAINTENANCE} when the observed value says so. Mode changes go through
 * {@link StackOperationService} so they take the environment lock and show up in the journal like
 * operator commands.
 */
public class MaintenanceObserverService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceObserverService.class);

    private final StackStateStore store;
    private final StackOperationService operations;
    private final MaintenanceObserverFactory factory;
    private final Clock clock;
    private final boolean enabled;
    private final Map<StackKey, Tracked> tracked = new ConcurrentHashMap<>();

    public MaintenanceObserverService(StackStateStore store,
                                      StackOperationService operations,
                                      MaintenanceObserverFactory factory,
                                      Clock clock,
                                      boolean enabled) {
        this.store = Objects.requireNonNull(store, "store");
        this.operations = Objects.requireNonNull(operations, "operations");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${stackwarden.orchestrator.observers.tick-interval:PT5S}",
        initialDelayString = "${stackwarden.orchestrator.observers.tick-interval:PT5S}")
    public void tick() {
        if (!enabled) {
            return;
        }
        Set<StackKey> observed = new HashSet<>();
        for (StackRuntimeRecord record : store.all()) {
            Optional<MaintenanceObserverDefinition> definition = observerOf(record);
            if (definition.isEmpty()) {
                continue;
            }
            observed.add(record.key());
            try {
                Tracked entry = track(record.key(), definition.get());
                if (entry.due()) {
                    apply(record, entry);
                }
            } catch (RuntimeException e) {
                log.warn("Maintenance observer of stack {} failed: {}", record.key(), e.getMessage(), e);
            }
        }
        tracked.keySet().retainAll(observed);
    }

    /**
     * Runs the stack's observer now, ignoring its poll interval. Empty when the stack's current plan
     * has no observer.
     */
    public Optional<ObserverResult> check(StackKey key) {
        StackRuntimeRecord record = store.find(key).orElseThrow(() -> StackNotFoundException.stack(key));
        Optional<MaintenanceObserverDefinition> definition = observerOf(record);
        if (definition.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(apply(record, track(key, definition.get())));
    }

    public Optional<ObserverResult> lastResult(StackKey key) {
        return Optional.ofNullable(tracked.get(key)).map(entry -> entry.lastResult);
    }

    private static Optional<MaintenanceObserverDefinition> observerOf(StackRuntimeRecord record) {
        if (!record.deployed()) {
            return Optional.empty();
        }
        return record.currentPlan().flatMap(DeploymentPlan::observer);
    }

    private Tracked track(StackKey key, MaintenanceObserverDefinition definition) {
        return tracked.compute(key, (k, existing) -> {
            if (existing != null && existing.observer.definition().equals(definition)) {
                return existing;
            }
            log.info("Watching stack {} with maintenance observer {} every {}", k,
                definition.settings().describe(), definition.pollInterval());
            return new Tracked(factory.create(definition));
        });
    }

    private ObserverResult apply(StackRuntimeRecord record, Tracked entry) {
        ObserverResult result = entry.observer.check();
        entry.lastResult = result;
        StackKey key = record.key();
        if (!result.success()) {
            log.warn("Maintenance observer of stack {} failed: {}", key, result.error());
            return result;
        }
        OperationMode mode = record.mode();
        if (result.maintenanceRequired() && mode == OperationMode.NORMAL) {
            log.info("Observer of stack {} reported '{}'; entering maintenance", key, result.observedValue());
            submit(key, "enter maintenance", () -> operations.enterMaintenance(key));
        } else if (!result.maintenanceRequired() && mode == OperationMode.MAINTENANCE) {
            log.info("Observer of stack {} reported '{}'; leaving maintenance", key, result.observedValue());
            submit(key, "exit maintenance", () -> operations.exitMaintenance(key));
        }
        return result;
    }

    private static void submit(StackKey key, String action, Runnable command) {
        try {
            command.run();
        } catch (StackOperationException e) {
            log.warn("Observer could not {} on stack {}: {}; retrying on the next check", action, key,
                e.getMessage());
        }
    }

    private final class Tracked {
        private final MaintenanceObserver observer;
        private volatile ObserverResult lastResult;

        private Tracked(MaintenanceObserver observer) {
            this.observer = observer;
        }

        private boolean due() {
            ObserverResult last = lastResult;
            return last == null
                || !clock.now().isBefore(last.checkedAt().plus(observer.definition().pollInterval()));
        }
    }
}
