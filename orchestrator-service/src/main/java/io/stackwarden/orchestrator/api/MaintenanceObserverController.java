package io.stackwarden.orchestrator.api;

import io.stackwarden.orchestrator.app.MaintenanceObserverService;
import io.stackwarden.orchestrator.domain.ObserverResult;
import io.stackwarden.orchestrator.domain.StackKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Last result of a stack's maintenance observer, and an on-demand check. Both answer {@code 404}
 * when the deployed plan has no observer.
 */
@RestController
@RequestMapping("/api/environments/{environmentId}/stacks/{stack}/maintenance-observer")
public class MaintenanceObserverController {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceObserverController.class);

    private final MaintenanceObserverService observers;

    public MaintenanceObserverController(MaintenanceObserverService observers) {
        this.observers = observers;
    }

    @GetMapping
    public ResponseEntity<ObserverResult> lastResult(@PathVariable String environmentId, @PathVariable String stack) {
        return observers.lastResult(new StackKey(environmentId, stack))
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/check")
    public ResponseEntity<ObserverResult> check(@PathVariable String environmentId, @PathVariable String stack) {
        log.info("[REST] POST /api/environments/{}/stacks/{}/maintenance-observer/check", environmentId, stack);
        return observers.check(new StackKey(environmentId, stack))
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
