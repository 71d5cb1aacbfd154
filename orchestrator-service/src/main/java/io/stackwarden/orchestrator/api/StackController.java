package io.stackwarden.orchestrator.api;

import io.stackwarden.orchestrator.app.HealthMonitor;
import io.stackwarden.orchestrator.app.OperationHandle;
import io.stackwarden.orchestrator.app.StackOperationService;
import io.stackwarden.orchestrator.domain.EnvironmentContext;
import io.stackwarden.orchestrator.domain.EnvironmentHealthSummary;
import io.stackwarden.orchestrator.domain.HealthSnapshot;
import io.stackwarden.orchestrator.domain.OperationRecord;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.stack.model.ResolvedStack;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of stack lifecycle commands and health queries. Commands answer {@code 202} with
 * an {@link OperationHandle}; progress is read back through {@code operations/{id}}.
 */
@RestController
@RequestMapping("/api/environments/{environmentId}")
public class StackController {
    private static final Logger log = LoggerFactory.getLogger(StackController.class);

    private final StackOperationService operations;
    private final HealthMonitor health;

    public StackController(StackOperationService operations, HealthMonitor health) {
        this.operations = operations;
        this.health = health;
    }

    @PostMapping("/stacks/{stack}/deploy")
    public ResponseEntity<OperationHandle> deploy(@PathVariable String environmentId,
                                                  @PathVariable String stack,
                                                  @Valid @RequestBody DeployRequest request) {
        log.info("[REST] POST /api/environments/{}/stacks/{}/deploy version={}", environmentId, stack,
            request.stack().stackVersion());
        requireMatchingName(stack, request.stack());
        EnvironmentContext environment = new EnvironmentContext(request.organizationId(), environmentId);
        return accepted(operations.deploy(request.stack(), environment));
    }

    @PostMapping("/stacks/{stack}/upgrade")
    public ResponseEntity<OperationHandle> upgrade(@PathVariable String environmentId,
                                                   @PathVariable String stack,
                                                   @Valid @RequestBody UpgradeRequest request) {
        log.info("[REST] POST /api/environments/{}/stacks/{}/upgrade target={}", environmentId, stack,
            request.targetVersion());
        requireMatchingName(stack, request.stack());
        EnvironmentContext environment = new EnvironmentContext(request.organizationId(), environmentId);
        return accepted(operations.upgrade(environment, request.targetVersion(), request.stack()));
    }

    @PostMapping("/stacks/{stack}/rollback")
    public ResponseEntity<OperationHandle> rollback(@PathVariable String environmentId, @PathVariable String stack) {
        return command("rollback", environmentId, stack, operations::rollback);
    }

    @PostMapping("/stacks/{stack}/maintenance")
    public ResponseEntity<OperationHandle> enterMaintenance(@PathVariable String environmentId,
                                                            @PathVariable String stack) {
        return command("maintenance", environmentId, stack, operations::enterMaintenance);
    }

    @DeleteMapping("/stacks/{stack}/maintenance")
    public ResponseEntity<OperationHandle> exitMaintenance(@PathVariable String environmentId,
                                                           @PathVariable String stack) {
        return command("maintenance (exit)", environmentId, stack, operations::exitMaintenance);
    }

    @PostMapping("/stacks/{stack}/stop")
    public ResponseEntity<OperationHandle> stop(@PathVariable String environmentId, @PathVariable String stack) {
        return command("stop", environmentId, stack, operations::stop);
    }

    @PostMapping("/stacks/{stack}/start")
    public ResponseEntity<OperationHandle> start(@PathVariable String environmentId, @PathVariable String stack) {
        return command("start", environmentId, stack, operations::start);
    }

    @PostMapping("/stacks/{stack}/recover")
    public ResponseEntity<OperationHandle> recover(@PathVariable String environmentId, @PathVariable String stack) {
        return command("recover", environmentId, stack, operations::recover);
    }

    @DeleteMapping("/stacks/{stack}")
    public ResponseEntity<OperationHandle> remove(@PathVariable String environmentId, @PathVariable String stack) {
        return command("remove", environmentId, stack, operations::remove);
    }

    @GetMapping("/stacks/{stack}")
    public StackStatusResponse status(@PathVariable String environmentId, @PathVariable String stack) {
        return StackStatusResponse.from(operations.status(new StackKey(environmentId, stack)));
    }

    @GetMapping("/stacks/{stack}/health")
    public HealthSnapshot stackHealth(@PathVariable String environmentId, @PathVariable String stack) {
        StackKey key = new StackKey(environmentId, stack);
        return health.latest(key).orElseGet(() -> health.refresh(key));
    }

    @GetMapping("/stacks/{stack}/health/history")
    public List<HealthSnapshot> healthHistory(@PathVariable String environmentId,
                                              @PathVariable String stack,
                                              @RequestParam(required = false)
                                              @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        return health.since(new StackKey(environmentId, stack), since);
    }

    @GetMapping("/stacks/{stack}/operations")
    public List<OperationRecord> stackOperations(@PathVariable String environmentId, @PathVariable String stack) {
        return operations.operations(new StackKey(environmentId, stack));
    }

    @GetMapping("/stacks/{stack}/operations/{operationId}")
    public ResponseEntity<OperationRecord> operation(@PathVariable String environmentId,
                                                     @PathVariable String stack,
                                                     @PathVariable String operationId) {
        return operations.operation(operationId)
            .filter(record -> new StackKey(environmentId, stack).equals(record.stack()))
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/stacks/{stack}/operations/{operationId}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String environmentId,
                                       @PathVariable String stack,
                                       @PathVariable String operationId) {
        log.info("[REST] POST /api/environments/{}/stacks/{}/operations/{}/cancel", environmentId, stack, operationId);
        boolean owned = operations.operation(operationId)
            .filter(record -> new StackKey(environmentId, stack).equals(record.stack()))
            .isPresent();
        if (!owned) {
            log.info("[REST] operation {} does not belong to {}/{}", operationId, environmentId, stack);
            return ResponseEntity.notFound().build();
        }
        return operations.cancel(operationId)
            ? ResponseEntity.accepted().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/health")
    public EnvironmentHealthSummary environmentHealth(@PathVariable String environmentId) {
        return health.environment(environmentId);
    }

    private ResponseEntity<OperationHandle> command(String name,
                                                    String environmentId,
                                                    String stack,
                                                    Function<StackKey, OperationHandle> action) {
        log.info("[REST] {} of stack {}/{}", name, environmentId, stack);
        return accepted(action.apply(new StackKey(environmentId, stack)));
    }

    private static ResponseEntity<OperationHandle> accepted(OperationHandle handle) {
        log.info("[REST] accepted operation {} on {}", handle.operationId(), handle.stack());
        return ResponseEntity.accepted().body(handle);
    }

    private static void requireMatchingName(String stack, ResolvedStack body) {
        if (!stack.equals(body.stackName())) {
            throw new IllegalArgumentException(
                "stack name '" + body.stackName() + "' in the body does not match path '" + stack + "'");
        }
    }

    public record DeployRequest(String organizationId, @NotNull @Valid ResolvedStack stack) {
    }

    public record UpgradeRequest(String organizationId,
                                 @NotBlank String targetVersion,
                                 @NotNull @Valid ResolvedStack stack) {
    }
}
