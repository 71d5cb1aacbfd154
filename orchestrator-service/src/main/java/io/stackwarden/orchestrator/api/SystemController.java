package io.stackwarden.orchestrator.api;

import io.stackwarden.orchestrator.app.OperationHandle;
import io.stackwarden.orchestrator.app.StackOperationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/system")
public class SystemController {
    private static final Logger log = LoggerFactory.getLogger(SystemController.class);

    private final StackOperationService operations;

    public SystemController(StackOperationService operations) {
        this.operations = operations;
    }

    @PostMapping("/self-replace")
    public ResponseEntity<OperationHandle> selfReplace(@Valid @RequestBody SelfReplaceRequest request) {
        log.info("[REST] POST /api/system/self-replace target={}", request.targetVersion());
        OperationHandle handle = operations.selfReplace(request.targetVersion());
        return ResponseEntity.accepted().body(handle);
    }

    public record SelfReplaceRequest(@NotBlank String targetVersion) {
    }
}
