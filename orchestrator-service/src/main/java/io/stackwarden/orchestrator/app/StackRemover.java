package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.ProgressEvent;
import io.stackwarden.orchestrator.domain.ProgressOutcome;
import io.stackwarden.orchestrator.domain.ProgressPhase;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.runtime.container.ContainerRuntimeException;
import io.stackwarden.runtime.container.ContainerSummary;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.runtime.ports.ContainerRuntime;
import io.stackwarden.stack.model.DeploymentResult;
import io.stackwarden.stack.model.StackLabels;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tears down every container labelled with a stack. One container failing to go away does not
 * keep the others running.
 */
public class StackRemover {
    private static final Logger log = LoggerFactory.getLogger(StackRemover.class);

    private final ContainerRuntime runtime;
    private final Clock clock;
    private final Duration stopTimeout;

    public StackRemover(ContainerRuntime runtime, Clock clock, Duration stopTimeout) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
    }

    public DeploymentResult remove(StackKey key, String stackVersion, DeploymentProgressListener listener) {
        DeploymentProgressListener progress = listener == null ? DeploymentProgressListener.noop() : listener;
        List<ContainerSummary> containers;
        try {
            containers = runtime.listContainers(StackContainers.selector(key));
        } catch (ContainerRuntimeException e) {
            log.error("Unable to list containers of stack {}: {}", key, e.getMessage());
            return DeploymentResult.failure(stackVersion, "listing containers failed: " + e.getMessage(), clock.now());
        }
        List<String> removed = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (ContainerSummary container : containers) {
            String context = container.label(StackLabels.CONTEXT) == null
                ? container.name()
                : container.label(StackLabels.CONTEXT);
            try {
                if (container.running()) {
                    runtime.stopContainer(container.id(), stopTimeout);
                }
                runtime.removeContainer(container.id(), true);
                removed.add(context);
                log.info("Removed container {} of stack {}", container.name(), key);
                progress.onProgress(new ProgressEvent(context, ProgressPhase.REMOVE, ProgressOutcome.SUCCEEDED,
                    "Removed " + container.name(), clock.now()));
            } catch (ContainerRuntimeException e) {
                errors.add(context + ": " + e.getMessage());
                log.error("Failed to remove container {} of stack {}: {}", container.name(), key, e.getMessage());
                progress.onProgress(new ProgressEvent(context, ProgressPhase.REMOVE, ProgressOutcome.FAILED,
                    e.getMessage(), clock.now()));
            }
        }
        return new DeploymentResult(errors.isEmpty(), stackVersion, removed, errors, List.of(), clock.now());
    }
}
