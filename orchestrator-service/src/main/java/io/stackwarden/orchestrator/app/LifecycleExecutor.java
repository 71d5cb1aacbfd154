package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.ProgressEvent;
import io.stackwarden.orchestrator.domain.ProgressOutcome;
import io.stackwarden.orchestrator.domain.ProgressPhase;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.runtime.container.ContainerDetails;
import io.stackwarden.runtime.container.ContainerRuntimeException;
import io.stackwarden.runtime.container.ContainerSpec;
import io.stackwarden.runtime.container.ContainerSummary;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.runtime.ports.ContainerRuntime;
import io.stackwarden.runtime.ports.RegistryCredentialProvider;
import io.stackwarden.stack.model.DeploymentPlan;
import io.stackwarden.stack.model.DeploymentResult;
import io.stackwarden.stack.model.DeploymentStep;
import io.stackwarden.stack.model.ImageReference;
import io.stackwarden.stack.model.NetworkDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Realizes a {@link DeploymentPlan} against the container runtime, one step at a time and strictly
 * in plan order.
 * <p>
 * Execution stops at the first failing step. Containers started by earlier steps are left running;
 * the result lists exactly the contexts that completed. Init steps are started with an
 * {@code on-failure} restart policy and must exit with code 0 before the next step begins.
 */
public class LifecycleExecutor {
    private static final Logger log = LoggerFactory.getLogger(LifecycleExecutor.class);

    private final ContainerRuntime runtime;
    private final RegistryCredentialProvider credentials;
    private final Clock clock;
    private final ExecutorSettings settings;

    public LifecycleExecutor(ContainerRuntime runtime,
                             RegistryCredentialProvider credentials,
                             Clock clock,
                             ExecutorSettings settings) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public DeploymentResult execute(DeploymentPlan plan,
                                    DeploymentProgressListener listener,
                                    OperationCancellation cancellation) {
        Objects.requireNonNull(plan, "plan");
        DeploymentProgressListener progress = listener == null ? DeploymentProgressListener.noop() : listener;
        OperationCancellation token = cancellation == null ? OperationCancellation.none() : cancellation;
        StackKey key = new StackKey(plan.environmentId(), plan.stackName());
        List<String> deployed = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        log.info("Executing plan for stack {} version {}: {} step(s)", key, plan.stackVersion(), plan.steps().size());

        try {
            ensureNetworks(key, plan, progress);
        } catch (StepFailure failure) {
            errors.add(failure.getMessage());
            skip(plan.steps(), 0, progress, "network setup failed");
            return finish(key, plan, deployed, errors, warnings);
        }

        List<DeploymentStep> steps = plan.steps();
        for (int i = 0; i < steps.size(); i++) {
            DeploymentStep step = steps.get(i);
            if (token.isCancelled()) {
                errors.add("cancelled before step '" + step.contextName() + "'");
                skip(steps, i, progress, "operation cancelled");
                break;
            }
            try {
                runStep(key, step, progress, warnings);
                deployed.add(step.contextName());
            } catch (StepFailure failure) {
                errors.add(failure.getMessage());
                skip(steps, i + 1, progress, "previous step '" + step.contextName() + "' failed");
                break;
            }
        }
        return finish(key, plan, deployed, errors, warnings);
    }

    private void ensureNetworks(StackKey key, DeploymentPlan plan, DeploymentProgressListener progress) {
        for (Map.Entry<String, NetworkDefinition> entry : plan.networks().entrySet()) {
            NetworkDefinition network = entry.getValue();
            String name = network.resolvedName();
            if (network.external()) {
                log.info("Network {} is external; not managing it", name);
                emit(progress, name, ProgressPhase.NETWORK, ProgressOutcome.SKIPPED, "External network");
                continue;
            }
            try {
                if (runtime.networkExists(name)) {
                    log.debug("Network {} already exists", name);
                    continue;
                }
                runtime.createNetwork(name, StackContainers.selector(key));
                log.info("Created network {} for stack {}", name, key);
                emit(progress, name, ProgressPhase.NETWORK, ProgressOutcome.SUCCEEDED, "Created network " + name);
            } catch (ContainerRuntimeException e) {
                String message = "network '" + name + "': " + e.getMessage();
                log.error("Failed to prepare network {} for stack {}: {}", name, key, e.getMessage());
                emit(progress, name, ProgressPhase.NETWORK, ProgressOutcome.FAILED, e.getMessage());
                throw new StepFailure(message, e);
            }
        }
    }

    private void runStep(StackKey key,
                         DeploymentStep step,
                         DeploymentProgressListener progress,
                         List<String> warnings) {
        String context = step.contextName();
        ImageReference image = step.imageReference();
        pull(step, image, progress, warnings);
        removeExisting(step, progress);
        String containerId = create(key, step, image, progress);
        start(step, containerId, progress);
        if (step.init()) {
            awaitExit(step, containerId, progress);
            log.info("Init container {} ({}) from {} completed", context, step.containerName(), image);
            emit(progress, context, ProgressPhase.COMPLETE, ProgressOutcome.SUCCEEDED, "Completed " + image);
            return;
        }
        verify(step, containerId, progress);
        log.info("Deployed {} ({}) from {}", context, step.containerName(), image);
        emit(progress, context, ProgressPhase.COMPLETE, ProgressOutcome.SUCCEEDED, "Deployed " + image);
    }

    private void pull(DeploymentStep step,
                      ImageReference image,
                      DeploymentProgressListener progress,
                      List<String> warnings) {
        String context = step.contextName();
        emit(progress, context, ProgressPhase.PULL, ProgressOutcome.STARTED, "Pulling " + image);
        try {
            runtime.pullImage(image.name(), image.pullTag(),
                credentials.credentialsFor(image.toString()).orElse(null));
            emit(progress, context, ProgressPhase.PULL, ProgressOutcome.SUCCEEDED, "Pulled " + image);
        } catch (ContainerRuntimeException e) {
            if (localImageExists(image)) {
                String warning = "Pull of " + image + " failed (" + e.getMessage() + "); using local image";
                log.warn("{}: {}", context, warning);
                warnings.add(context + ": " + warning);
                emit(progress, context, ProgressPhase.PULL, ProgressOutcome.WARNING, warning);
                return;
            }
            throw fail(progress, context, ProgressPhase.PULL, "pull of " + image + " failed", e);
        }
    }

    private boolean localImageExists(ImageReference image) {
        try {
            return runtime.imageExists(image.runReference());
        } catch (ContainerRuntimeException e) {
            log.debug("Unable to check for local image {}: {}", image, e.getMessage());
            return false;
        }
    }

    private void removeExisting(DeploymentStep step, DeploymentProgressListener progress) {
        String context = step.contextName();
        try {
            Optional<ContainerSummary> existing = runtime.findContainer(step.containerName());
            if (existing.isEmpty()) {
                return;
            }
            ContainerSummary container = existing.get();
            if (container.running()) {
                runtime.stopContainer(container.id(), settings.stopTimeout());
            }
            runtime.removeContainer(container.id(), true);
            log.info("Removed previous container {} of {}", step.containerName(), context);
            emit(progress, context, ProgressPhase.REMOVE_EXISTING, ProgressOutcome.SUCCEEDED,
                "Removed previous container " + step.containerName());
        } catch (ContainerRuntimeException e) {
            throw fail(progress, context, ProgressPhase.REMOVE_EXISTING,
                "removing previous container " + step.containerName() + " failed", e);
        }
    }

    private String create(StackKey key,
                          DeploymentStep step,
                          ImageReference image,
                          DeploymentProgressListener progress) {
        String context = step.contextName();
        ContainerSpec.Builder spec = ContainerSpec.builder(step.containerName(), image.runReference())
            .env(step.env())
            .labels(StackContainers.containerLabels(key, step))
            .restartPolicy(step.init() ? ContainerSpec.RESTART_ON_FAILURE : ContainerSpec.RESTART_UNLESS_STOPPED);
        for (String port : step.ports()) {
            if (port.contains(":")) {
                spec.portBindings(List.of(port));
            } else {
                spec.exposedPorts(List.of(port));
            }
        }
        step.volumes().forEach((source, target) -> spec.bind(source + ":" + target));
        if (!step.networks().isEmpty()) {
            spec.networkMode(step.networks().get(0)).networkAliases(List.of(context));
        }
        try {
            String id = runtime.createContainer(spec.build());
            emit(progress, context, ProgressPhase.CREATE, ProgressOutcome.SUCCEEDED, "Created " + step.containerName());
            return id;
        } catch (ContainerRuntimeException e) {
            throw fail(progress, context, ProgressPhase.CREATE, "create of " + step.containerName() + " failed", e);
        }
    }

    private void start(DeploymentStep step, String containerId, DeploymentProgressListener progress) {
        String context = step.contextName();
        try {
            List<String> networks = step.networks();
            for (int i = 1; i < networks.size(); i++) {
                runtime.connectNetwork(networks.get(i), containerId, List.of(context));
            }
            runtime.startContainer(containerId);
            emit(progress, context, ProgressPhase.START, ProgressOutcome.SUCCEEDED, "Started " + step.containerName());
        } catch (ContainerRuntimeException e) {
            throw fail(progress, context, ProgressPhase.START, "start of " + step.containerName() + " failed", e);
        }
    }

    private void verify(DeploymentStep step, String containerId, DeploymentProgressListener progress) {
        if (!settings.verifyLiveness()) {
            return;
        }
        String context = step.contextName();
        int polls = settings.livenessPolls();
        for (int attempt = 1; attempt <= polls; attempt++) {
            ContainerDetails details;
            try {
                details = runtime.inspectContainer(containerId);
            } catch (ContainerRuntimeException e) {
                throw fail(progress, context, ProgressPhase.VERIFY, "inspect of " + step.containerName() + " failed", e);
            }
            if (details.running()) {
                emit(progress, context, ProgressPhase.VERIFY, ProgressOutcome.SUCCEEDED, "Container is running");
                return;
            }
            if ("exited".equals(details.state()) || "dead".equals(details.state())) {
                throw fail(progress, context, ProgressPhase.VERIFY,
                    step.containerName() + " stopped right after start (" + details.state() + ")", null);
            }
            log.debug("Waiting for {} to run (attempt {}/{}, state {})", step.containerName(), attempt, polls,
                details.state());
            if (attempt < polls && !pause()) {
                throw fail(progress, context, ProgressPhase.VERIFY, "interrupted while verifying "
                    + step.containerName(), null);
            }
        }
        throw fail(progress, context, ProgressPhase.VERIFY,
            step.containerName() + " not running after " + settings.livenessTimeout(), null);
    }

    /**
     * Waits for an init container to run to completion. A restart means an earlier run already
     * failed, so it counts as a failure rather than another wait.
     */
    private void awaitExit(DeploymentStep step, String containerId, DeploymentProgressListener progress) {
        String context = step.contextName();
        int polls = settings.initPolls();
        emit(progress, context, ProgressPhase.AWAIT_EXIT, ProgressOutcome.STARTED,
            "Waiting for init container " + step.containerName() + " to exit");
        for (int attempt = 1; attempt <= polls; attempt++) {
            ContainerDetails details;
            try {
                details = runtime.inspectContainer(containerId);
            } catch (ContainerRuntimeException e) {
                throw fail(progress, context, ProgressPhase.AWAIT_EXIT,
                    "inspect of init container " + step.containerName() + " failed", e);
            }
            if (details.completedSuccessfully()) {
                emit(progress, context, ProgressPhase.AWAIT_EXIT, ProgressOutcome.SUCCEEDED, "Exited with code 0");
                return;
            }
            if (details.restartCount() > 0 || "restarting".equals(details.state())
                || (!details.running() && details.exitCode() != null)
                || "dead".equals(details.state())) {
                stopQuietly(step, containerId);
                String code = details.exitCode() == null ? details.state() : "exit code " + details.exitCode();
                throw fail(progress, context, ProgressPhase.AWAIT_EXIT,
                    "init container " + step.containerName() + " failed with " + code, null);
            }
            log.debug("Waiting for init container {} to exit (attempt {}/{}, state {})", step.containerName(),
                attempt, polls, details.state());
            if (attempt < polls && !pause()) {
                throw fail(progress, context, ProgressPhase.AWAIT_EXIT, "interrupted while waiting for "
                    + step.containerName(), null);
            }
        }
        stopQuietly(step, containerId);
        throw fail(progress, context, ProgressPhase.AWAIT_EXIT,
            "init container " + step.containerName() + " still running after " + settings.initTimeout(), null);
    }

    private void stopQuietly(DeploymentStep step, String containerId) {
        try {
            runtime.stopContainer(containerId, settings.stopTimeout());
        } catch (ContainerRuntimeException e) {
            log.warn("Unable to stop failed init container {}: {}", step.containerName(), e.getMessage());
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(settings.livenessPollInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private StepFailure fail(DeploymentProgressListener progress,
                             String context,
                             ProgressPhase phase,
                             String message,
                             ContainerRuntimeException cause) {
        String detail = cause == null ? message : message + ": " + cause.getMessage();
        log.error("Step {} failed during {}: {}", context, phase, detail);
        emit(progress, context, phase, ProgressOutcome.FAILED, detail);
        return new StepFailure(context + ": " + detail, cause);
    }

    private void skip(List<DeploymentStep> steps, int from, DeploymentProgressListener progress, String reason) {
        for (int i = from; i < steps.size(); i++) {
            emit(progress, steps.get(i).contextName(), ProgressPhase.COMPLETE, ProgressOutcome.SKIPPED, reason);
        }
    }

    private DeploymentResult finish(StackKey key,
                                    DeploymentPlan plan,
                                    List<String> deployed,
                                    List<String> errors,
                                    List<String> warnings) {
        DeploymentResult result = new DeploymentResult(errors.isEmpty(), plan.stackVersion(), deployed, errors,
            warnings, clock.now());
        if (result.success()) {
            log.info("Plan for stack {} version {} completed: {}", key, plan.stackVersion(), deployed);
        } else {
            log.error("Plan for stack {} version {} failed after {}: {}", key, plan.stackVersion(), deployed, errors);
        }
        return result;
    }

    private void emit(DeploymentProgressListener progress,
                      String step,
                      ProgressPhase phase,
                      ProgressOutcome outcome,
                      String message) {
        try {
            progress.onProgress(new ProgressEvent(step, phase, outcome, message, clock.now()));
        } catch (RuntimeException e) {
            log.warn("Progress listener rejected {} {} event for {}: {}", phase, outcome, step, e.getMessage());
        }
    }

    private static final class StepFailure extends RuntimeException {
        StepFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
