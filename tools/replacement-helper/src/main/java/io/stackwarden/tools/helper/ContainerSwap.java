package io.stackwarden.tools.helper;

import io.stackwarden.runtime.container.ContainerDetails;
import io.stackwarden.runtime.container.ContainerRuntimeException;
import io.stackwarden.runtime.ports.ContainerRuntime;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Swaps a running container for a prepared (created, not started) replacement.
 * <p>
 * The old container is stopped and kept as {@code <old>-previous} until the replacement, renamed to
 * the old name, reports running. Any failure after the old container stopped puts the previous
 * container back under its name and starts it again.
 */
public class ContainerSwap {
    private static final Logger log = LoggerFactory.getLogger(ContainerSwap.class);

    static final String PREVIOUS_SUFFIX = "-previous";

    private final ContainerRuntime runtime;
    private final SwapSettings settings;

    public ContainerSwap(ContainerRuntime runtime, SwapSettings settings) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public SwapOutcome swap(String oldName, String newName) {
        String previousName = oldName + PREVIOUS_SUFFIX;
        log.info("Swapping container {} for {}", oldName, newName);

        boolean oldExists;
        try {
            runtime.inspectContainer(newName);
            oldExists = stopOld(oldName);
            removeLeftover(previousName);
            if (oldExists) {
                runtime.renameContainer(oldName, previousName);
            }
        } catch (ContainerRuntimeException e) {
            log.error("Swap of {} aborted before the replacement was touched: {}", oldName, e.getMessage(), e);
            return restartOld(oldName);
        }

        boolean renamed = false;
        try {
            runtime.renameContainer(newName, oldName);
            renamed = true;
            runtime.startContainer(oldName);
            awaitRunning(oldName);
        } catch (ContainerRuntimeException | IllegalStateException e) {
            log.error("Replacement {} failed to start as {}: {}", newName, oldName, e.getMessage(), e);
            if (!oldExists) {
                return SwapOutcome.RESTORE_FAILED;
            }
            return restorePrevious(oldName, newName, previousName, renamed);
        }

        if (oldExists) {
            try {
                runtime.removeContainer(previousName, true);
            } catch (ContainerRuntimeException e) {
                log.warn("Swap succeeded but previous container {} could not be removed: {}", previousName,
                    e.getMessage());
            }
        }
        log.info("Container {} now runs the replacement", oldName);
        return SwapOutcome.SWAPPED;
    }

    private boolean stopOld(String oldName) {
        ContainerDetails old;
        try {
            old = runtime.inspectContainer(oldName);
        } catch (ContainerRuntimeException e) {
            if (e.isNotFound()) {
                log.warn("Old container {} does not exist; starting the replacement without a fallback", oldName);
                return false;
            }
            throw e;
        }
        int polls = settings.polls(settings.stopGrace());
        for (int i = 0; i < polls && old.running(); i++) {
            pause();
            old = runtime.inspectContainer(oldName);
        }
        if (old.running()) {
            log.info("Stopping old container {}", oldName);
            runtime.stopContainer(oldName, settings.stopTimeout());
        }
        return true;
    }

    private void removeLeftover(String name) {
        Optional<?> leftover = runtime.findContainer(name);
        if (leftover.isPresent()) {
            log.warn("Removing leftover container {}", name);
            runtime.removeContainer(name, true);
        }
    }

    private void awaitRunning(String name) {
        int polls = settings.polls(settings.startTimeout());
        for (int i = 0; i < polls; i++) {
            ContainerDetails details = runtime.inspectContainer(name);
            if (details.running()) {
                return;
            }
            if ("exited".equals(details.state()) || "dead".equals(details.state())) {
                throw new IllegalStateException("container " + name + " is " + details.state());
            }
            pause();
        }
        throw new IllegalStateException("container " + name + " not running after " + settings.startTimeout());
    }

    private SwapOutcome restorePrevious(String oldName, String newName, String previousName, boolean renamed) {
        try {
            if (renamed) {
                runtime.stopContainer(oldName, settings.stopTimeout());
                runtime.renameContainer(oldName, newName);
            }
            runtime.renameContainer(previousName, oldName);
            runtime.startContainer(oldName);
            log.info("Restored previous container {}; replacement kept as {}", oldName, newName);
            return SwapOutcome.RESTORED;
        } catch (ContainerRuntimeException e) {
            log.error("Restoring {} failed: {}", oldName, e.getMessage(), e);
            return SwapOutcome.RESTORE_FAILED;
        }
    }

    private SwapOutcome restartOld(String oldName) {
        try {
            runtime.startContainer(oldName);
            return SwapOutcome.RESTORED;
        } catch (ContainerRuntimeException e) {
            log.error("Restarting {} failed: {}", oldName, e.getMessage(), e);
            return SwapOutcome.RESTORE_FAILED;
        }
    }

    private void pause() {
        if (settings.pollInterval().isZero()) {
            return;
        }
        try {
            Thread.sleep(settings.pollInterval().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting", e);
        }
    }
}
