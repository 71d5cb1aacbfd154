package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.ProgressEvent;

/**
 * Receives progress events of a running operation in emission order.
 */
@FunctionalInterface
public interface DeploymentProgressListener {

    void onProgress(ProgressEvent event);

    static DeploymentProgressListener noop() {
        return event -> {
        };
    }
}
