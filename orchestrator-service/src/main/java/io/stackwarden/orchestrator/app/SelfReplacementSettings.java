package io.stackwarden.orchestrator.app;

import java.util.Objects;

/**
 * @param imageRepository repository the orchestrator image is pulled from; the target version is its tag
 * @param helperImage     image of the replacement helper
 * @param containerId     own container id, or {@code null} to read {@code HOSTNAME}
 * @param socketPath      container runtime socket mounted into the helper
 */
public record SelfReplacementSettings(String imageRepository,
                                      String helperImage,
                                      String containerId,
                                      String socketPath) {
    public SelfReplacementSettings {
        Objects.requireNonNull(imageRepository, "imageRepository");
        Objects.requireNonNull(helperImage, "helperImage");
        Objects.requireNonNull(socketPath, "socketPath");
    }
}
