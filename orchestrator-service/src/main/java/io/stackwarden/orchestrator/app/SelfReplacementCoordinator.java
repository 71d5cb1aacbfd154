package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.ReasonCode;
import io.stackwarden.runtime.container.ContainerDetails;
import io.stackwarden.runtime.container.ContainerRuntimeException;
import io.stackwarden.runtime.container.ContainerSpec;
import io.stackwarden.runtime.container.ContainerSummary;
import io.stackwarden.runtime.ports.ContainerRuntime;
import io.stackwarden.runtime.ports.RegistryCredentialProvider;
import io.stackwarden.stack.model.ImageReference;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares an upgrade of the orchestrator's own container.
 * <p>
 * A process cannot replace the container it runs in, so the coordinator only creates the
 * replacement container from its own configuration and launches a short-lived helper container
 * that performs the swap. The coordinator's responsibility ends once the helper is running.
 */
public class SelfReplacementCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SelfReplacementCoordinator.class);

    static final String REPLACEMENT_SUFFIX = "-replacement";
    static final String HELPER_SUFFIX = "-replacement-helper";
    static final String ENV_OLD_CONTAINER = "OLD_CONTAINER";
    static final String ENV_NEW_CONTAINER = "NEW_CONTAINER";

    private final ContainerRuntime runtime;
    private final RegistryCredentialProvider credentials;
    private final SelfReplacementSettings settings;
    private final Function<String, String> environment;

    public SelfReplacementCoordinator(ContainerRuntime runtime,
                                      RegistryCredentialProvider credentials,
                                      SelfReplacementSettings settings) {
        this(runtime, credentials, settings, System::getenv);
    }

    SelfReplacementCoordinator(ContainerRuntime runtime,
                               RegistryCredentialProvider credentials,
                               SelfReplacementSettings settings,
                               Function<String, String> environment) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public SelfReplacementResult replace(String targetVersion) {
        if (targetVersion == null || targetVersion.isBlank()) {
            return SelfReplacementResult.rejected(ReasonCode.RUNTIME_FAILURE, "target version must not be blank");
        }
        String ownId = settings.containerId() != null ? settings.containerId() : environment.apply("HOSTNAME");
        if (ownId == null || ownId.isBlank()) {
            return SelfReplacementResult.rejected(ReasonCode.RUNTIME_FAILURE,
                "Unable to determine own container id; configure it or set HOSTNAME");
        }

        ContainerDetails self;
        try {
            self = runtime.inspectContainer(ownId);
        } catch (ContainerRuntimeException e) {
            log.error("Unable to inspect own container {}: {}", ownId, e.getMessage());
            return SelfReplacementResult.rejected(ReasonCode.RUNTIME_FAILURE,
                "Unable to inspect own container " + ownId + ": " + e.getMessage());
        }

        ImageReference target = new ImageReference(settings.imageRepository(), targetVersion);
        try {
            runtime.pullImage(target.name(), target.tag(), credentials.credentialsFor(target.toString()).orElse(null));
        } catch (ContainerRuntimeException e) {
            log.error("Unable to pull {}: {}", target, e.getMessage());
            return SelfReplacementResult.rejected(ReasonCode.RUNTIME_FAILURE,
                "Unable to pull " + target + ": " + e.getMessage());
        }

        String replacementName = self.name() + REPLACEMENT_SUFFIX;
        String helperName = self.name() + HELPER_SUFFIX;
        String replacementId;
        try {
            removeLeftover(replacementName);
            replacementId = runtime.createContainer(replacementSpec(self, replacementName, target));
            connectSecondaryNetworks(self, replacementId);
        } catch (ContainerRuntimeException e) {
            log.error("Unable to create replacement container {}: {}", replacementName, e.getMessage());
            return SelfReplacementResult.rejected(ReasonCode.RUNTIME_FAILURE,
                "Unable to create replacement container " + replacementName + ": " + e.getMessage());
        }

        try {
            removeLeftover(helperName);
            ensureHelperImage();
            String helperId = runtime.createContainer(helperSpec(helperName, self.name(), replacementName));
            runtime.startContainer(helperId);
        } catch (ContainerRuntimeException e) {
            log.error("Unable to launch replacement helper {}: {}", helperName, e.getMessage());
            removeLeftover(replacementName);
            return SelfReplacementResult.rejected(ReasonCode.RUNTIME_FAILURE,
                "Unable to launch replacement helper " + helperName + ": " + e.getMessage());
        }

        log.info("Self-replacement to {} handed over to helper {} (replacement {})", target, helperName,
            replacementName);
        return SelfReplacementResult.accepted("Replacing " + self.name() + " with " + target, replacementName,
            helperName);
    }

    private ContainerSpec replacementSpec(ContainerDetails self, String name, ImageReference image) {
        String primary = self.primaryNetwork();
        ContainerSpec.Builder spec = ContainerSpec.builder(name, image.toString())
            .env(self.envAsMap())
            .labels(self.labels())
            .exposedPorts(self.exposedPorts())
            .portBindings(self.portBindings())
            .binds(self.binds())
            .restartPolicy(self.restartPolicy())
            .networkMode(primary);
        List<String> aliases = primary == null ? null : self.networkAliases().get(primary);
        if (aliases != null) {
            spec.networkAliases(aliases);
        }
        return spec.build();
    }

    private void connectSecondaryNetworks(ContainerDetails self, String replacementId) {
        String primary = self.primaryNetwork();
        for (Map.Entry<String, List<String>> network : self.networkAliases().entrySet()) {
            if (network.getKey().equals(primary)) {
                continue;
            }
            try {
                runtime.connectNetwork(network.getKey(), replacementId, network.getValue());
            } catch (ContainerRuntimeException e) {
                log.warn("Unable to connect replacement to network {}: {}", network.getKey(), e.getMessage());
            }
        }
    }

    private ContainerSpec helperSpec(String helperName, String oldName, String newName) {
        String socket = settings.socketPath();
        return ContainerSpec.builder(helperName, settings.helperImage())
            .env(ENV_OLD_CONTAINER, oldName)
            .env(ENV_NEW_CONTAINER, newName)
            .networkMode("host")
            .bind(socket + ":" + socket)
            .autoRemove(true)
            .build();
    }

    private void ensureHelperImage() {
        if (runtime.imageExists(settings.helperImage())) {
            return;
        }
        ImageReference helper = ImageReference.parse(settings.helperImage(), null);
        log.info("Pulling replacement helper image {}", helper);
        runtime.pullImage(helper.name(), helper.pullTag(), credentials.credentialsFor(helper.toString()).orElse(null));
    }

    private void removeLeftover(String nameOrId) {
        try {
            Optional<ContainerSummary> leftover = runtime.findContainer(nameOrId);
            if (leftover.isPresent()) {
                runtime.removeContainer(leftover.get().id(), true);
                log.info("Removed leftover container {}", nameOrId);
            }
        } catch (ContainerRuntimeException e) {
            log.warn("Unable to remove leftover container {}: {}", nameOrId, e.getMessage());
        }
    }
}
