package io.stackwarden.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.ListContainersCmd;
import com.github.dockerjava.api.command.PullImageCmd;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.BadRequestException;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.exception.UnauthorizedException;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerNetwork;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Network;
import com.github.dockerjava.api.model.PortBinding;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.RestartPolicy;
import io.stackwarden.runtime.container.ContainerDetails;
import io.stackwarden.runtime.container.ContainerRuntimeException;
import io.stackwarden.runtime.container.ContainerSpec;
import io.stackwarden.runtime.container.ContainerSummary;
import io.stackwarden.runtime.container.RegistryCredentials;
import io.stackwarden.runtime.container.RuntimeErrorCode;
import io.stackwarden.runtime.ports.ContainerRuntime;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ContainerRuntime} backed by docker-java.
 */
public class DockerContainerClient implements ContainerRuntime {
    private static final Logger log = LoggerFactory.getLogger(DockerContainerClient.class);
    private static final String DOCKER_HINT =
        "Ensure Docker is installed, running, and that the process can access the Docker socket "
            + "(for example /var/run/docker.sock) or an explicit DOCKER_HOST.";

    private final DockerClient dockerClient;
    private final DockerRuntimeSettings settings;

    public DockerContainerClient(DockerClient dockerClient) {
        this(dockerClient, DockerRuntimeSettings.defaults());
    }

    public DockerContainerClient(DockerClient dockerClient, DockerRuntimeSettings settings) {
        this.dockerClient = Objects.requireNonNull(dockerClient, "dockerClient");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public List<ContainerSummary> listContainers(Map<String, String> labels) {
        return callDocker("list containers", () -> {
            ListContainersCmd cmd = dockerClient.listContainersCmd().withShowAll(true);
            if (labels != null && !labels.isEmpty()) {
                cmd = cmd.withLabelFilter(labels);
            }
            List<Container> containers = cmd.exec();
            if (containers == null) {
                return List.of();
            }
            return containers.stream().map(DockerContainerClient::toSummary).toList();
        });
    }

    @Override
    public Optional<ContainerSummary> findContainer(String name) {
        return callDocker("find container " + name, () -> {
            List<Container> containers = dockerClient.listContainersCmd()
                .withShowAll(true)
                .withNameFilter(List.of(name))
                .exec();
            if (containers == null) {
                return Optional.<ContainerSummary>empty();
            }
            // the name filter matches substrings
            return containers.stream()
                .map(DockerContainerClient::toSummary)
                .filter(summary -> name.equals(summary.name()))
                .findFirst();
        });
    }

    @Override
    public ContainerDetails inspectContainer(String idOrName) {
        return callDocker("inspect container " + idOrName,
            () -> toDetails(dockerClient.inspectContainerCmd(idOrName).exec()));
    }

    @Override
    public String createContainer(ContainerSpec spec) {
        String label = spec.name() == null ? spec.image() : spec.name();
        return callDocker("create container " + label, () -> {
            HostConfig hostConfig = HostConfig.newHostConfig();
            Set<ExposedPort> exposed = new LinkedHashSet<>();
            for (String port : spec.exposedPorts()) {
                exposed.add(ExposedPort.parse(port));
            }
            if (!spec.portBindings().isEmpty()) {
                Ports ports = new Ports();
                for (String mapping : spec.portBindings()) {
                    PortBinding binding = PortBinding.parse(mapping);
                    ports.add(binding);
                    exposed.add(binding.getExposedPort());
                }
                hostConfig.withPortBindings(ports);
            }
            if (!spec.binds().isEmpty()) {
                hostConfig.withBinds(spec.binds().stream().map(Bind::parse).toList());
            }
            if (spec.restartPolicy() != null && !spec.restartPolicy().isBlank()) {
                hostConfig.withRestartPolicy(RestartPolicy.parse(spec.restartPolicy()));
            }
            if (spec.networkMode() != null && !spec.networkMode().isBlank()) {
                hostConfig.withNetworkMode(spec.networkMode());
            }
            if (spec.autoRemove()) {
                hostConfig.withAutoRemove(true);
            }
            CreateContainerCmd cmd = dockerClient.createContainerCmd(spec.image())
                .withHostConfig(hostConfig)
                .withEnv(toEnvArray(spec.env()))
                .withLabels(spec.labels());
            if (spec.name() != null && !spec.name().isBlank()) {
                cmd = cmd.withName(spec.name());
            }
            if (!exposed.isEmpty()) {
                cmd = cmd.withExposedPorts(new ArrayList<>(exposed));
            }
            if (!spec.networkAliases().isEmpty()) {
                cmd = cmd.withAliases(spec.networkAliases());
            }
            CreateContainerResponse response = cmd.exec();
            if (response.getWarnings() != null) {
                for (String warning : response.getWarnings()) {
                    log.warn("Docker warning while creating {}: {}", label, warning);
                }
            }
            return response.getId();
        });
    }

    @Override
    public void startContainer(String idOrName) {
        callDocker("start container " + idOrName, () -> {
            try {
                dockerClient.startContainerCmd(idOrName).exec();
            } catch (NotModifiedException e) {
                log.debug("Container {} already running", idOrName);
            }
        });
    }

    @Override
    public void stopContainer(String idOrName, Duration timeout) {
        callDocker("stop container " + idOrName, () -> {
            try {
                dockerClient.stopContainerCmd(idOrName).withTimeout((int) timeout.toSeconds()).exec();
            } catch (NotModifiedException e) {
                log.debug("Container {} already stopped", idOrName);
            }
        });
    }

    @Override
    public void removeContainer(String idOrName, boolean force) {
        callDocker("remove container " + idOrName,
            () -> dockerClient.removeContainerCmd(idOrName).withForce(force).exec());
    }

    @Override
    public void renameContainer(String idOrName, String newName) {
        callDocker("rename container " + idOrName,
            () -> dockerClient.renameContainerCmd(idOrName).withName(newName).exec());
    }

    @Override
    public boolean networkExists(String name) {
        return callDocker("inspect network " + name, () -> {
            List<Network> networks = dockerClient.listNetworksCmd().withNameFilter(name).exec();
            return networks != null && networks.stream().anyMatch(network -> name.equals(network.getName()));
        });
    }

    @Override
    public void createNetwork(String name, Map<String, String> labels) {
        callDocker("create network " + name, () -> dockerClient.createNetworkCmd()
            .withName(name)
            .withDriver("bridge")
            .withLabels(labels == null ? Map.of() : labels)
            .exec());
    }

    @Override
    public void connectNetwork(String network, String containerId, List<String> aliases) {
        callDocker("connect " + containerId + " to network " + network, () -> {
            ContainerNetwork endpoint = new ContainerNetwork();
            if (aliases != null && !aliases.isEmpty()) {
                endpoint.withAliases(aliases);
            }
            dockerClient.connectToNetworkCmd()
                .withNetworkId(network)
                .withContainerId(containerId)
                .withContainerNetwork(endpoint)
                .exec();
        });
    }

    @Override
    public void pullImage(String image, String tag, RegistryCredentials credentials) {
        String reference = image + ":" + tag;
        callDocker("pull image " + reference, () -> {
            PullImageCmd cmd = dockerClient.pullImageCmd(image).withTag(tag);
            if (credentials != null) {
                cmd = cmd.withAuthConfig(new AuthConfig()
                    .withUsername(credentials.username())
                    .withPassword(credentials.password())
                    .withRegistryAddress(credentials.serverAddress()));
            }
            boolean completed;
            try {
                completed = cmd.exec(new PullImageResultCallback())
                    .awaitCompletion(settings.pullTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContainerRuntimeException(RuntimeErrorCode.UNKNOWN, "pull image " + reference,
                    "Interrupted while pulling " + reference, e);
            }
            if (!completed) {
                throw new ContainerRuntimeException(RuntimeErrorCode.TRANSIENT, "pull image " + reference,
                    "Timed out after " + settings.pullTimeout() + " pulling " + reference);
            }
            log.info("Pulled image {}", reference);
        });
    }

    @Override
    public boolean imageExists(String imageReference) {
        try {
            callDocker("inspect image " + imageReference, () -> dockerClient.inspectImageCmd(imageReference).exec());
            return true;
        } catch (ContainerRuntimeException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
    }

    private static ContainerSummary toSummary(Container container) {
        String name = null;
        if (container.getNames() != null && container.getNames().length > 0) {
            name = container.getNames()[0];
            if (name.startsWith("/")) {
                name = name.substring(1);
            }
        }
        return new ContainerSummary(container.getId(), name, container.getImage(), container.getState(),
            container.getStatus(), container.getLabels());
    }

    private static ContainerDetails toDetails(InspectContainerResponse inspect) {
        var config = inspect.getConfig();
        var hostConfig = inspect.getHostConfig();
        var state = inspect.getState();
        boolean running = state != null && Boolean.TRUE.equals(state.getRunning());
        String status = state == null ? null : state.getStatus();
        String health = state == null || state.getHealth() == null ? null : state.getHealth().getStatus();
        Integer restarts = inspect.getRestartCount();
        Long exit = state == null || running ? null : state.getExitCodeLong();

        List<String> env = config == null || config.getEnv() == null ? List.of() : Arrays.asList(config.getEnv());
        Map<String, String> labels = config == null || config.getLabels() == null ? Map.of() : config.getLabels();
        List<String> exposedPorts = new ArrayList<>();
        if (config != null && config.getExposedPorts() != null) {
            for (ExposedPort port : config.getExposedPorts()) {
                exposedPorts.add(port.toString());
            }
        }

        List<String> portBindings = new ArrayList<>();
        List<String> binds = new ArrayList<>();
        String restartPolicy = null;
        String networkMode = null;
        if (hostConfig != null) {
            if (hostConfig.getPortBindings() != null) {
                for (Map.Entry<ExposedPort, Ports.Binding[]> entry : hostConfig.getPortBindings().getBindings().entrySet()) {
                    if (entry.getValue() == null) {
                        continue;
                    }
                    for (Ports.Binding binding : entry.getValue()) {
                        portBindings.add(formatBinding(entry.getKey(), binding));
                    }
                }
            }
            if (hostConfig.getBinds() != null) {
                for (Bind bind : hostConfig.getBinds()) {
                    binds.add(bind.toString());
                }
            }
            RestartPolicy policy = hostConfig.getRestartPolicy();
            if (policy != null && policy.getName() != null && !policy.getName().isBlank()) {
                restartPolicy = policy.toString();
            }
            networkMode = hostConfig.getNetworkMode();
        }

        Map<String, List<String>> aliases = new LinkedHashMap<>();
        if (inspect.getNetworkSettings() != null && inspect.getNetworkSettings().getNetworks() != null) {
            for (Map.Entry<String, ContainerNetwork> entry : inspect.getNetworkSettings().getNetworks().entrySet()) {
                List<String> networkAliases = entry.getValue() == null ? null : entry.getValue().getAliases();
                aliases.put(entry.getKey(), networkAliases == null ? List.of() : networkAliases);
            }
        }

        return new ContainerDetails(inspect.getId(), inspect.getName(), config == null ? null : config.getImage(),
            status, running, health, restarts == null ? 0 : restarts, env, labels, exposedPorts, portBindings,
            binds, restartPolicy, networkMode, aliases, exit == null ? null : exit.intValue());
    }

    private static String formatBinding(ExposedPort port, Ports.Binding binding) {
        StringBuilder value = new StringBuilder();
        if (binding.getHostIp() != null && !binding.getHostIp().isBlank()) {
            value.append(binding.getHostIp()).append(':');
        }
        if (binding.getHostPortSpec() != null) {
            value.append(binding.getHostPortSpec());
        }
        value.append(':').append(port.getPort()).append('/').append(port.getProtocol());
        return value.toString();
    }

    private String[] toEnvArray(Map<String, String> env) {
        return env.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .toArray(String[]::new);
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        int attempt = 1;
        while (true) {
            try {
                return supplier.get();
            } catch (RuntimeException e) {
                ContainerRuntimeException failure = translate(action, e);
                if (!failure.code().retryable() || attempt >= settings.maxAttempts()) {
                    throw failure;
                }
                log.warn("Docker call '{}' failed (attempt {}/{}): {}; retrying in {}",
                    action, attempt, settings.maxAttempts(), failure.getMessage(), settings.retryBackoff());
                pause(failure);
                attempt++;
            }
        }
    }

    private void callDocker(String action, Runnable runnable) {
        callDocker(action, () -> {
            runnable.run();
            return null;
        });
    }

    private void pause(ContainerRuntimeException failure) {
        try {
            Thread.sleep(settings.retryBackoff().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure.addSuppressed(e);
            throw failure;
        }
    }

    private ContainerRuntimeException translate(String action, RuntimeException e) {
        if (e instanceof ContainerRuntimeException runtimeException) {
            return runtimeException;
        }
        if (isDockerUnavailable(e)) {
            return new DockerDaemonUnavailableException(action,
                "Unable to " + action + " because the Docker daemon is unavailable. " + DOCKER_HINT,
                e);
        }
        RuntimeErrorCode code;
        if (e instanceof NotFoundException) {
            code = RuntimeErrorCode.NOT_FOUND;
        } else if (e instanceof ConflictException) {
            code = RuntimeErrorCode.CONFLICT;
        } else if (e instanceof UnauthorizedException) {
            code = RuntimeErrorCode.UNAUTHORIZED;
        } else if (e instanceof BadRequestException) {
            code = RuntimeErrorCode.BAD_REQUEST;
        } else {
            code = RuntimeErrorCode.UNKNOWN;
        }
        return new ContainerRuntimeException(code, action, "Unable to " + action + ": " + describe(e), e);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message.trim();
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            String className = t.getClass().getName();
            if ("com.sun.jna.LastErrorException".equals(className)
                && messageContains(t, "No such file or directory")) {
                return true;
            }
            if (messageContains(t, "Could not find a valid Docker environment")) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private boolean messageContains(Throwable t, String needle) {
        if (needle == null || needle.isBlank()) {
            return false;
        }
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT)
            .contains(needle.toLowerCase(Locale.ROOT));
    }
}
