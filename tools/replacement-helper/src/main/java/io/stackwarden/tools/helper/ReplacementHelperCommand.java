package io.stackwarden.tools.helper;

import io.stackwarden.docker.DockerClientFactory;
import io.stackwarden.docker.DockerContainerClient;
import io.stackwarden.runtime.ports.ContainerRuntime;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Entry point of the short-lived helper container that finishes a self-replacement: it outlives
 * the orchestrator it stops and brings the replacement up under the orchestrator's name.
 */
@Command(
    name = "replacement-helper",
    version = "1.0.0",
    description = "Swap the orchestrator container for its prepared replacement",
    mixinStandardHelpOptions = true,
    footerHeading = "%n@|bold Exit codes:|@%n",
    footer = {
        "  0  replacement running under the old name",
        "  1  swap failed, previous container restored",
        "  2  swap failed and the previous container could not be restored"
    }
)
public class ReplacementHelperCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ReplacementHelperCommand.class);

    static final String ENV_OLD_CONTAINER = "OLD_CONTAINER";
    static final String ENV_NEW_CONTAINER = "NEW_CONTAINER";
    static final int USAGE_ERROR = 3;

    @Option(names = {"--old"}, description = "Container to replace (default: $" + ENV_OLD_CONTAINER + ")")
    String oldContainer;

    @Option(names = {"--new"}, description = "Prepared replacement container (default: $" + ENV_NEW_CONTAINER + ")")
    String newContainer;

    @Option(names = {"--docker-host"}, description = "Docker host URI or socket path (default: DOCKER_HOST or the local socket)")
    String dockerHost;

    @Option(names = {"--stop-grace"}, defaultValue = "PT10S",
        description = "Time the old container gets to exit on its own (default: ${DEFAULT-VALUE})")
    Duration stopGrace;

    @Option(names = {"--stop-timeout"}, defaultValue = "PT30S",
        description = "Time the runtime waits before killing the old container (default: ${DEFAULT-VALUE})")
    Duration stopTimeout;

    @Option(names = {"--start-timeout"}, defaultValue = "PT60S",
        description = "Time the replacement has to report running (default: ${DEFAULT-VALUE})")
    Duration startTimeout;

    @Option(names = {"--poll-interval"}, defaultValue = "PT1S",
        description = "Interval between container state checks (default: ${DEFAULT-VALUE})")
    Duration pollInterval;

    private final Function<String, String> environment;
    private final Function<String, ContainerRuntime> runtimes;

    public ReplacementHelperCommand() {
        this(System::getenv, ReplacementHelperCommand::dockerRuntime);
    }

    ReplacementHelperCommand(Function<String, String> environment, Function<String, ContainerRuntime> runtimes) {
        this.environment = environment;
        this.runtimes = runtimes;
    }

    @Override
    public Integer call() {
        String oldName = resolve(oldContainer, ENV_OLD_CONTAINER);
        String newName = resolve(newContainer, ENV_NEW_CONTAINER);
        if (oldName == null || newName == null) {
            log.error("Both --old/{} and --new/{} are required", ENV_OLD_CONTAINER, ENV_NEW_CONTAINER);
            return USAGE_ERROR;
        }
        if (oldName.equals(newName)) {
            log.error("Old and new container are both '{}'", oldName);
            return USAGE_ERROR;
        }
        SwapSettings settings = new SwapSettings(stopGrace, stopTimeout, startTimeout, pollInterval);
        SwapOutcome outcome = new ContainerSwap(runtimes.apply(dockerHost), settings).swap(oldName, newName);
        log.info("Replacement of {} finished: {}", oldName, outcome);
        return outcome.exitCode();
    }

    private String resolve(String option, String variable) {
        String value = option == null || option.isBlank() ? environment.apply(variable) : option;
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static ContainerRuntime dockerRuntime(String dockerHost) {
        return new DockerContainerClient(DockerClientFactory.create(DockerClientFactory.hostForSocket(dockerHost),
            Duration.ofSeconds(5), Duration.ofSeconds(60)));
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ReplacementHelperCommand()).execute(args);
        System.exit(exitCode);
    }
}
