package io.stackwarden.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "stackwarden.orchestrator")
public class OrchestratorProperties {

    private final Docker docker;
    private final Executor executor;
    private final Health health;
    private final Journal journal;
    private final Observers observers;
    private final SelfReplacement selfReplacement;

    public OrchestratorProperties(@Valid @DefaultValue Docker docker,
                                  @Valid @DefaultValue Executor executor,
                                  @Valid @DefaultValue Health health,
                                  @Valid @DefaultValue Journal journal,
                                  @Valid @DefaultValue Observers observers,
                                  @Valid SelfReplacement selfReplacement) {
        this.docker = Objects.requireNonNull(docker, "docker");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.health = Objects.requireNonNull(health, "health");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.observers = Objects.requireNonNull(observers, "observers");
        this.selfReplacement = Objects.requireNonNull(selfReplacement, "selfReplacement");
    }

    public Docker getDocker() {
        return docker;
    }

    public Executor getExecutor() {
        return executor;
    }

    public Health getHealth() {
        return health;
    }

    public Journal getJournal() {
        return journal;
    }

    public Observers getObservers() {
        return observers;
    }

    public SelfReplacement getSelfReplacement() {
        return selfReplacement;
    }

    @Validated
    public static final class Docker {

        private final String socketPath;
        private final Duration connectTimeout;
        private final Duration responseTimeout;
        private final int maxAttempts;
        private final Duration retryBackoff;
        private final Duration pullTimeout;

        public Docker(@DefaultValue("/var/run/docker.sock") @NotBlank String socketPath,
                      @DefaultValue("PT5S") @NotNull Duration connectTimeout,
                      @DefaultValue("PT60S") @NotNull Duration responseTimeout,
                      @DefaultValue("3") @Min(1) int maxAttempts,
                      @DefaultValue("PT1S") @NotNull Duration retryBackoff,
                      @DefaultValue("PT10M") @NotNull Duration pullTimeout) {
            this.socketPath = requireNonBlank(socketPath, "socketPath");
            this.connectTimeout = requirePositive(connectTimeout, "connectTimeout");
            this.responseTimeout = requirePositive(responseTimeout, "responseTimeout");
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
            this.pullTimeout = requirePositive(pullTimeout, "pullTimeout");
        }

        public String getSocketPath() {
            return socketPath;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public Duration getResponseTimeout() {
            return responseTimeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public Duration getPullTimeout() {
            return pullTimeout;
        }
    }

    @Validated
    public static final class Executor {

        private final int poolSize;
        private final int maxPoolSize;
        private final boolean verifyLiveness;
        private final Duration livenessTimeout;
        private final Duration livenessPollInterval;
        private final Duration stopTimeout;
        private final Duration initTimeout;

        public Executor(@DefaultValue("4") @Min(1) int poolSize,
                        @DefaultValue("32") @Min(1) int maxPoolSize,
                        @DefaultValue("true") boolean verifyLiveness,
                        @DefaultValue("PT30S") @NotNull Duration livenessTimeout,
                        @DefaultValue("PT0.5S") @NotNull Duration livenessPollInterval,
                        @DefaultValue("PT30S") @NotNull Duration stopTimeout,
                        @DefaultValue("PT5M") @NotNull Duration initTimeout) {
            if (poolSize < 1) {
                throw new IllegalArgumentException("poolSize must be at least 1");
            }
            if (maxPoolSize < poolSize) {
                throw new IllegalArgumentException("maxPoolSize must not be smaller than poolSize");
            }
            this.poolSize = poolSize;
            this.maxPoolSize = maxPoolSize;
            this.verifyLiveness = verifyLiveness;
            this.livenessTimeout = requirePositive(livenessTimeout, "livenessTimeout");
            this.livenessPollInterval = requirePositive(livenessPollInterval, "livenessPollInterval");
            this.stopTimeout = requirePositive(stopTimeout, "stopTimeout");
            this.initTimeout = requirePositive(initTimeout, "initTimeout");
        }

        /**
         * Threads kept alive while idle.
         */
        public int getPoolSize() {
            return poolSize;
        }

        /**
         * Upper bound on concurrently running operations. Operations are never queued; one more
         * than this is rejected and reported as busy.
         */
        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public boolean isVerifyLiveness() {
            return verifyLiveness;
        }

        public Duration getLivenessTimeout() {
            return livenessTimeout;
        }

        public Duration getLivenessPollInterval() {
            return livenessPollInterval;
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public Duration getInitTimeout() {
            return initTimeout;
        }
    }

    @Validated
    public static final class Health {

        private final Duration pollInterval;
        private final Duration retention;
        private final int maxEntries;
        private final Duration probeTimeout;

        public Health(@DefaultValue("PT30S") @NotNull Duration pollInterval,
                      @DefaultValue("PT24H") @NotNull Duration retention,
                      @DefaultValue("2880") @Min(1) int maxEntries,
                      @DefaultValue("PT5S") @NotNull Duration probeTimeout) {
            this.pollInterval = requirePositive(pollInterval, "pollInterval");
            this.retention = requirePositive(retention, "retention");
            if (maxEntries < 1) {
                throw new IllegalArgumentException("maxEntries must be at least 1");
            }
            this.maxEntries = maxEntries;
            this.probeTimeout = requirePositive(probeTimeout, "probeTimeout");
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public Duration getRetention() {
            return retention;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public Duration getProbeTimeout() {
            return probeTimeout;
        }
    }

    @Validated
    public static final class Journal {

        private final int maxOperationsPerStack;

        public Journal(@DefaultValue("50") @Min(1) int maxOperationsPerStack) {
            if (maxOperationsPerStack < 1) {
                throw new IllegalArgumentException("maxOperationsPerStack must be at least 1");
            }
            this.maxOperationsPerStack = maxOperationsPerStack;
        }

        /**
         * Finished operations kept per stack; older ones are dropped. Running operations are never dropped.
         */
        public int getMaxOperationsPerStack() {
            return maxOperationsPerStack;
        }
    }

    @Validated
    public static final class Observers {

        private final boolean enabled;
        private final Duration tickInterval;

        public Observers(@DefaultValue("true") boolean enabled,
                         @DefaultValue("PT5S") @NotNull Duration tickInterval) {
            this.enabled = enabled;
            this.tickInterval = requirePositive(tickInterval, "tickInterval");
        }

        public boolean isEnabled() {
            return enabled;
        }

        /**
         * How often observers are considered; each still honours its own poll interval.
         */
        public Duration getTickInterval() {
            return tickInterval;
        }
    }

    @Validated
    public static final class SelfReplacement {

        private final String imageRepository;
        private final String helperImage;
        private final String containerId;
        private final String environmentId;
        private final String registryUsername;
        private final String registryPassword;
        private final Path dockerConfigPath;

        public SelfReplacement(@NotBlank String imageRepository,
                               @NotBlank String helperImage,
                               String containerId,
                               @DefaultValue("system") @NotBlank String environmentId,
                               String registryUsername,
                               String registryPassword,
                               Path dockerConfigPath) {
            this.imageRepository = requireNonBlank(imageRepository, "imageRepository");
            this.helperImage = requireNonBlank(helperImage, "helperImage");
            this.containerId = blankToNull(containerId);
            this.environmentId = requireNonBlank(environmentId, "environmentId");
            this.registryUsername = blankToNull(registryUsername);
            this.registryPassword = blankToNull(registryPassword);
            this.dockerConfigPath = dockerConfigPath;
        }

        public String getImageRepository() {
            return imageRepository;
        }

        public String getHelperImage() {
            return helperImage;
        }

        /**
         * Explicit id of the orchestrator's own container; {@code null} means use {@code HOSTNAME}.
         */
        public String getContainerId() {
            return containerId;
        }

        /**
         * Lock key that serializes self-replacement with other lifecycle operations.
         */
        public String getEnvironmentId() {
            return environmentId;
        }

        public String getRegistryUsername() {
            return registryUsername;
        }

        public String getRegistryPassword() {
            return registryPassword;
        }

        public Path getDockerConfigPath() {
            return dockerConfigPath;
        }
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
