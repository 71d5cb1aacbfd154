package io.stackwarden.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.stackwarden.orchestrator.app.EndpointProbe;
import io.stackwarden.orchestrator.app.EnvironmentLockRegistry;
import io.stackwarden.orchestrator.app.ExecutorSettings;
import io.stackwarden.orchestrator.app.HealthAggregator;
import io.stackwarden.orchestrator.app.HealthMonitor;
import io.stackwarden.orchestrator.app.LifecycleExecutor;
import io.stackwarden.orchestrator.app.MaintenanceObserverFactory;
import io.stackwarden.orchestrator.app.MaintenanceObserverService;
import io.stackwarden.orchestrator.app.NetworkResolver;
import io.stackwarden.orchestrator.app.OperationModeController;
import io.stackwarden.orchestrator.app.PlanBuilder;
import io.stackwarden.orchestrator.app.SelfReplacementCoordinator;
import io.stackwarden.orchestrator.app.SelfReplacementSettings;
import io.stackwarden.orchestrator.app.StackOperationService;
import io.stackwarden.orchestrator.app.StackRemover;
import io.stackwarden.orchestrator.domain.HealthHistory;
import io.stackwarden.orchestrator.domain.OperationJournal;
import io.stackwarden.orchestrator.domain.StackStateStore;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.runtime.ports.ContainerRuntime;
import io.stackwarden.runtime.ports.RegistryCredentialProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the lifecycle components. They are plain classes so tests can build them against a fake
 * {@link ContainerRuntime} without a Spring context.
 */
@Configuration
@EnableScheduling
public class OrchestratorConfiguration {

    /**
     * Mapper shared by the REST layer, the endpoint checks and the observers: ISO-8601 instants and
     * durations, {@code Optional} accessors written as their value, unknown fields tolerated.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .addModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.system();
    }

    @Bean
    public PlanBuilder planBuilder() {
        return new PlanBuilder(new NetworkResolver());
    }

    @Bean
    public LifecycleExecutor lifecycleExecutor(ContainerRuntime runtime,
                                               RegistryCredentialProvider credentials,
                                               Clock clock,
                                               OrchestratorProperties properties) {
        OrchestratorProperties.Executor executor = properties.getExecutor();
        ExecutorSettings settings = new ExecutorSettings(executor.isVerifyLiveness(), executor.getLivenessTimeout(),
            executor.getLivenessPollInterval(), executor.getStopTimeout(), executor.getInitTimeout());
        return new LifecycleExecutor(runtime, credentials, clock, settings);
    }

    @Bean
    public StackRemover stackRemover(ContainerRuntime runtime, Clock clock, OrchestratorProperties properties) {
        return new StackRemover(runtime, clock, properties.getExecutor().getStopTimeout());
    }

    @Bean
    public OperationModeController operationModeController(StackStateStore store,
                                                           ContainerRuntime runtime,
                                                           Clock clock,
                                                           OrchestratorProperties properties) {
        return new OperationModeController(store, runtime, clock, properties.getExecutor().getStopTimeout());
    }

    @Bean
    public SelfReplacementCoordinator selfReplacementCoordinator(ContainerRuntime runtime,
                                                                 RegistryCredentialProvider credentials,
                                                                 OrchestratorProperties properties) {
        OrchestratorProperties.SelfReplacement self = properties.getSelfReplacement();
        return new SelfReplacementCoordinator(runtime, credentials, new SelfReplacementSettings(
            self.getImageRepository(), self.getHelperImage(), self.getContainerId(),
            properties.getDocker().getSocketPath()));
    }

    @Bean
    public EnvironmentLockRegistry environmentLockRegistry() {
        return new EnvironmentLockRegistry();
    }

    /**
     * Operations hold their environment lock while they run, so one that waits in a queue blocks its
     * environment without making progress. The pool has no queue: it grows up to the maximum and
     * rejects beyond it, which callers see as a busy orchestrator.
     */
    @Bean
    public ThreadPoolTaskExecutor operationExecutor(OrchestratorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getPoolSize());
        executor.setMaxPoolSize(properties.getExecutor().getMaxPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("stack-op-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public StackOperationService stackOperationService(PlanBuilder planBuilder,
                                                       LifecycleExecutor lifecycleExecutor,
                                                       StackRemover stackRemover,
                                                       OperationModeController modes,
                                                       SelfReplacementCoordinator selfReplacement,
                                                       EnvironmentLockRegistry locks,
                                                       OperationJournal journal,
                                                       HealthHistory healthHistory,
                                                       ThreadPoolTaskExecutor operationExecutor,
                                                       Clock clock,
                                                       OrchestratorProperties properties) {
        return new StackOperationService(planBuilder, lifecycleExecutor, stackRemover, modes, selfReplacement,
            properties.getSelfReplacement().getEnvironmentId(), locks, journal, healthHistory, operationExecutor,
            clock);
    }

    @Bean
    public HealthAggregator healthAggregator(ContainerRuntime runtime, EndpointProbe probe, Clock clock) {
        return new HealthAggregator(runtime, probe, clock);
    }

    @Bean
    public HealthMonitor healthMonitor(StackStateStore store, HealthAggregator aggregator, HealthHistory history) {
        return new HealthMonitor(store, aggregator, history);
    }

    @Bean
    public MaintenanceObserverService maintenanceObserverService(StackStateStore store,
                                                                 StackOperationService operations,
                                                                 MaintenanceObserverFactory observers,
                                                                 Clock clock,
                                                                 OrchestratorProperties properties) {
        return new MaintenanceObserverService(store, operations, observers, clock,
            properties.getObservers().isEnabled());
    }
}
