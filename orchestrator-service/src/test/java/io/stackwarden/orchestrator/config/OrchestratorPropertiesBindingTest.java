package io.stackwarden.orchestrator.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.ConfigurationPropertiesBindException;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class OrchestratorPropertiesBindingTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(TestConfiguration.class);

    @Test
    void bindsDefaultsAroundRequiredSelfReplacementSettings() {
        contextRunner
            .withPropertyValues(
                "stackwarden.orchestrator.self-replacement.image-repository=ghcr.io/acme/stackwarden",
                "stackwarden.orchestrator.self-replacement.helper-image=ghcr.io/acme/helper:1.0.0",
                "stackwarden.orchestrator.executor.pool-size=2",
                "stackwarden.orchestrator.health.retention=PT1H")
            .run(context -> {
                assertThat(context).hasNotFailed();
                OrchestratorProperties properties = context.getBean(OrchestratorProperties.class);
                assertThat(properties.getDocker().getSocketPath()).isEqualTo("/var/run/docker.sock");
                assertThat(properties.getDocker().getMaxAttempts()).isEqualTo(3);
                assertThat(properties.getExecutor().getPoolSize()).isEqualTo(2);
                assertThat(properties.getExecutor().isVerifyLiveness()).isTrue();
                assertThat(properties.getExecutor().getMaxPoolSize()).isEqualTo(32);
                assertThat(properties.getExecutor().getInitTimeout()).isEqualTo(Duration.ofMinutes(5));
                assertThat(properties.getJournal().getMaxOperationsPerStack()).isEqualTo(50);
                assertThat(properties.getObservers().isEnabled()).isTrue();
                assertThat(properties.getObservers().getTickInterval()).isEqualTo(Duration.ofSeconds(5));
                assertThat(properties.getHealth().getRetention()).isEqualTo(Duration.ofHours(1));
                assertThat(properties.getHealth().getPollInterval()).isEqualTo(Duration.ofSeconds(30));
                assertThat(properties.getSelfReplacement().getEnvironmentId()).isEqualTo("system");
                assertThat(properties.getSelfReplacement().getContainerId()).isNull();
            });
    }

    @Test
    void failsWhenImageRepositoryMissing() {
        contextRunner
            .withPropertyValues("stackwarden.orchestrator.self-replacement.helper-image=ghcr.io/acme/helper:1.0.0")
            .run(context -> {
                assertThat(context).hasFailed();
                Throwable failure = context.getStartupFailure();
                assertThat(failure)
                    .isInstanceOf(ConfigurationPropertiesBindException.class)
                    .hasRootCauseInstanceOf(IllegalArgumentException.class);
                Throwable root = failure;
                while (root.getCause() != null) {
                    root = root.getCause();
                }
                assertThat(root.getMessage()).contains("imageRepository");
            });
    }

    @Test
    void rejectsNonPositiveDurations() {
        contextRunner
            .withPropertyValues(
                "stackwarden.orchestrator.self-replacement.image-repository=ghcr.io/acme/stackwarden",
                "stackwarden.orchestrator.self-replacement.helper-image=ghcr.io/acme/helper:1.0.0",
                "stackwarden.orchestrator.executor.stop-timeout=PT0S")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsMaxPoolSizeBelowPoolSize() {
        contextRunner
            .withPropertyValues(
                "stackwarden.orchestrator.self-replacement.image-repository=ghcr.io/acme/stackwarden",
                "stackwarden.orchestrator.self-replacement.helper-image=ghcr.io/acme/helper:1.0.0",
                "stackwarden.orchestrator.executor.pool-size=8",
                "stackwarden.orchestrator.executor.max-pool-size=4")
            .run(context -> assertThat(context).hasFailed());
    }

    @EnableConfigurationProperties(OrchestratorProperties.class)
    static class TestConfiguration {
    }
}
