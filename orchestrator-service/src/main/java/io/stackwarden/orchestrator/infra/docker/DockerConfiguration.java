package io.stackwarden.orchestrator.infra.docker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import io.stackwarden.docker.DockerClientFactory;
import io.stackwarden.docker.DockerContainerClient;
import io.stackwarden.docker.DockerRuntimeSettings;
import io.stackwarden.docker.RegistryCredentialResolver;
import io.stackwarden.orchestrator.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DockerConfiguration {
    private static final Logger log = LoggerFactory.getLogger(DockerConfiguration.class);

    @Bean(destroyMethod = "close")
    public DockerClient dockerClient(OrchestratorProperties properties) {
        OrchestratorProperties.Docker docker = properties.getDocker();
        String host = DockerClientFactory.hostForSocket(docker.getSocketPath());
        log.info("Using container runtime at {} (connect timeout {}, response timeout {})", host,
            docker.getConnectTimeout(), docker.getResponseTimeout());
        return DockerClientFactory.create(host, docker.getConnectTimeout(), docker.getResponseTimeout());
    }

    @Bean
    public DockerContainerClient dockerContainerClient(DockerClient dockerClient, OrchestratorProperties properties) {
        OrchestratorProperties.Docker docker = properties.getDocker();
        return new DockerContainerClient(dockerClient,
            new DockerRuntimeSettings(docker.getMaxAttempts(), docker.getRetryBackoff(), docker.getPullTimeout()));
    }

    @Bean
    public RegistryCredentialResolver registryCredentialResolver(OrchestratorProperties properties,
                                                                 ObjectMapper objectMapper) {
        OrchestratorProperties.SelfReplacement self = properties.getSelfReplacement();
        return new RegistryCredentialResolver(self.getRegistryUsername(), self.getRegistryPassword(),
            self.getDockerConfigPath(), objectMapper);
    }
}
