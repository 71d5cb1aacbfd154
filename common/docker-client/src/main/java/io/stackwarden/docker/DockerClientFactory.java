package io.stackwarden.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import java.time.Duration;

/**
 * Builds docker-java clients talking to a local socket or an explicit {@code DOCKER_HOST}.
 */
public final class DockerClientFactory {

    private DockerClientFactory() {
    }

    public static DockerClient create(String dockerHost, Duration connectTimeout, Duration responseTimeout) {
        DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (dockerHost != null && !dockerHost.isBlank()) {
            builder.withDockerHost(dockerHost);
        }
        DefaultDockerClientConfig config = builder.build();
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
            .dockerHost(config.getDockerHost())
            .sslConfig(config.getSSLConfig())
            .connectionTimeout(connectTimeout)
            .responseTimeout(responseTimeout)
            .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    /**
     * Turns a socket path such as {@code /var/run/docker.sock} into a docker host URI; values that
     * already carry a scheme are returned unchanged.
     */
    public static String hostForSocket(String socketPath) {
        if (socketPath == null || socketPath.isBlank()) {
            return null;
        }
        if (socketPath.contains("://")) {
            return socketPath;
        }
        return "unix://" + socketPath;
    }
}
