package io.stackwarden.orchestrator.infra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.stackwarden.orchestrator.app.EndpointProbe;
import io.stackwarden.orchestrator.domain.HealthStatus;
import io.stackwarden.stack.model.EndpointHealthCheck;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpEndpointProbeTest {

    private HttpServer server;
    private HttpEndpointProbe probe;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        respond("/health", 200, "Healthy");
        respond("/json", 200, "{\"status\":\"Degraded\",\"checks\":[]}");
        respond("/broken", 503, "Unhealthy");
        respond("/accepted", 204, "");
        server.start();
        probe = new HttpEndpointProbe(HttpClient.newHttpClient(), new ObjectMapper(), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
    }

    private int port() {
        return server.getAddress().getPort();
    }

    @Test
    void healthyTokenIsHealthy() {
        EndpointProbe.Result result = probe.probe("127.0.0.1", new EndpointHealthCheck("/health", port()));

        assertEquals(HealthStatus.HEALTHY, result.status());
        assertNull(result.detail());
    }

    @Test
    void jsonStatusFieldIsHonoured() {
        EndpointProbe.Result result = probe.probe("127.0.0.1", new EndpointHealthCheck("json", port()));

        assertEquals(HealthStatus.DEGRADED, result.status());
        assertEquals("health endpoint reported DEGRADED", result.detail());
    }

    @Test
    void unexpectedStatusCodeIsUnhealthy() {
        EndpointProbe.Result result = probe.probe("127.0.0.1", new EndpointHealthCheck("/broken", port()));

        assertEquals(HealthStatus.UNHEALTHY, result.status());
        assertEquals("health endpoint returned HTTP 503", result.detail());
    }

    @Test
    void acceptsConfiguredStatusCodes() {
        EndpointHealthCheck check = new EndpointHealthCheck("/accepted", port(), null, List.of(200, 204), false);

        assertEquals(HealthStatus.HEALTHY, probe.probe("127.0.0.1", check).status());
    }

    @Test
    void unreachableEndpointIsUnhealthy() {
        int closed = port();
        server.stop(0);
        server = null;

        EndpointProbe.Result result = probe.probe("127.0.0.1", new EndpointHealthCheck("/health", closed));

        assertEquals(HealthStatus.UNHEALTHY, result.status());
        assertThat(result.detail()).startsWith("health endpoint unreachable");
    }

    @Test
    void malformedAddressIsUnhealthyInsteadOfThrowing() {
        EndpointProbe.Result badPath = probe.probe("127.0.0.1", new EndpointHealthCheck("/health check", port()));
        EndpointProbe.Result badHost = probe.probe("shop api", new EndpointHealthCheck("/health", port()));

        assertEquals(HealthStatus.UNHEALTHY, badPath.status());
        assertThat(badPath.detail()).startsWith("health endpoint address invalid");
        assertEquals(HealthStatus.UNHEALTHY, badHost.status());
        assertThat(badHost.detail()).startsWith("health endpoint address invalid");
    }

    @Test
    void parsesBodies() {
        assertEquals(HealthStatus.HEALTHY, probe.parseBody(""));
        assertEquals(HealthStatus.HEALTHY, probe.parseBody(null));
        assertEquals(HealthStatus.DEGRADED, probe.parseBody(" degraded\n"));
        assertEquals(HealthStatus.UNHEALTHY, probe.parseBody("DOWN"));
        assertEquals(HealthStatus.UNHEALTHY, probe.parseBody("{\"status\":\"Unhealthy\"}"));
        assertEquals(HealthStatus.HEALTHY, probe.parseBody("{\"uptime\":42}"));
        assertEquals(HealthStatus.HEALTHY, probe.parseBody("{not json"));
    }
}
