package io.stackwarden.orchestrator.infra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.stackwarden.orchestrator.domain.ObserverResult;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.stack.model.HttpObserverSettings;
import io.stackwarden.stack.model.MaintenanceObserverDefinition;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpMaintenanceObserverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"));

    private final ObjectMapper json = new ObjectMapper();
    private final AtomicReference<String> seenMethod = new AtomicReference<>();
    private final AtomicReference<String> seenToken = new AtomicReference<>();
    private HttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        respond("/flag", 200, "  MAINTENANCE\n");
        respond("/status", 200, "{\"site\":{\"flags\":[{\"mode\":\"normal\"},{\"mode\":\"maintenance\"}]}}");
        respond("/down", 503, "maintenance");
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            seenMethod.set(exchange.getRequestMethod());
            seenToken.set(exchange.getRequestHeaders().getFirst("X-Token"));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
    }

    private ObserverResult check(HttpObserverSettings settings) {
        MaintenanceObserverDefinition definition =
            new MaintenanceObserverDefinition(Duration.ofSeconds(5), "maintenance", null, settings);
        return new HttpMaintenanceObserver(definition, settings, HttpClient.newHttpClient(), json, CLOCK).check();
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    @Test
    void trimmedBodyIsTheValue() {
        ObserverResult result = check(new HttpObserverSettings(url("/flag"), null));

        assertTrue(result.maintenanceRequired());
        assertEquals("MAINTENANCE", result.observedValue());
        assertEquals("GET", seenMethod.get());
    }

    @Test
    void jsonPathSelectsNestedArrayElement() {
        ObserverResult result = check(new HttpObserverSettings(url("/status"), "$.site.flags[1].mode"));

        assertTrue(result.success());
        assertTrue(result.maintenanceRequired());
    }

    @Test
    void configuredMethodAndHeadersAreSent() {
        ObserverResult result = check(new HttpObserverSettings(url("/flag"), "post", Map.of("X-Token", "s3cret"),
            Duration.ofSeconds(2), null));

        assertTrue(result.success());
        assertEquals("POST", seenMethod.get());
        assertEquals("s3cret", seenToken.get());
    }

    @Test
    void errorStatusStillReportsTheBody() {
        ObserverResult result = check(new HttpObserverSettings(url("/down"), null));

        assertTrue(result.maintenanceRequired());
    }

    @Test
    void missingJsonFieldIsAFailedCheck() {
        ObserverResult result = check(new HttpObserverSettings(url("/status"), "site.banner"));

        assertFalse(result.success());
        assertThat(result.error()).contains("site.banner not found");
    }

    @Test
    void unreachableEndpointIsAFailedCheck() {
        String address = url("/flag");
        server.stop(0);
        server = null;

        ObserverResult result = check(new HttpObserverSettings(address, null));

        assertFalse(result.success());
        assertFalse(result.maintenanceRequired());
    }

    @Test
    void selectReadsScalarsAndRejectsBrokenPaths() throws IOException {
        JsonNode root = json.readTree("{\"a\":{\"b\":[1,{\"c\":true}],\"n\":null}}");

        assertEquals("1", HttpMaintenanceObserver.select(root, "a.b[0]"));
        assertEquals("true", HttpMaintenanceObserver.select(root, "$.a.b[1].c"));
        assertEquals("", HttpMaintenanceObserver.select(root, "a.n"));
        assertThatThrownBy(() -> HttpMaintenanceObserver.select(root, "a.b[x]"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HttpMaintenanceObserver.select(root, "a.b[0"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
