package io.stackwarden.orchestrator.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stackwarden.orchestrator.app.EndpointProbe;
import io.stackwarden.orchestrator.config.OrchestratorProperties;
import io.stackwarden.orchestrator.domain.HealthStatus;
import io.stackwarden.stack.model.EndpointHealthCheck;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Probes service health endpoints over HTTP. A response with an accepted status code is healthy
 * unless its body says otherwise, either as a bare {@code Healthy}/{@code Degraded}/{@code Unhealthy}
 * token or as the {@code status} field of a JSON object.
 */
@Component
public class HttpEndpointProbe implements EndpointProbe {
    private static final Logger log = LoggerFactory.getLogger(HttpEndpointProbe.class);

    private final HttpClient http;
    private final ObjectMapper json;
    private final Duration defaultTimeout;

    @Autowired
    public HttpEndpointProbe(ObjectMapper json, OrchestratorProperties properties) {
        this(HttpClient.newBuilder().connectTimeout(properties.getHealth().getProbeTimeout()).build(), json,
            properties.getHealth().getProbeTimeout());
    }

    HttpEndpointProbe(HttpClient http, ObjectMapper json, Duration defaultTimeout) {
        this.http = http;
        this.json = json;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public Result probe(String host, EndpointHealthCheck check) {
        String address = (check.https() ? "https" : "http") + "://" + host + ":" + check.port() + check.path();
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(address))
                .timeout(check.timeout() == null ? defaultTimeout : check.timeout())
                .GET()
                .build();
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (!check.healthyStatusCodes().contains(response.statusCode())) {
                log.debug("Health endpoint {} returned HTTP {}", address, response.statusCode());
                return new Result(HealthStatus.UNHEALTHY, "health endpoint returned HTTP " + response.statusCode());
            }
            HealthStatus reported = parseBody(response.body());
            return new Result(reported, reported == HealthStatus.HEALTHY ? null : "health endpoint reported " + reported);
        } catch (IllegalArgumentException e) {
            log.warn("Health endpoint address {} is invalid: {}", address, e.getMessage());
            return new Result(HealthStatus.UNHEALTHY, "health endpoint address invalid: " + e.getMessage());
        } catch (IOException e) {
            log.debug("Health endpoint {} failed: {}", address, e.getMessage());
            return new Result(HealthStatus.UNHEALTHY, "health endpoint unreachable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Result(HealthStatus.UNKNOWN, "health check interrupted");
        }
    }

    HealthStatus parseBody(String body) {
        if (body == null || body.isBlank()) {
            return HealthStatus.HEALTHY;
        }
        String trimmed = body.trim();
        if (trimmed.startsWith("{")) {
            try {
                JsonNode status = json.readTree(trimmed).path("status");
                return status.isTextual() ? token(status.asText()) : HealthStatus.HEALTHY;
            } catch (IOException e) {
                log.debug("Unparseable health body: {}", e.getMessage());
                return HealthStatus.HEALTHY;
            }
        }
        return token(trimmed);
    }

    private static HealthStatus token(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "degraded" -> HealthStatus.DEGRADED;
            case "unhealthy", "down" -> HealthStatus.UNHEALTHY;
            default -> HealthStatus.HEALTHY;
        };
    }
}
