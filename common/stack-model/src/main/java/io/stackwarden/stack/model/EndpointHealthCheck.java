package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.List;

/**
 * HTTP endpoint probed by the health aggregator for a running service. The body may carry a
 * plain {@code Healthy}/{@code Degraded}/{@code Unhealthy} token or a JSON {@code status} field.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointHealthCheck(String path,
                                  @Min(1) @Max(65535) int port,
                                  Duration timeout,
                                  List<Integer> healthyStatusCodes,
                                  boolean https) {
    public EndpointHealthCheck {
        path = path == null || path.isBlank() ? "/health" : (path.startsWith("/") ? path : "/" + path);
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(5) : timeout;
        healthyStatusCodes = healthyStatusCodes == null || healthyStatusCodes.isEmpty()
            ? List.of(200)
            : List.copyOf(healthyStatusCodes);
    }

    public EndpointHealthCheck(String path, int port) {
        this(path, port, null, null, false);
    }
}
