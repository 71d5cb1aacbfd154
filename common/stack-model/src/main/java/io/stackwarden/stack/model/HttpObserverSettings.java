package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a value from an HTTP endpoint. Without {@code jsonPath} the trimmed body is the value;
 * with it, the path ({@code status.flags[0].mode}, an optional leading {@code $.}) selects a field
 * of the JSON body.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HttpObserverSettings(String url,
                                   String method,
                                   Map<String, String> headers,
                                   Duration timeout,
                                   String jsonPath) implements ObserverSettings {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public HttpObserverSettings {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("http observer url must not be blank");
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            throw new IllegalArgumentException("http observer url must use http or https: " + url);
        }
        method = method == null || method.isBlank() ? "GET" : method.toUpperCase(Locale.ROOT);
        headers = headers == null || headers.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
        jsonPath = jsonPath == null || jsonPath.isBlank() ? null : jsonPath.trim();
    }

    public HttpObserverSettings(String url, String jsonPath) {
        this(url, null, null, null, jsonPath);
    }

    @Override
    public String describe() {
        return method + " " + url + (jsonPath == null ? "" : " -> " + jsonPath);
    }
}
