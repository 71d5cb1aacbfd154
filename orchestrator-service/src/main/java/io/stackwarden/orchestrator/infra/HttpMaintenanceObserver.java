package io.stackwarden.orchestrator.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.stackwarden.orchestrator.app.AbstractMaintenanceObserver;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.stack.model.HttpObserverSettings;
import io.stackwarden.stack.model.MaintenanceObserverDefinition;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the observed value from an HTTP response body. Any status code is accepted; the body
 * decides.
 */
class HttpMaintenanceObserver extends AbstractMaintenanceObserver {
    private static final Logger log = LoggerFactory.getLogger(HttpMaintenanceObserver.class);

    private final HttpObserverSettings settings;
    private final HttpClient http;
    private final ObjectMapper json;

    HttpMaintenanceObserver(MaintenanceObserverDefinition definition,
                            HttpObserverSettings settings,
                            HttpClient http,
                            ObjectMapper json,
                            Clock clock) {
        super(definition, clock);
        this.settings = settings;
        this.http = http;
        this.json = json;
    }

    @Override
    protected String readValue() throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(settings.url()))
            .timeout(settings.timeout())
            .method(settings.method(), HttpRequest.BodyPublishers.noBody());
        settings.headers().forEach(request::header);
        HttpResponse<String> response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
        log.debug("Observer {} answered HTTP {}", settings.url(), response.statusCode());
        String body = response.body() == null ? "" : response.body();
        if (settings.jsonPath() == null) {
            return body.trim();
        }
        return select(json.readTree(body), settings.jsonPath());
    }

    /**
     * Follows a dotted path with optional {@code [index]} segments, e.g. {@code $.flags[0].mode}.
     */
    static String select(JsonNode root, String path) {
        String trimmed = path.startsWith("$") ? path.substring(1) : path;
        JsonNode node = root == null ? MissingNode.getInstance() : root;
        for (String segment : trimmed.split("\\.")) {
            if (segment.isEmpty()) {
                continue;
            }
            int bracket = segment.indexOf('[');
            String field = bracket < 0 ? segment : segment.substring(0, bracket);
            if (!field.isEmpty()) {
                node = node.path(field);
            }
            while (bracket >= 0) {
                int close = segment.indexOf(']', bracket);
                if (close < 0) {
                    throw new IllegalArgumentException("unclosed index in json path " + path);
                }
                String index = segment.substring(bracket + 1, close).trim();
                try {
                    node = node.path(Integer.parseInt(index));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid index '" + index + "' in json path " + path, e);
                }
                bracket = segment.indexOf('[', close);
            }
        }
        if (node.isMissingNode()) {
            throw new IllegalStateException("json path " + path + " not found in response");
        }
        if (node.isNull()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
