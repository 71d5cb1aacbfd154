package io.stackwarden.docker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stackwarden.runtime.container.RegistryCredentials;
import io.stackwarden.runtime.ports.RegistryCredentialProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves registry credentials from explicit configuration, falling back to the {@code auths}
 * section of the Docker CLI {@code config.json}. Missing credentials are not an error.
 */
public class RegistryCredentialResolver implements RegistryCredentialProvider {
    private static final Logger log = LoggerFactory.getLogger(RegistryCredentialResolver.class);
    private static final List<String> DOCKER_HUB_KEYS =
        List.of("https://index.docker.io/v1/", "index.docker.io", "docker.io", "registry-1.docker.io");

    private final String username;
    private final String password;
    private final Path configuredPath;
    private final ObjectMapper objectMapper;
    private final Function<String, String> environment;

    public RegistryCredentialResolver(String username,
                                      String password,
                                      Path configuredPath,
                                      ObjectMapper objectMapper) {
        this(username, password, configuredPath, objectMapper, System::getenv);
    }

    RegistryCredentialResolver(String username,
                               String password,
                               Path configuredPath,
                               ObjectMapper objectMapper,
                               Function<String, String> environment) {
        this.username = username;
        this.password = password;
        this.configuredPath = configuredPath;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public Optional<RegistryCredentials> credentialsFor(String image) {
        String registry = registryHost(image);
        if (username != null && !username.isBlank() && password != null) {
            return Optional.of(new RegistryCredentials(username, password, registry));
        }
        Path path = dockerConfigPath();
        if (path == null || !Files.isRegularFile(path)) {
            log.debug("No docker config found at {}; pulling {} anonymously", path, image);
            return Optional.empty();
        }
        try {
            JsonNode auths = objectMapper.readTree(path.toFile()).path("auths");
            return findAuth(auths, registry).flatMap(node -> decode(node, registry));
        } catch (IOException e) {
            log.warn("Unable to read docker config {}: {}; pulling {} anonymously", path, e.getMessage(), image);
            return Optional.empty();
        }
    }

    /**
     * Registry host of an image reference, or {@code docker.io} for Docker Hub images.
     */
    static String registryHost(String image) {
        if (image == null) {
            return "docker.io";
        }
        int slash = image.indexOf('/');
        if (slash < 0) {
            return "docker.io";
        }
        String first = image.substring(0, slash);
        if (first.contains(".") || first.contains(":") || "localhost".equals(first)) {
            return first;
        }
        return "docker.io";
    }

    private Path dockerConfigPath() {
        if (configuredPath != null) {
            return configuredPath;
        }
        String dockerConfig = environment.apply("DOCKER_CONFIG");
        if (dockerConfig != null && !dockerConfig.isBlank()) {
            return Path.of(dockerConfig, "config.json");
        }
        String home = System.getProperty("user.home");
        return home == null ? null : Path.of(home, ".docker", "config.json");
    }

    private Optional<JsonNode> findAuth(JsonNode auths, String registry) {
        if (auths == null || !auths.isObject()) {
            return Optional.empty();
        }
        List<String> candidates = "docker.io".equals(registry) ? DOCKER_HUB_KEYS : List.of(registry);
        Iterator<Map.Entry<String, JsonNode>> fields = auths.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = normalizeKey(entry.getKey());
            for (String candidate : candidates) {
                if (key.equals(normalizeKey(candidate))) {
                    return Optional.of(entry.getValue());
                }
            }
        }
        return Optional.empty();
    }

    private static String normalizeKey(String key) {
        String value = key;
        int scheme = value.indexOf("://");
        if (scheme >= 0) {
            value = value.substring(scheme + 3);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        return value;
    }

    private Optional<RegistryCredentials> decode(JsonNode node, String registry) {
        String auth = node.path("auth").asText(null);
        if (auth != null && !auth.isBlank()) {
            String decoded;
            try {
                decoded = new String(Base64.getDecoder().decode(auth.trim()), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring malformed auth entry for registry {}", registry);
                return Optional.empty();
            }
            int separator = decoded.indexOf(':');
            if (separator <= 0) {
                log.warn("Ignoring malformed auth entry for registry {}", registry);
                return Optional.empty();
            }
            return Optional.of(new RegistryCredentials(decoded.substring(0, separator),
                decoded.substring(separator + 1), registry));
        }
        String user = node.path("username").asText(null);
        String secret = node.path("password").asText(null);
        if (user != null && secret != null) {
            return Optional.of(new RegistryCredentials(user, secret, registry));
        }
        return Optional.empty();
    }
}
