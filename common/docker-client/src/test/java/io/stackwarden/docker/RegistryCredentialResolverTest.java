package io.stackwarden.docker;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stackwarden.runtime.container.RegistryCredentials;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RegistryCredentialResolverTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void explicitCredentialsWin() throws Exception {
        Path config = writeConfig("registry.acme.io", "docker:secret");
        RegistryCredentialResolver resolver = new RegistryCredentialResolver("ci", "token", config, mapper);

        Optional<RegistryCredentials> credentials = resolver.credentialsFor("registry.acme.io/shop/api:1");

        assertThat(credentials).contains(new RegistryCredentials("ci", "token", "registry.acme.io"));
    }

    @Test
    void readsBase64AuthForRegistryHost() throws Exception {
        Path config = writeConfig("https://registry.acme.io", "deploy:p4ss:word");
        RegistryCredentialResolver resolver = new RegistryCredentialResolver(null, null, config, mapper);

        RegistryCredentials credentials = resolver.credentialsFor("registry.acme.io/shop/api:1").orElseThrow();

        assertThat(credentials.username()).isEqualTo("deploy");
        assertThat(credentials.password()).isEqualTo("p4ss:word");
    }

    @Test
    void mapsDockerHubImagesToIndexEntry() throws Exception {
        Path config = writeConfig("https://index.docker.io/v1/", "hub:hubpass");
        RegistryCredentialResolver resolver = new RegistryCredentialResolver(null, null, config, mapper);

        assertThat(resolver.credentialsFor("stackwarden/orchestrator:1.2.0"))
            .map(RegistryCredentials::username)
            .contains("hub");
    }

    @Test
    void missingConfigMeansAnonymousPull() {
        RegistryCredentialResolver resolver = new RegistryCredentialResolver(null, null, null, mapper,
            Map.of("DOCKER_CONFIG", tempDir.resolve("absent").toString())::get);

        assertThat(resolver.credentialsFor("registry.acme.io/shop/api:1")).isEmpty();
    }

    @Test
    void unrelatedRegistryHasNoCredentials() throws Exception {
        Path config = writeConfig("ghcr.io", "gh:token");
        RegistryCredentialResolver resolver = new RegistryCredentialResolver(null, null, config, mapper);

        assertThat(resolver.credentialsFor("registry.acme.io/shop/api:1")).isEmpty();
    }

    @Test
    void resolvesRegistryHostFromImage() {
        assertThat(RegistryCredentialResolver.registryHost("localhost:5000/app")).isEqualTo("localhost:5000");
        assertThat(RegistryCredentialResolver.registryHost("library/nginx")).isEqualTo("docker.io");
        assertThat(RegistryCredentialResolver.registryHost("nginx")).isEqualTo("docker.io");
    }

    private Path writeConfig(String registry, String userAndPassword) throws Exception {
        String auth = Base64.getEncoder().encodeToString(userAndPassword.getBytes(StandardCharsets.UTF_8));
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"auths\":{\"" + registry + "\":{\"auth\":\"" + auth + "\"}}}");
        return file;
    }
}
