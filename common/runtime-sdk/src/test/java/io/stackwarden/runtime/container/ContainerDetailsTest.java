package io.stackwarden.runtime.container;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContainerDetailsTest {

  @Test
  void splitsEnvironmentOnFirstEquals() {
    ContainerDetails details = details("shop_net", List.of("A=1", "URL=jdbc:x?a=b", "FLAG"));

    assertThat(details.envAsMap())
        .containsEntry("A", "1")
        .containsEntry("URL", "jdbc:x?a=b")
        .containsEntry("FLAG", "");
  }

  @Test
  void stripsLeadingSlashFromName() {
    assertThat(details("shop_net", List.of()).name()).isEqualTo("orchestrator");
  }

  @Test
  void primaryNetworkFallsBackToFirstAttachedNetwork() {
    assertThat(details("shop_net", List.of()).primaryNetwork()).isEqualTo("shop_net");
    assertThat(details("default", List.of()).primaryNetwork()).isEqualTo("shop_net");
    assertThat(details("host", List.of()).primaryNetwork()).isEqualTo("host");
  }

  @Test
  void summaryExtractsHealthFromStatusLine() {
    assertThat(summary("Up 3 minutes (healthy)").healthStatus()).isEqualTo("healthy");
    assertThat(summary("Up 3 minutes (unhealthy)").healthStatus()).isEqualTo("unhealthy");
    assertThat(summary("Up 2 seconds (health: starting)").healthStatus()).isEqualTo("starting");
    assertThat(summary("Exited (0) 1 hour ago").healthStatus()).isNull();
  }

  private static ContainerSummary summary(String status) {
    return new ContainerSummary("id", "shop_api", "api:1", "running", status, Map.of());
  }

  private static ContainerDetails details(String networkMode, List<String> env) {
    Map<String, List<String>> aliases = new LinkedHashMap<>();
    aliases.put("shop_net", List.of("orchestrator"));
    aliases.put("edge", List.of());
    return new ContainerDetails("abc", "/orchestrator", "stackwarden/orchestrator:1.0.0", "running", true, null, 0,
        env, Map.of(), List.of("8080/tcp"), List.of("8080:8080/tcp"), List.of("/var/run/docker.sock:/var/run/docker.sock"),
        "unless-stopped", networkMode, aliases, null);
  }
}
