package io.stackwarden.runtime.container;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Result of inspecting a container: its runtime state plus the configuration needed to recreate it.
 * Port bindings use the {@code [hostIp:]hostPort:containerPort/protocol} notation and binds the
 * {@code source:target[:mode]} notation. {@code exitCode} is only set once the container stopped.
 */
public record ContainerDetails(String id,
                               String name,
                               String image,
                               String state,
                               boolean running,
                               String healthStatus,
                               int restartCount,
                               List<String> env,
                               Map<String, String> labels,
                               List<String> exposedPorts,
                               List<String> portBindings,
                               List<String> binds,
                               String restartPolicy,
                               String networkMode,
                               Map<String, List<String>> networkAliases,
                               Integer exitCode) {

  public ContainerDetails {
    name = name != null && name.startsWith("/") ? name.substring(1) : name;
    state = state == null ? "" : state.toLowerCase(Locale.ROOT);
    env = env == null ? List.of() : List.copyOf(env);
    labels = labels == null || labels.isEmpty() ? Map.of() : Map.copyOf(labels);
    exposedPorts = exposedPorts == null ? List.of() : List.copyOf(exposedPorts);
    portBindings = portBindings == null ? List.of() : List.copyOf(portBindings);
    binds = binds == null ? List.of() : List.copyOf(binds);
    networkAliases = networkAliases == null || networkAliases.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(networkAliases));
  }

  /**
   * Whether the container ran to completion with exit code 0.
   */
  public boolean completedSuccessfully() {
    return !running && "exited".equals(state) && exitCode != null && exitCode == 0;
  }

  /**
   * Environment entries as an ordered map; entries without {@code =} map to an empty value.
   */
  public Map<String, String> envAsMap() {
    Map<String, String> values = new LinkedHashMap<>();
    for (String entry : env) {
      int separator = entry.indexOf('=');
      if (separator < 0) {
        values.put(entry, "");
      } else {
        values.put(entry.substring(0, separator), entry.substring(separator + 1));
      }
    }
    return values;
  }

  /**
   * Network the container was created on; falls back to the first attached network when the
   * network mode is a runtime default such as {@code default}.
   */
  public String primaryNetwork() {
    if (networkMode != null && !networkMode.isBlank() && networkAliases.containsKey(networkMode)) {
      return networkMode;
    }
    if (networkMode != null && ("host".equals(networkMode) || "none".equals(networkMode))) {
      return networkMode;
    }
    return networkAliases.keySet().stream().findFirst().orElse(networkMode);
  }
}
