package io.stackwarden.runtime.container;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to create a container. {@code networkMode} names the primary network;
 * {@code networkAliases} apply on that network.
 */
public record ContainerSpec(String name,
                            String image,
                            Map<String, String> env,
                            Map<String, String> labels,
                            List<String> exposedPorts,
                            List<String> portBindings,
                            List<String> binds,
                            String restartPolicy,
                            String networkMode,
                            List<String> networkAliases,
                            boolean autoRemove) {

  public static final String RESTART_UNLESS_STOPPED = "unless-stopped";
  public static final String RESTART_ON_FAILURE = "on-failure";

  public ContainerSpec {
    Objects.requireNonNull(image, "image");
    env = env == null || env.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
    labels = labels == null || labels.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    exposedPorts = exposedPorts == null ? List.of() : List.copyOf(exposedPorts);
    portBindings = portBindings == null ? List.of() : List.copyOf(portBindings);
    binds = binds == null ? List.of() : List.copyOf(binds);
    networkAliases = networkAliases == null ? List.of() : List.copyOf(networkAliases);
  }

  public static Builder builder(String name, String image) {
    return new Builder(name, image);
  }

  public static final class Builder {
    private final String name;
    private final String image;
    private final Map<String, String> env = new LinkedHashMap<>();
    private final Map<String, String> labels = new LinkedHashMap<>();
    private final List<String> exposedPorts = new ArrayList<>();
    private final List<String> portBindings = new ArrayList<>();
    private final List<String> binds = new ArrayList<>();
    private String restartPolicy;
    private String networkMode;
    private final List<String> networkAliases = new ArrayList<>();
    private boolean autoRemove;

    private Builder(String name, String image) {
      this.name = name;
      this.image = image;
    }

    public Builder env(Map<String, String> values) {
      env.putAll(values);
      return this;
    }

    public Builder env(String key, String value) {
      env.put(key, value);
      return this;
    }

    public Builder labels(Map<String, String> values) {
      labels.putAll(values);
      return this;
    }

    public Builder label(String key, String value) {
      labels.put(key, value);
      return this;
    }

    public Builder exposedPorts(List<String> ports) {
      exposedPorts.addAll(ports);
      return this;
    }

    public Builder portBindings(List<String> bindings) {
      portBindings.addAll(bindings);
      return this;
    }

    public Builder binds(List<String> values) {
      binds.addAll(values);
      return this;
    }

    public Builder bind(String value) {
      binds.add(value);
      return this;
    }

    public Builder restartPolicy(String policy) {
      this.restartPolicy = policy;
      return this;
    }

    public Builder networkMode(String network) {
      this.networkMode = network;
      return this;
    }

    public Builder networkAliases(List<String> aliases) {
      networkAliases.addAll(aliases);
      return this;
    }

    public Builder autoRemove(boolean value) {
      this.autoRemove = value;
      return this;
    }

    public ContainerSpec build() {
      return new ContainerSpec(name, image, env, labels, exposedPorts, portBindings, binds, restartPolicy,
          networkMode, networkAliases, autoRemove);
    }
  }
}
