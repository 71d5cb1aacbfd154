package io.stackwarden.runtime.ports;

import io.stackwarden.runtime.container.ContainerDetails;
import io.stackwarden.runtime.container.ContainerRuntimeException;
import io.stackwarden.runtime.container.ContainerSpec;
import io.stackwarden.runtime.container.ContainerSummary;
import io.stackwarden.runtime.container.RegistryCredentials;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Abstraction over the container host of one environment.
 * <p>
 * The interface is free of transport-specific types so that the executor, the health aggregator
 * and the replacement helper can run against a fake in tests. Every failure is reported as a
 * {@link ContainerRuntimeException} carrying a {@link io.stackwarden.runtime.container.RuntimeErrorCode};
 * implementations retry transient failures themselves.
 */
public interface ContainerRuntime {

  /**
   * List containers (running or not) carrying all of the given labels.
   *
   * @param labels label filter; an empty map lists every container
   * @return matching containers, never {@code null}
   */
  List<ContainerSummary> listContainers(Map<String, String> labels);

  /**
   * Find a container by its exact name.
   */
  Optional<ContainerSummary> findContainer(String name);

  /**
   * Inspect a container by id or name.
   *
   * @throws ContainerRuntimeException with {@code NOT_FOUND} when it does not exist
   */
  ContainerDetails inspectContainer(String idOrName);

  /**
   * Create (but do not start) a container.
   *
   * @return id of the created container
   */
  String createContainer(ContainerSpec spec);

  /**
   * Start a container; starting a running container is a no-op.
   */
  void startContainer(String idOrName);

  /**
   * Stop a container, waiting at most {@code timeout} before the runtime kills it; stopping a
   * stopped container is a no-op.
   */
  void stopContainer(String idOrName, Duration timeout);

  void removeContainer(String idOrName, boolean force);

  void renameContainer(String idOrName, String newName);

  boolean networkExists(String name);

  void createNetwork(String name, Map<String, String> labels);

  /**
   * Attach a container to an additional network.
   *
   * @param aliases DNS aliases of the container on that network, may be empty
   */
  void connectNetwork(String network, String containerId, List<String> aliases);

  /**
   * Pull {@code image:tag}, blocking until the pull completes.
   *
   * @param credentials registry credentials or {@code null} for an anonymous pull
   */
  void pullImage(String image, String tag, RegistryCredentials credentials);

  boolean imageExists(String imageReference);
}
