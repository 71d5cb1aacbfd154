package io.stackwarden.runtime.container;

import java.util.Objects;

/**
 * Failure reported by a {@link io.stackwarden.runtime.ports.ContainerRuntime}.
 */
public class ContainerRuntimeException extends RuntimeException {

  private final RuntimeErrorCode code;
  private final String action;

  public ContainerRuntimeException(RuntimeErrorCode code, String action, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.action = action;
  }

  public ContainerRuntimeException(RuntimeErrorCode code, String action, String message) {
    this(code, action, message, null);
  }

  public RuntimeErrorCode code() {
    return code;
  }

  public String action() {
    return action;
  }

  public boolean isNotFound() {
    return code == RuntimeErrorCode.NOT_FOUND;
  }
}
