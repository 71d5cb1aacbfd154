package io.stackwarden.runtime.container;

/**
 * Classification of container runtime failures.
 */
public enum RuntimeErrorCode {
  NOT_FOUND,
  CONFLICT,
  UNAUTHORIZED,
  BAD_REQUEST,
  TRANSIENT,
  UNKNOWN;

  public boolean retryable() {
    return this == TRANSIENT;
  }
}
