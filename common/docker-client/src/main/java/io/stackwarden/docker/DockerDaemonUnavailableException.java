package io.stackwarden.docker;

import io.stackwarden.runtime.container.ContainerRuntimeException;
import io.stackwarden.runtime.container.RuntimeErrorCode;

/**
 * Indicates that the Docker daemon could not be reached from the current runtime.
 */
public class DockerDaemonUnavailableException extends ContainerRuntimeException {

    public DockerDaemonUnavailableException(String action, String message, Throwable cause) {
        super(RuntimeErrorCode.TRANSIENT, action, message, cause);
    }
}
