package io.stackwarden.stack.model;

/**
 * How a service's container is expected to behave once started.
 */
public enum ServiceLifecycle {
    /** Long-running container that stays up. */
    SERVICE,
    /** Run-to-completion container that must exit with code 0 before any regular service starts. */
    INIT
}
