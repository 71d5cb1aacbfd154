package io.stackwarden.stack.model;

/**
 * Labels written on every managed container and network.
 */
public final class StackLabels {

    public static final String STACK = "stackwarden.stack";
    public static final String CONTEXT = "stackwarden.context";
    public static final String ENVIRONMENT = "stackwarden.environment";
    public static final String MAINTENANCE = "stackwarden.maintenance";
    public static final String MAINTENANCE_IGNORE = "ignore";
    public static final String LIFECYCLE = "stackwarden.lifecycle";
    public static final String LIFECYCLE_INIT = "init";

    private StackLabels() {
    }
}
