package io.stackwarden.stack.model;

import java.util.regex.Pattern;

/**
 * Docker object naming rules: names must match {@code [a-zA-Z0-9][a-zA-Z0-9_.-]*}.
 */
public final class DockerNames {

    public static final String FALLBACK = "unnamed";

    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-zA-Z0-9_.-]");
    private static final Pattern LEADING_INVALID = Pattern.compile("^[^a-zA-Z0-9]+");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");

    private DockerNames() {
    }

    public static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return FALLBACK;
        }
        String sanitized = INVALID_CHARS.matcher(name).replaceAll("_");
        sanitized = LEADING_INVALID.matcher(sanitized).replaceAll("");
        sanitized = REPEATED_UNDERSCORES.matcher(sanitized).replaceAll("_");
        int end = sanitized.length();
        while (end > 0 && sanitized.charAt(end - 1) == '_') {
            end--;
        }
        sanitized = sanitized.substring(0, end);
        return sanitized.isEmpty() ? FALLBACK : sanitized;
    }

    public static String containerName(String stackIdentity, String serviceName) {
        return sanitize(stackIdentity) + "_" + sanitize(serviceName);
    }

    public static String networkName(String stackIdentity, String networkName) {
        return sanitize(stackIdentity) + "_" + sanitize(networkName);
    }

    public static String volumeName(String stackIdentity, String volumeName) {
        return sanitize(stackIdentity) + "_" + sanitize(volumeName);
    }
}
