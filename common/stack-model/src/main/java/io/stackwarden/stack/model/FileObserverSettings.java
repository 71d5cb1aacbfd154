package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads a value from the orchestrator's file system. {@link Mode#EXISTS} yields {@code true} or
 * {@code false}; {@link Mode#CONTENT} yields the trimmed file content, or the first capture group
 * (whole match when there is none) of {@code contentPattern}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileObserverSettings(String path, Mode mode, String contentPattern) implements ObserverSettings {

    public enum Mode {
        EXISTS,
        CONTENT
    }

    public FileObserverSettings {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("file observer path must not be blank");
        }
        mode = mode == null ? Mode.EXISTS : mode;
        contentPattern = contentPattern == null || contentPattern.isEmpty() ? null : contentPattern;
        if (contentPattern != null) {
            try {
                Pattern.compile(contentPattern);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid file observer contentPattern: " + e.getDescription(), e);
            }
        }
    }

    @Override
    public String describe() {
        return mode.name().toLowerCase(Locale.ROOT) + " " + path;
    }
}
