package io.stackwarden.orchestrator.infra;

import io.stackwarden.orchestrator.app.AbstractMaintenanceObserver;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.stack.model.FileObserverSettings;
import io.stackwarden.stack.model.MaintenanceObserverDefinition;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

class FileMaintenanceObserver extends AbstractMaintenanceObserver {

    private final FileObserverSettings settings;
    private final Path path;
    private final Pattern pattern;

    FileMaintenanceObserver(MaintenanceObserverDefinition definition, FileObserverSettings settings, Clock clock) {
        super(definition, clock);
        this.settings = settings;
        this.path = Path.of(settings.path());
        this.pattern = settings.contentPattern() == null ? null : Pattern.compile(settings.contentPattern());
    }

    @Override
    protected String readValue() throws IOException {
        if (settings.mode() == FileObserverSettings.Mode.EXISTS) {
            return Boolean.toString(Files.exists(path));
        }
        String content = Files.readString(path).trim();
        if (pattern == null) {
            return content;
        }
        Matcher matcher = pattern.matcher(content);
        if (!matcher.find()) {
            throw new IllegalStateException("content of " + path + " does not match " + pattern.pattern());
        }
        if (matcher.groupCount() > 0 && matcher.group(1) != null) {
            return matcher.group(1);
        }
        return matcher.group();
    }
}
