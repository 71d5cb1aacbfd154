package io.stackwarden.orchestrator.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stackwarden.orchestrator.app.MaintenanceObserver;
import io.stackwarden.orchestrator.app.MaintenanceObserverFactory;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.stack.model.FileObserverSettings;
import io.stackwarden.stack.model.HttpObserverSettings;
import io.stackwarden.stack.model.MaintenanceObserverDefinition;
import io.stackwarden.stack.model.ObserverSettings;
import io.stackwarden.stack.model.SqlObserverSettings;
import java.net.http.HttpClient;
import org.springframework.stereotype.Component;

@Component
public class DefaultMaintenanceObserverFactory implements MaintenanceObserverFactory {

    private final ObjectMapper json;
    private final Clock clock;

    public DefaultMaintenanceObserverFactory(ObjectMapper json, Clock clock) {
        this.json = json;
        this.clock = clock;
    }

    @Override
    public MaintenanceObserver create(MaintenanceObserverDefinition definition) {
        ObserverSettings settings = definition.settings();
        if (settings instanceof HttpObserverSettings http) {
            HttpClient client = HttpClient.newBuilder()
                .connectTimeout(http.timeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
            return new HttpMaintenanceObserver(definition, http, client, json, clock);
        }
        if (settings instanceof FileObserverSettings file) {
            return new FileMaintenanceObserver(definition, file, clock);
        }
        if (settings instanceof SqlObserverSettings sql) {
            return SqlMaintenanceObserver.connect(definition, sql, clock);
        }
        throw new IllegalArgumentException("unsupported observer settings " + settings.getClass().getSimpleName());
    }
}
