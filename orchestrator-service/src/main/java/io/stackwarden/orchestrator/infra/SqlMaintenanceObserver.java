package io.stackwarden.orchestrator.infra;

import io.stackwarden.orchestrator.app.AbstractMaintenanceObserver;
import io.stackwarden.runtime.ports.Clock;
import io.stackwarden.stack.model.MaintenanceObserverDefinition;
import io.stackwarden.stack.model.SqlObserverSettings;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Runs the observer query on a fresh connection per check; no pool is kept between polls.
 */
class SqlMaintenanceObserver extends AbstractMaintenanceObserver {

    private final SqlObserverSettings settings;
    private final JdbcTemplate jdbc;

    SqlMaintenanceObserver(MaintenanceObserverDefinition definition,
                           SqlObserverSettings settings,
                           JdbcTemplate jdbc,
                           Clock clock) {
        super(definition, clock);
        this.settings = settings;
        this.jdbc = jdbc;
    }

    static SqlMaintenanceObserver connect(MaintenanceObserverDefinition definition,
                                          SqlObserverSettings settings,
                                          Clock clock) {
        DriverManagerDataSource dataSource =
            new DriverManagerDataSource(settings.jdbcUrl(), settings.username(), settings.password());
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setMaxRows(1);
        jdbc.setQueryTimeout((int) Math.max(1, definition.pollInterval().toSeconds()));
        return new SqlMaintenanceObserver(definition, settings, jdbc, clock);
    }

    @Override
    protected String readValue() {
        List<String> rows = jdbc.query(settings.query(), (rs, rowNum) -> rs.getString(1));
        if (rows.isEmpty()) {
            throw new IllegalStateException("observer query returned no rows");
        }
        String value = rows.get(0);
        return value == null ? "" : value;
    }
}
