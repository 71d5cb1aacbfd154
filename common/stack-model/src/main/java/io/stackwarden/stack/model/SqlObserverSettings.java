package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Reads a single scalar value through JDBC. The first column of the first row is the observed
 * value; no row at all is an observer failure.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SqlObserverSettings(String jdbcUrl,
                                  String username,
                                  String password,
                                  String query) implements ObserverSettings {

    public SqlObserverSettings {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("sql observer jdbcUrl must not be blank");
        }
        if (!jdbcUrl.startsWith("jdbc:")) {
            throw new IllegalArgumentException("sql observer jdbcUrl must start with jdbc:");
        }
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("sql observer query must not be blank");
        }
    }

    @Override
    public String describe() {
        int params = jdbcUrl.indexOf('?');
        return "query on " + (params < 0 ? jdbcUrl : jdbcUrl.substring(0, params));
    }

    @Override
    public String toString() {
        return "SqlObserverSettings[jdbcUrl=" + describe() + ", username=" + username + ", query=" + query + "]";
    }
}
