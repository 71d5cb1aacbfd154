package io.stackwarden.stack.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Source a maintenance observer reads its value from.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = HttpObserverSettings.class, name = "http"),
    @JsonSubTypes.Type(value = FileObserverSettings.class, name = "file"),
    @JsonSubTypes.Type(value = SqlObserverSettings.class, name = "sql")
})
public sealed interface ObserverSettings permits HttpObserverSettings, FileObserverSettings, SqlObserverSettings {

    /**
     * Short human-readable description of what is being watched; never includes secrets.
     */
    String describe();
}
