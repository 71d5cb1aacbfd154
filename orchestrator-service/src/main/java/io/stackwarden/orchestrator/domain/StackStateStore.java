package io.stackwarden.orchestrator.domain;

import java.util.Collection;
import java.util.Optional;

/**
 * Key-value store of stack runtime records with last-write-wins semantics.
 */
public interface StackStateStore {

    Optional<StackRuntimeRecord> find(StackKey key);

    void save(StackRuntimeRecord record);

    void remove(StackKey key);

    Collection<StackRuntimeRecord> all();
}
