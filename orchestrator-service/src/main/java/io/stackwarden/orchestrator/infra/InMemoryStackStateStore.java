package io.stackwarden.orchestrator.infra;

import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.orchestrator.domain.StackRuntimeRecord;
import io.stackwarden.orchestrator.domain.StackStateStore;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Process-local stack state; last write wins.
 */
@Component
public class InMemoryStackStateStore implements StackStateStore {
    private final Map<StackKey, StackRuntimeRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<StackRuntimeRecord> find(StackKey key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public void save(StackRuntimeRecord record) {
        records.put(record.key(), record);
    }

    @Override
    public void remove(StackKey key) {
        records.remove(key);
    }

    @Override
    public Collection<StackRuntimeRecord> all() {
        return List.copyOf(records.values());
    }
}
