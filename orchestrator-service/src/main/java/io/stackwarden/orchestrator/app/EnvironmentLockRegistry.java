package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.OperationInProgressException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * At most one lifecycle operation per environment. Acquisition never waits: a busy environment
 * rejects the caller immediately.
 */
public class EnvironmentLockRegistry {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentLockRegistry.class);

    private final Map<String, Semaphore> locks = new ConcurrentHashMap<>();
    private final Map<String, String> holders = new ConcurrentHashMap<>();

    /**
     * @throws OperationInProgressException when another operation holds the environment
     */
    public Lease acquire(String environmentId, String operation) {
        Semaphore semaphore = locks.computeIfAbsent(environmentId, id -> new Semaphore(1));
        if (!semaphore.tryAcquire()) {
            String running = holders.getOrDefault(environmentId, "another operation");
            log.info("Rejecting {} on environment {}: {} is running", operation, environmentId, running);
            throw new OperationInProgressException(environmentId, running);
        }
        holders.put(environmentId, operation);
        log.debug("Environment {} locked for {}", environmentId, operation);
        return new Lease(environmentId, semaphore);
    }

    public boolean isLocked(String environmentId) {
        Semaphore semaphore = locks.get(environmentId);
        return semaphore != null && semaphore.availablePermits() == 0;
    }

    /**
     * Held lock of one environment; closing it more than once releases it only once.
     */
    public final class Lease implements AutoCloseable {
        private final String environmentId;
        private final Semaphore semaphore;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(String environmentId, Semaphore semaphore) {
            this.environmentId = environmentId;
            this.semaphore = semaphore;
        }

        public String environmentId() {
            return environmentId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                holders.remove(environmentId);
                semaphore.release();
                log.debug("Environment {} unlocked", environmentId);
            }
        }
    }
}
