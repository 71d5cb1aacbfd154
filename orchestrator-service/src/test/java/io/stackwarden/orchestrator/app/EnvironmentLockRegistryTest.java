package io.stackwarden.orchestrator.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.stackwarden.orchestrator.domain.OperationInProgressException;
import io.stackwarden.orchestrator.domain.ReasonCode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class EnvironmentLockRegistryTest {

    private final EnvironmentLockRegistry registry = new EnvironmentLockRegistry();

    @Test
    void secondAcquisitionIsRejectedUntilTheFirstIsReleased() {
        EnvironmentLockRegistry.Lease lease = registry.acquire("staging", "deploy of staging/shop");

        assertThatThrownBy(() -> registry.acquire("staging", "stop of staging/blog"))
            .isInstanceOfSatisfying(OperationInProgressException.class, e -> {
                assertThat(e.reason()).isEqualTo(ReasonCode.OPERATION_IN_PROGRESS);
                assertThat(e.retryable()).isTrue();
                assertThat(e.getMessage()).contains("deploy of staging/shop");
            });

        lease.close();

        try (EnvironmentLockRegistry.Lease next = registry.acquire("staging", "stop of staging/blog")) {
            assertTrue(registry.isLocked(next.environmentId()));
        }
        assertFalse(registry.isLocked("staging"));
    }

    @Test
    void environmentsAreLockedIndependently() {
        try (EnvironmentLockRegistry.Lease staging = registry.acquire("staging", "deploy");
             EnvironmentLockRegistry.Lease production = registry.acquire("production", "deploy")) {
            assertTrue(registry.isLocked("staging"));
            assertTrue(registry.isLocked("production"));
        }
    }

    @Test
    void closingALeaseTwiceReleasesOnce() {
        EnvironmentLockRegistry.Lease lease = registry.acquire("staging", "deploy");
        lease.close();
        EnvironmentLockRegistry.Lease other = registry.acquire("staging", "upgrade");

        lease.close();

        assertTrue(registry.isLocked("staging"));
        other.close();
    }

    @Test
    void concurrentAcquisitionsAdmitExactlyOne() throws Exception {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch ready = new CountDownLatch(contenders);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<EnvironmentLockRegistry.Lease>> attempts = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                String operation = "deploy #" + i;
                Callable<EnvironmentLockRegistry.Lease> attempt = () -> {
                    ready.countDown();
                    go.await();
                    return registry.acquire("staging", operation);
                };
                attempts.add(pool.submit(attempt));
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            go.countDown();

            int admitted = 0;
            int rejected = 0;
            for (Future<EnvironmentLockRegistry.Lease> attempt : attempts) {
                try {
                    attempt.get(5, TimeUnit.SECONDS);
                    admitted++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(OperationInProgressException.class);
                    rejected++;
                }
            }
            assertThat(admitted).isEqualTo(1);
            assertThat(rejected).isEqualTo(contenders - 1);
        } finally {
            pool.shutdownNow();
        }
    }
}
