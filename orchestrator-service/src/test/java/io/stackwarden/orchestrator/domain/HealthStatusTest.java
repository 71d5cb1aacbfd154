package io.stackwarden.orchestrator.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class HealthStatusTest {

    @Test
    void combiningKeepsTheWorse() {
        assertEquals(HealthStatus.DEGRADED, HealthStatus.HEALTHY.combineWith(HealthStatus.DEGRADED));
        assertEquals(HealthStatus.UNHEALTHY, HealthStatus.UNHEALTHY.combineWith(HealthStatus.DEGRADED));
        assertEquals(HealthStatus.UNKNOWN, HealthStatus.UNHEALTHY.combineWith(HealthStatus.UNKNOWN));
        assertEquals(HealthStatus.HEALTHY, HealthStatus.HEALTHY.combineWith(null));
    }

    @Test
    void worstOfNothingIsUnknown() {
        assertEquals(HealthStatus.UNKNOWN, HealthStatus.worstOf(List.of()));
        assertEquals(HealthStatus.DEGRADED,
            HealthStatus.worstOf(List.of(HealthStatus.HEALTHY, HealthStatus.DEGRADED, HealthStatus.HEALTHY)));
    }

    @Test
    void modeImpliesMinimumStatus() {
        assertEquals(HealthStatus.HEALTHY, HealthStatus.minimumFor(OperationMode.NORMAL));
        assertEquals(HealthStatus.DEGRADED, HealthStatus.minimumFor(OperationMode.MIGRATING));
        assertEquals(HealthStatus.DEGRADED, HealthStatus.minimumFor(OperationMode.MAINTENANCE));
        assertEquals(HealthStatus.DEGRADED, HealthStatus.minimumFor(OperationMode.STOPPED));
        assertEquals(HealthStatus.UNHEALTHY, HealthStatus.minimumFor(OperationMode.FAILED));
    }

    @Test
    void overallIsNeverBetterThanTheModeAllows() {
        SelfHealth healthy = new SelfHealth(List.of(new ServiceHealth("api", "c1", "shop_api",
            HealthStatus.HEALTHY, 0, null)));

        assertEquals(HealthStatus.DEGRADED,
            HealthSource.overall(OperationMode.MAINTENANCE, List.of(new HealthSource.SelfSource(healthy))));
        assertEquals(HealthStatus.HEALTHY,
            HealthSource.overall(OperationMode.NORMAL, List.of(new HealthSource.SelfSource(healthy))));
    }
}
