package io.stackwarden.orchestrator.infra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stackwarden.orchestrator.domain.HealthSnapshot;
import io.stackwarden.orchestrator.domain.SelfHealth;
import io.stackwarden.orchestrator.domain.StackKey;
import io.stackwarden.orchestrator.domain.StackRuntimeRecord;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryHealthHistoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final StackKey SHOP = new StackKey("staging", "shop");

    private static HealthSnapshot at(StackKey key, Instant when) {
        return HealthSnapshot.capture(StackRuntimeRecord.initial(key, "acme", T0), when, new SelfHealth(null), null,
            null);
    }

    @Test
    void dropsSnapshotsOlderThanRetention() {
        InMemoryHealthHistory history = new InMemoryHealthHistory(Duration.ofMinutes(10), 100);

        history.append(at(SHOP, T0));
        history.append(at(SHOP, T0.plus(Duration.ofMinutes(5))));
        history.append(at(SHOP, T0.plus(Duration.ofMinutes(12))));

        assertThat(history.since(SHOP, null)).extracting(HealthSnapshot::capturedAt)
            .containsExactly(T0.plus(Duration.ofMinutes(5)), T0.plus(Duration.ofMinutes(12)));
    }

    @Test
    void keepsAtMostMaxEntries() {
        InMemoryHealthHistory history = new InMemoryHealthHistory(Duration.ofDays(1), 3);

        for (int i = 0; i < 5; i++) {
            history.append(at(SHOP, T0.plusSeconds(i)));
        }

        assertThat(history.since(SHOP, null)).hasSize(3);
        assertThat(history.latest(SHOP)).hasValueSatisfying(
            snapshot -> assertThat(snapshot.capturedAt()).isEqualTo(T0.plusSeconds(4)));
    }

    @Test
    void sinceIsInclusive() {
        InMemoryHealthHistory history = new InMemoryHealthHistory(Duration.ofDays(1), 10);
        history.append(at(SHOP, T0));
        history.append(at(SHOP, T0.plusSeconds(30)));
        history.append(at(SHOP, T0.plusSeconds(60)));

        assertThat(history.since(SHOP, T0.plusSeconds(30))).hasSize(2);
        assertThat(history.since(new StackKey("staging", "blog"), null)).isEmpty();
    }

    @Test
    void latestForEnvironmentIgnoresOtherEnvironmentsAndForgottenStacks() {
        InMemoryHealthHistory history = new InMemoryHealthHistory(Duration.ofDays(1), 10);
        history.append(at(SHOP, T0));
        history.append(at(new StackKey("staging", "blog"), T0));
        history.append(at(new StackKey("production", "shop"), T0));

        history.forget(new StackKey("staging", "blog"));

        assertThat(history.latestForEnvironment("staging")).extracting(HealthSnapshot::key).containsExactly(SHOP);
    }

    @Test
    void rejectsEmptyCapacity() {
        assertThatThrownBy(() -> new InMemoryHealthHistory(Duration.ofHours(1), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
