package io.harvestcore.queue;

import io.harvestcore.config.CoordinationSettings;
import io.harvestcore.runtime.HarvestFixture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class CircuitBreakerTest {

    @Test
    void opensAtThresholdAndClosesAfterCooldown() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CircuitBreaker breaker = new CircuitBreaker("gov-portal", 3, Duration.ofSeconds(60), fx.clock, fx.auditLogger);
            breaker.recordFailure();
            breaker.recordFailure();
            Assertions.assertTrue(breaker.allowRequest());

            breaker.recordFailure();
            Assertions.assertFalse(breaker.allowRequest());
            Assertions.assertEquals(Duration.ofSeconds(60), breaker.remainingCooldown());
            Assertions.assertEquals(1, fx.audit("circuit.open").size());

            fx.clock.advance(Duration.ofSeconds(59));
            Assertions.assertFalse(breaker.allowRequest());
            fx.clock.advance(Duration.ofSeconds(1));
            Assertions.assertTrue(breaker.allowRequest());
            Assertions.assertFalse(breaker.snapshot().open());
            Assertions.assertEquals(0, breaker.snapshot().consecutiveFailures());
            Assertions.assertEquals(1, fx.audit("circuit.close").size());
        }
    }

    @Test
    void failureWhileOpenExtendsTheCooldown() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CircuitBreaker breaker = new CircuitBreaker("gov-portal", 1, Duration.ofSeconds(60), fx.clock, fx.auditLogger);
            breaker.recordFailure();
            fx.clock.advance(Duration.ofSeconds(50));
            breaker.recordFailure();
            fx.clock.advance(Duration.ofSeconds(20));
            Assertions.assertFalse(breaker.allowRequest());
            Assertions.assertEquals(Duration.ofSeconds(40), breaker.remainingCooldown());
            Assertions.assertEquals(1, fx.audit("circuit.open").size());
        }
    }

    @Test
    void successResetsTheFailureStreak() throws Exception {
        try (HarvestFixture fx = HarvestFixture.create()) {
            CircuitBreaker breaker = new CircuitBreaker("gov-portal", 3, Duration.ofSeconds(60), fx.clock, fx.auditLogger);
            breaker.recordFailure();
            breaker.recordFailure();
            breaker.recordSuccess();
            breaker.recordFailure();
            breaker.recordFailure();
            Assertions.assertTrue(breaker.allowRequest());
            Assertions.assertTrue(fx.audit("circuit.close").isEmpty());
        }
    }

    @Test
    void registryHandsOutOneBreakerPerDependency() throws Exception {
        CoordinationSettings settings = CoordinationSettings.defaults().withCircuit(2, 10_000L);
        try (HarvestFixture fx = HarvestFixture.create(settings)) {
            CircuitBreakers breakers = fx.components.breakers();
            CircuitBreaker a = breakers.forDependency("portal-a");
            Assertions.assertSame(a, breakers.forDependency("portal-a"));
            Assertions.assertNotSame(a, breakers.forDependency("portal-b"));

            a.recordFailure();
            a.recordFailure();
            Assertions.assertFalse(a.allowRequest());
            Assertions.assertTrue(breakers.forDependency("portal-b").allowRequest());
            Assertions.assertEquals(2, breakers.snapshots().size());
            Assertions.assertThrows(IllegalArgumentException.class, () -> breakers.forDependency(" "));
        }
    }
}
