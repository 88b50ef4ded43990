package com.civics.ingest.ratelimit;

import com.civics.ingest.core.model.Provider;
import com.civics.ingest.metrics.MetricsService;
import com.civics.ingest.support.ManualRateClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RateGovernorTest {

    @Mock
    private MetricsService metricsService;

    private ManualRateClock clock;
    private RateGovernor governor;

    @BeforeEach
    void setUp() {
        clock = new ManualRateClock();
        governor = new RateGovernor(clock, metricsService);
    }

    @Nested
    @DisplayName("Token bucket")
    class TokenBucket {

        @Test
        @DisplayName("Should grant immediately while tokens remain")
        void testGrantWithinCapacity() throws InterruptedException {
            governor.register(Provider.FEDERAL_ROSTER, QuotaPolicy.of(3, Duration.ofMinutes(1), Duration.ZERO));

            for (int i = 0; i < 3; i++) {
                AcquireResult result = governor.acquire(Provider.FEDERAL_ROSTER);
                assertTrue(result.granted());
                assertEquals(Duration.ZERO, result.waited());
            }
            assertTrue(clock.sleeps().isEmpty());
            assertEquals(3, governor.snapshot(Provider.FEDERAL_ROSTER).granted());
        }

        @Test
        @DisplayName("Should wait for refill once the bucket is empty")
        void testWaitForRefill() throws InterruptedException {
            governor.register(Provider.FEDERAL_ROSTER, QuotaPolicy.of(2, Duration.ofSeconds(10), Duration.ZERO));
            governor.acquire(Provider.FEDERAL_ROSTER);
            governor.acquire(Provider.FEDERAL_ROSTER);

            AcquireResult third = governor.acquire(Provider.FEDERAL_ROSTER);

            assertTrue(third.granted());
            assertFalse(third.waited().isZero());
            // one token refills every 5 seconds
            assertTrue(clock.totalSlept().compareTo(Duration.ofSeconds(5)) >= 0);
            assertTrue(clock.totalSlept().compareTo(Duration.ofSeconds(6)) < 0);
        }

        @Test
        @DisplayName("Should space requests by the minimum interval")
        void testMinInterval() throws InterruptedException {
            governor.register(Provider.CAMPAIGN_FINANCE,
                    QuotaPolicy.of(1000, Duration.ofHours(1), Duration.ofMillis(1200)));

            governor.acquire(Provider.CAMPAIGN_FINANCE);
            AcquireResult second = governor.acquire(Provider.CAMPAIGN_FINANCE);

            assertTrue(second.granted());
            assertEquals(Duration.ofMillis(1200), clock.totalSlept());
        }

        @Test
        @DisplayName("Should report throttled when the wait exceeds the acquire timeout")
        void testThrottled() throws InterruptedException {
            governor.register(Provider.FEDERAL_ROSTER, new QuotaPolicy(1, Duration.ofDays(1), Duration.ZERO,
                    Duration.ofSeconds(30), Duration.ofSeconds(2), Duration.ofMinutes(5)));
            governor.acquire(Provider.FEDERAL_ROSTER);

            AcquireResult result = governor.acquire(Provider.FEDERAL_ROSTER);

            assertTrue(result.isThrottled());
            assertTrue(result.retryAfter().compareTo(Duration.ofHours(23)) > 0);
            assertEquals(1, governor.snapshot(Provider.FEDERAL_ROSTER).throttled());
            verify(metricsService).incrementThrottled(Provider.FEDERAL_ROSTER);
        }

        @Test
        @DisplayName("Should keep buckets of different providers independent")
        void testIndependentBuckets() throws InterruptedException {
            governor.register(Provider.FEDERAL_ROSTER, QuotaPolicy.daily(1, Duration.ZERO));
            governor.register(Provider.STATE_LEGISLATURE, QuotaPolicy.daily(1, Duration.ZERO));
            governor.acquire(Provider.FEDERAL_ROSTER);

            assertTrue(governor.acquire(Provider.STATE_LEGISLATURE).granted());
            assertEquals(0.0, governor.snapshot(Provider.FEDERAL_ROSTER).availableTokens(), 0.01);
        }

        @Test
        @DisplayName("Should reject providers without a registered quota")
        void testUnregistered() {
            assertFalse(governor.isRegistered(Provider.CIVIC_LOOKUP));
            assertThrows(IllegalArgumentException.class, () -> governor.acquire(Provider.CIVIC_LOOKUP));
        }
    }

    @Nested
    @DisplayName("Rate-limit backoff")
    class Backoff {

        @BeforeEach
        void register() {
            governor.register(Provider.STATE_LEGISLATURE,
                    QuotaPolicy.of(100, Duration.ofSeconds(1), Duration.ZERO));
        }

        @Test
        @DisplayName("Should block acquisition for the backoff period after a rate-limit signal")
        void testBlocksAfterSignal() throws InterruptedException {
            governor.reportRateLimited(Provider.STATE_LEGISLATURE, null);

            BucketSnapshot snapshot = governor.snapshot(Provider.STATE_LEGISLATURE);
            assertTrue(snapshot.backingOff());
            assertEquals(1, snapshot.consecutiveRateLimits());

            AcquireResult result = governor.acquire(Provider.STATE_LEGISLATURE);
            assertTrue(result.granted());
            assertTrue(clock.totalSlept().compareTo(Duration.ofSeconds(2)) >= 0);
            verify(metricsService).incrementRateLimited(Provider.STATE_LEGISLATURE);
        }

        @Test
        @DisplayName("Should double the backoff on consecutive signals")
        void testDoubling() throws InterruptedException {
            governor.reportRateLimited(Provider.STATE_LEGISLATURE, null);
            governor.reportRateLimited(Provider.STATE_LEGISLATURE, null);
            governor.reportRateLimited(Provider.STATE_LEGISLATURE, null);

            governor.acquire(Provider.STATE_LEGISLATURE);

            assertEquals(3, governor.snapshot(Provider.STATE_LEGISLATURE).consecutiveRateLimits());
            assertTrue(clock.totalSlept().compareTo(Duration.ofSeconds(8)) >= 0);
        }

        @Test
        @DisplayName("Should honor a Retry-After hint longer than the computed backoff")
        void testRetryAfterHint() throws InterruptedException {
            governor.reportRateLimited(Provider.STATE_LEGISLATURE, Duration.ofSeconds(20));

            governor.acquire(Provider.STATE_LEGISLATURE);

            assertTrue(clock.totalSlept().compareTo(Duration.ofSeconds(20)) >= 0);
        }

        @Test
        @DisplayName("Should reset the consecutive count after a success")
        void testResetOnSuccess() {
            governor.reportRateLimited(Provider.STATE_LEGISLATURE, null);
            governor.reportSuccess(Provider.STATE_LEGISLATURE);

            assertEquals(0, governor.snapshot(Provider.STATE_LEGISLATURE).consecutiveRateLimits());
        }
    }

    @Test
    @DisplayName("Should cap the backoff at the policy maximum")
    void testBackoffCap() {
        QuotaPolicy policy = QuotaPolicy.of(10, Duration.ofMinutes(1), Duration.ZERO);

        assertEquals(Duration.ofSeconds(2), policy.backoffFor(1));
        assertEquals(Duration.ofSeconds(4), policy.backoffFor(2));
        assertEquals(Duration.ofSeconds(8), policy.backoffFor(3));
        assertEquals(Duration.ofMinutes(5), policy.backoffFor(12));
        assertEquals(Duration.ofMinutes(5), policy.backoffFor(500));
    }

    @Test
    @DisplayName("Should validate quota policies")
    void testPolicyValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> QuotaPolicy.of(0, Duration.ofMinutes(1), Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> QuotaPolicy.of(10, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> QuotaPolicy.of(10, Duration.ofMinutes(1), Duration.ofMillis(-1)));
    }
}
