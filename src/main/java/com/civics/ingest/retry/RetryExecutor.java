package com.civics.ingest.retry;

import com.civics.ingest.connector.ConnectorResult;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.ratelimit.AcquireResult;
import com.civics.ingest.ratelimit.RateClock;
import com.civics.ingest.ratelimit.RateGovernor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry around one governed connector call.
 *
 * <ul>
 *   <li>Every attempt first acquires a token from the {@link RateGovernor}; a throttled
 *       acquire ends the call as EXHAUSTED.</li>
 *   <li>RATE_LIMITED is reported to the governor, which empties the bucket for a backoff
 *       window; the next acquire waits it out.</li>
 *   <li>TRANSIENT sleeps the policy backoff and tries again up to {@code maxAttempts}.</li>
 *   <li>INVALID and EXHAUSTED are returned as they are.</li>
 * </ul>
 */
public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final RateGovernor governor;
    private final RateClock clock;

    public RetryExecutor(RetryPolicy policy, RateGovernor governor, RateClock clock) {
        this.policy = policy;
        this.governor = governor;
        this.clock = clock;
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * @throws InterruptedException if the worker is cancelled while waiting for a token or a backoff
     */
    public <T> RetryOutcome<T> execute(Provider provider, Supplier<ConnectorResult<T>> call)
            throws InterruptedException {
        int attempts = 0;
        int rateLimited = 0;
        int transientFailures = 0;

        while (true) {
            AcquireResult permit = governor.acquire(provider);
            if (permit.isThrottled()) {
                ConnectorResult<T> exhausted = ConnectorResult.exhausted(
                        "Quota wait exceeded, retry after " + permit.retryAfter().toMillis() + "ms");
                return new RetryOutcome<>(exhausted, attempts, rateLimited, transientFailures);
            }

            attempts++;
            ConnectorResult<T> result = call.get();
            if (result.isSuccess()) {
                governor.reportSuccess(provider);
                return new RetryOutcome<>(result, attempts, rateLimited, transientFailures);
            }

            switch (result.errorKind()) {
                case RATE_LIMITED -> {
                    rateLimited++;
                    governor.reportRateLimited(provider, result.retryAfter());
                    if (rateLimited > policy.maxRateLimitRetries()) {
                        log.warn("retry.rateLimitGiveUp provider={} signals={}", provider.key(), rateLimited);
                        return new RetryOutcome<>(result, attempts, rateLimited, transientFailures);
                    }
                }
                case TRANSIENT -> {
                    transientFailures++;
                    if (transientFailures >= policy.maxAttempts()) {
                        log.warn("retry.transientGiveUp provider={} attempts={} message={}",
                                provider.key(), attempts, result.message());
                        return new RetryOutcome<>(result, attempts, rateLimited, transientFailures);
                    }
                    Duration backoff = policy.delay(transientFailures - 1);
                    log.debug("retry.backoff provider={} attempt={} delayMs={}",
                            provider.key(), attempts, backoff.toMillis());
                    clock.sleep(backoff);
                }
                default -> {
                    return new RetryOutcome<>(result, attempts, rateLimited, transientFailures);
                }
            }
        }
    }
}
