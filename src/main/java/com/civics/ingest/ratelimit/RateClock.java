package com.civics.ingest.ratelimit;

import java.time.Duration;

/**
 * Time source and sleeper for rate limiting and retry backoff. Tests substitute a manual
 * clock so quota behavior can be verified without real waiting.
 */
public interface RateClock {

    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;

    static RateClock system() {
        return SystemRateClock.INSTANCE;
    }

    final class SystemRateClock implements RateClock {
        private static final SystemRateClock INSTANCE = new SystemRateClock();

        private SystemRateClock() {
        }

        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis(), (int) (duration.toNanos() % 1_000_000));
            }
        }
    }
}
