package com.relaychat.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 * <p>
 * Used by the durable consumer to space out redeliveries of an event the accumulator refused.
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the next backoff delay with jitter.
     *
     * @param attempt   Retry attempt number (0-based)
     * @param base      Base delay
     * @param max       Maximum delay (cap, before jitter)
     * @param jitterMax Maximum jitter to add
     * @return Computed delay
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20)); // Cap exponent to avoid overflow

        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterMs = jitterMax.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);

        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Backoff with jitter of up to a quarter of the capped delay.
     *
     * @param attempt Retry attempt number (0-based)
     * @param base    Base delay
     * @param max     Maximum delay
     * @return Computed delay
     */
    public static Duration next(int attempt, Duration base, Duration max) {
        long capped = Math.min(base.toMillis() * (1L << Math.min(Math.max(attempt, 0), 20)), max.toMillis());
        return next(attempt, base, max, Duration.ofMillis(capped / 4));
    }
}
