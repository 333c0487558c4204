package com.gladlabs.orchestrator.core.engine;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff between phase attempts: {@code base * 2^(n-1)}, capped, with
 * symmetric jitter of {@code ±jitter} as a fraction of the delay.
 */
public class RetryBackoff {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final DoubleSupplier random;

    public RetryBackoff(Duration baseDelay, Duration maxDelay, double jitter) {
        this(baseDelay, maxDelay, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryBackoff(Duration baseDelay, Duration maxDelay, double jitter, DoubleSupplier random) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = Math.max(0.0, Math.min(1.0, jitter));
        this.random = random;
    }

    public static RetryBackoff none() {
        return new RetryBackoff(Duration.ZERO, Duration.ZERO, 0.0);
    }

    /**
     * Delay before the given retry.
     *
     * @param retry 1 for the first retry, 2 for the second, ...
     */
    public Duration delayFor(int retry) {
        if (retry < 1 || baseDelay.isZero()) {
            return Duration.ZERO;
        }
        int exponent = Math.min(retry - 1, 30);
        long raw = baseDelay.toMillis() * (1L << exponent);
        long capped = Math.min(raw, maxDelay.toMillis());
        double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.max(0, Math.round(capped * factor)));
    }
}
