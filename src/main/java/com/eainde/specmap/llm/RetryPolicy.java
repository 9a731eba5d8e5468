package com.eainde.specmap.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff, shared by translation, extraction and
 * rate-limit handling so the schedule is defined in one place.
 *
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *         .maxAttempts(3)
 *         .initialDelay(Duration.ofSeconds(2))
 *         .multiplier(2.0)
 *         .maxDelay(Duration.ofSeconds(30))
 *         .build();
 *
 * String text = policy.execute("translate", () -> gateway.complete(messages), e -> true);
 * </pre>
 *
 * <p>Delay before retry {@code n} (1-based, counted after the first failed attempt) is
 * {@code initialDelay * multiplier^(n-1)}, capped at {@code maxDelay}.</p>
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** Sleeps between attempts. Replaced by a no-op in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelay = builder.initialDelay;
        this.multiplier = builder.multiplier;
        this.maxDelay = builder.maxDelay;
        this.sleeper = builder.sleeper;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Backoff to wait after the given failed attempt (1-based).
     */
    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Waits the backoff for the given failed attempt. Restores the interrupt flag and
     * returns false if interrupted, so callers can stop retrying.
     */
    public boolean backoff(int attempt) {
        Duration delay = delayAfterAttempt(attempt);
        if (delay.isZero()) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Runs {@code call} until it succeeds, the failure is not retryable, or attempts run out.
     * The last failure is rethrown (checked exceptions wrapped in {@link RetryExhaustedException}).
     */
    public <T> T execute(String operation, Callable<T> call, Predicate<Exception> retryable) {
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (Exception e) {
                last = e;
                boolean more = attempt < maxAttempts && retryable.test(e);
                log.warn("{} failed (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
                if (!more || !backoff(attempt)) {
                    break;
                }
            }
        }
        if (last instanceof RuntimeException runtime) {
            throw runtime;
        }
        throw new RetryExhaustedException(operation, last);
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts + ", initialDelay=" + initialDelay
                + ", multiplier=" + multiplier + ", maxDelay=" + maxDelay + "]";
    }

    /**
     * Wraps a checked failure left over after the final attempt.
     */
    public static class RetryExhaustedException extends RuntimeException {
        public RetryExhaustedException(String operation, Throwable cause) {
            super(operation + " failed after retries", cause);
        }
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(30);
        private Sleeper sleeper = d -> Thread.sleep(d.toMillis());

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay must be >= 0");
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public RetryPolicy build() {
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must be >= initialDelay");
            }
            return new RetryPolicy(this);
        }
    }
}
