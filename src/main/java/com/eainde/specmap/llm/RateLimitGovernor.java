package com.eainde.specmap.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.function.LongSupplier;

/**
 * Process-wide admission control for outbound model calls.
 *
 * <p>Two limits apply: at most {@code maxConcurrent} calls in flight, and call starts spaced
 * at least {@code 60s / requestsPerMinute} apart. Callers over either limit block until
 * admitted; nothing is rejected. When the provider signals a rate limit, {@link #penalize}
 * pushes the next admission back for every caller.</p>
 */
public class RateLimitGovernor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitGovernor.class);

    private final Semaphore inFlight;
    private final long minSpacingNanos;
    private final LongSupplier clock;
    private final RetryPolicy.Sleeper sleeper;

    private long nextStartNanos;

    public RateLimitGovernor(int maxConcurrent, int requestsPerMinute) {
        this(maxConcurrent, requestsPerMinute, System::nanoTime, d -> Thread.sleep(d.toMillis()));
    }

    RateLimitGovernor(int maxConcurrent, int requestsPerMinute, LongSupplier clock, RetryPolicy.Sleeper sleeper) {
        if (maxConcurrent < 1) throw new IllegalArgumentException("maxConcurrent must be >= 1");
        this.inFlight = new Semaphore(maxConcurrent, true);
        this.minSpacingNanos = requestsPerMinute > 0 ? Duration.ofMinutes(1).toNanos() / requestsPerMinute : 0L;
        this.clock = clock;
        this.sleeper = sleeper;
        this.nextStartNanos = clock.getAsLong();
    }

    /**
     * Blocks until the caller may start a call. Every successful acquire must be paired
     * with {@link #release()}.
     */
    public void acquire() throws InterruptedException {
        inFlight.acquire();
        try {
            long wait = reserveStartSlot();
            if (wait > 0) {
                sleeper.sleep(Duration.ofNanos(wait));
            }
        } catch (InterruptedException | RuntimeException e) {
            inFlight.release();
            throw e;
        }
    }

    public void release() {
        inFlight.release();
    }

    /**
     * Delays the next admission by at least {@code backoff} from now.
     */
    public synchronized void penalize(Duration backoff) {
        long candidate = clock.getAsLong() + backoff.toNanos();
        if (candidate > nextStartNanos) {
            nextStartNanos = candidate;
            log.info("Rate limit signalled, holding new model calls for {} ms", backoff.toMillis());
        }
    }

    public int availablePermits() {
        return inFlight.availablePermits();
    }

    private synchronized long reserveStartSlot() {
        long now = clock.getAsLong();
        long start = Math.max(now, nextStartNanos);
        nextStartNanos = start + minSpacingNanos;
        return start - now;
    }
}
