package com.coderenew.core.resilience;

import com.coderenew.core.exception.AnalysisServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retries transient analysis-service failures with capped exponential backoff.
 *
 * <p>The delay before retry {@code n} (1-based) is
 * {@code min(maxDelay, baseDelay * 2^(n-1) + jitter)} with jitter drawn uniformly
 * from {@code [0, 1)} seconds. Only failures whose {@link AnalysisServiceException#isRetryable()}
 * is true are retried; everything else propagates immediately.
 *
 * <p>Sleeps are interruptible: interrupting the calling thread aborts the retry loop
 * with {@link InterruptedException}.
 */
public class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, Sleeper sleeper, DoubleSupplier jitter) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.jitter = Objects.requireNonNull(jitter, "jitter must not be null");
    }

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {
        this(maxRetries, baseDelay, maxDelay, Sleeper.threadSleeper(), () -> ThreadLocalRandom.current().nextDouble());
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * Runs the call, retrying transient failures.
     *
     * @param call call to run
     * @param <T> result type
     * @return call result
     * @throws AnalysisServiceException the last failure when it is not retryable or retries are exhausted
     * @throws InterruptedException if interrupted during the call or a backoff sleep
     */
    public <T> T execute(ServiceCall<T> call) throws InterruptedException {
        int retries = 0;
        while (true) {
            try {
                return call.call();
            } catch (AnalysisServiceException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (retries >= maxRetries) {
                    log.warn("Giving up after {} retries: {}", retries, e.getMessage());
                    throw e;
                }
                retries++;
                Duration delay = delayFor(retries);
                log.warn("Transient {} failure, retry {}/{} in {} ms: {}",
                    e.getFailure(), retries, maxRetries, delay.toMillis(), e.getMessage());
                sleeper.sleep(delay);
            }
        }
    }

    /**
     * Computes the backoff before the given retry.
     *
     * @param retry 1-based retry number
     * @return delay, never above the configured maximum
     */
    Duration delayFor(int retry) {
        long exponential = baseDelay.toMillis() * (1L << Math.min(retry - 1, 30));
        long jitterMillis = (long) (jitter.getAsDouble() * 1000);
        long capped = Math.min(maxDelay.toMillis(), exponential + jitterMillis);
        return Duration.ofMillis(capped);
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
