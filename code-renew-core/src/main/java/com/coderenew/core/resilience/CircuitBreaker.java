package com.coderenew.core.resilience;

import com.coderenew.core.exception.AnalysisServiceException;
import com.coderenew.core.exception.CircuitBreakerOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Failure-isolation state machine guarding calls to one external dependency.
 *
 * <p>Transitions:
 * <ul>
 *   <li>CLOSED to OPEN after {@code failureThreshold} consecutive counted failures</li>
 *   <li>OPEN to HALF_OPEN once {@code resetTimeout} has elapsed, admitting one trial call</li>
 *   <li>HALF_OPEN to CLOSED when the trial succeeds, back to OPEN when it fails</li>
 * </ul>
 *
 * <p>While OPEN, and while a half-open trial is in flight, calls fail with
 * {@link CircuitBreakerOpenException} without running. Failures matched by the
 * exclusion predicate (client-side request errors) are treated as successes.
 *
 * <p>State changes are serialized on this instance; the guarded call itself runs
 * outside the lock. One breaker is meant to be shared by every caller of the dependency.
 */
public class CircuitBreaker {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(30);

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final Predicate<Throwable> excluded;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, Clock clock,
                          Predicate<Throwable> excluded) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
        this.resetTimeout = Objects.requireNonNull(resetTimeout, "resetTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.excluded = Objects.requireNonNull(excluded, "excluded must not be null");
    }

    /**
     * Creates a breaker that ignores client-side validation and authentication errors
     * and malformed responses.
     *
     * @param name breaker name used in logs and exceptions
     * @param failureThreshold consecutive failures before opening
     * @param resetTimeout time to stay open before a trial call
     * @param clock time source
     * @return circuit breaker
     */
    public static CircuitBreaker forAnalysisService(String name, int failureThreshold, Duration resetTimeout, Clock clock) {
        return new CircuitBreaker(name, failureThreshold, resetTimeout, clock,
            e -> e instanceof AnalysisServiceException ase && !ase.indicatesServiceFailure());
    }

    /**
     * Runs the call if the breaker admits it.
     *
     * @param call guarded call
     * @param <T> result type
     * @return call result
     * @throws CircuitBreakerOpenException if the breaker rejects the call
     * @throws InterruptedException if the call is interrupted; interruption is not counted
     */
    public <T> T execute(ServiceCall<T> call) throws InterruptedException {
        acquirePermission();
        T result;
        try {
            result = call.call();
        } catch (InterruptedException e) {
            releaseTrial();
            throw e;
        } catch (RuntimeException e) {
            if (excluded.test(e)) {
                onSuccess();
            } else {
                onFailure(e);
            }
            throw e;
        }
        onSuccess();
        return result;
    }

    /**
     * Returns a snapshot of the current state.
     *
     * @return status snapshot
     */
    public synchronized CircuitBreakerStatus status() {
        return new CircuitBreakerStatus(name, state, failureCount, openedAt);
    }

    public synchronized CircuitBreakerState getState() {
        return state;
    }

    public String getName() {
        return name;
    }

    private synchronized void acquirePermission() {
        Instant now = clock.instant();
        if (state == CircuitBreakerState.OPEN) {
            Instant retryAt = openedAt.plus(resetTimeout);
            if (now.isBefore(retryAt)) {
                throw new CircuitBreakerOpenException(name, secondsUntil(now, retryAt));
            }
            transitionTo(CircuitBreakerState.HALF_OPEN);
        }
        if (state == CircuitBreakerState.HALF_OPEN) {
            if (trialInFlight) {
                throw new CircuitBreakerOpenException(name, 1);
            }
            trialInFlight = true;
        }
    }

    private synchronized void onSuccess() {
        failureCount = 0;
        trialInFlight = false;
        if (state != CircuitBreakerState.CLOSED) {
            transitionTo(CircuitBreakerState.CLOSED);
        }
    }

    private synchronized void onFailure(RuntimeException error) {
        failureCount++;
        trialInFlight = false;
        log.debug("Circuit breaker '{}' recorded failure {}/{}: {}",
            name, failureCount, failureThreshold, error.getMessage());
        if (state == CircuitBreakerState.HALF_OPEN
            || (state == CircuitBreakerState.CLOSED && failureCount >= failureThreshold)) {
            openedAt = clock.instant();
            transitionTo(CircuitBreakerState.OPEN);
        }
    }

    private synchronized void releaseTrial() {
        trialInFlight = false;
    }

    private void transitionTo(CircuitBreakerState next) {
        log.warn("Circuit breaker '{}' state changed: {} -> {}", name, state, next);
        state = next;
    }

    private static long secondsUntil(Instant now, Instant retryAt) {
        long millis = Duration.between(now, retryAt).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
