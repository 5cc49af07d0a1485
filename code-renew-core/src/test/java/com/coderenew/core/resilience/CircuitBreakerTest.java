package com.coderenew.core.resilience;

import com.coderenew.core.exception.AnalysisServiceException;
import com.coderenew.core.exception.AnalysisServiceException.Failure;
import com.coderenew.core.exception.CircuitBreakerOpenException;
import com.coderenew.core.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CircuitBreaker}.
 */
class CircuitBreakerTest {

    private final MutableClock clock = new MutableClock();
    private final CircuitBreaker breaker =
        CircuitBreaker.forAnalysisService("analysis-service", 3, Duration.ofSeconds(30), clock);

    private static ServiceCall<String> failing(Failure failure) {
        return () -> {
            throw new AnalysisServiceException(failure, 500, "boom");
        };
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            assertThatThrownBy(() -> breaker.execute(failing(Failure.SERVER_ERROR)))
                .isInstanceOf(AnalysisServiceException.class);
        }
    }

    @Test
    void execute_thresholdConsecutiveFailures_opens() {
        // When
        failTimes(3);

        // Then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.status().openedAt()).isEqualTo(clock.instant());
    }

    @Test
    void execute_successResetsFailureCount() throws InterruptedException {
        failTimes(2);
        breaker.execute(() -> "ok");
        failTimes(2);

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.status().failureCount()).isEqualTo(2);
    }

    @Test
    void execute_open_rejectsWithoutRunningCall() {
        failTimes(3);
        clock.advance(Duration.ofSeconds(10));
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> breaker.execute(() -> calls.incrementAndGet()))
            .isInstanceOf(CircuitBreakerOpenException.class)
            .satisfies(e -> {
                CircuitBreakerOpenException open = (CircuitBreakerOpenException) e;
                assertThat(open.getServiceName()).isEqualTo("analysis-service");
                assertThat(open.getRetryAfterSeconds()).isEqualTo(20);
            });
        assertThat(calls).hasValue(0);
    }

    @Test
    void execute_afterResetTimeoutTrialSucceeds_closes() throws InterruptedException {
        failTimes(3);
        clock.advance(Duration.ofSeconds(30));

        String result = breaker.execute(() -> "recovered");

        assertThat(result).isEqualTo("recovered");
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.status().failureCount()).isZero();
    }

    @Test
    void execute_afterResetTimeoutTrialFails_reopens() {
        failTimes(3);
        clock.advance(Duration.ofSeconds(31));

        failTimes(1);

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThatThrownBy(() -> breaker.execute(() -> "x")).isInstanceOf(CircuitBreakerOpenException.class);
    }

    @Test
    void execute_clientErrors_countAsSuccess() {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> breaker.execute(failing(Failure.BAD_REQUEST)))
                .isInstanceOf(AnalysisServiceException.class);
            assertThatThrownBy(() -> breaker.execute(failing(Failure.AUTHENTICATION)))
                .isInstanceOf(AnalysisServiceException.class);
        }

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.status().failureCount()).isZero();
    }

    @Test
    void execute_halfOpenTrialInFlight_rejectsSecondCaller() throws InterruptedException {
        failTimes(3);
        clock.advance(Duration.ofSeconds(30));

        // When: a second call arrives while the trial is still running
        String result = breaker.execute(() -> {
            assertThatThrownBy(() -> breaker.execute(() -> "second"))
                .isInstanceOf(CircuitBreakerOpenException.class);
            return "trial";
        });

        // Then
        assertThat(result).isEqualTo("trial");
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void execute_interrupted_notCountedAsFailure() {
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new InterruptedException();
        })).isInstanceOf(InterruptedException.class);

        assertThat(breaker.status().failureCount()).isZero();
    }

    @Test
    void retryInsideBreaker_exhaustedRetries_countOnce() {
        RetryPolicy retry = new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(1), duration -> { }, () -> 0.0);

        assertThatThrownBy(() -> breaker.execute(() -> retry.execute(failing(Failure.CONNECTION))))
            .isInstanceOf(AnalysisServiceException.class);

        assertThat(breaker.status().failureCount()).isEqualTo(1);
    }
}
