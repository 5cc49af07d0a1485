package com.coderenew.core.resilience;

import java.time.Instant;

/**
 * Point-in-time snapshot of a circuit breaker.
 *
 * @param name breaker name
 * @param state current state
 * @param failureCount consecutive counted failures
 * @param openedAt when the breaker last opened, or null if it never has
 */
public record CircuitBreakerStatus(String name, CircuitBreakerState state, int failureCount, Instant openedAt) {
}
