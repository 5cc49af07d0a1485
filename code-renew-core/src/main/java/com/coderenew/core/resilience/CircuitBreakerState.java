package com.coderenew.core.resilience;

/**
 * State of a {@link CircuitBreaker}.
 */
public enum CircuitBreakerState {
    /** Calls pass through; consecutive failures are counted. */
    CLOSED,
    /** Calls fail immediately until the reset timeout elapses. */
    OPEN,
    /** A single trial call decides between closing and reopening. */
    HALF_OPEN
}
