package com.coderenew.core.exception;

/**
 * Raised instead of calling a dependency whose circuit breaker is open.
 *
 * @since 1.0.0
 */
public class CircuitBreakerOpenException extends CodeRenewException {

    public static final String ERROR_CODE = "CIRCUIT_BREAKER_OPEN";

    private final String serviceName;
    private final long retryAfterSeconds;

    public CircuitBreakerOpenException(String serviceName, long retryAfterSeconds) {
        super(ERROR_CODE, serviceName + " is temporarily unavailable, retry after "
            + retryAfterSeconds + " seconds");
        this.serviceName = serviceName;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String getServiceName() {
        return serviceName;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
