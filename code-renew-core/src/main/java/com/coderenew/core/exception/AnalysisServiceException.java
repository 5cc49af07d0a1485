package com.coderenew.core.exception;

/**
 * Failure of a call to the external code-analysis service.
 *
 * <p>The {@link Failure} kind decides whether the call may be retried:
 * rate limiting, connection problems, timeouts and upstream 5xx responses are
 * transient; authentication, bad requests and malformed responses are not.
 *
 * @since 1.0.0
 */
public class AnalysisServiceException extends CodeRenewException {

    public static final String ERROR_CODE = "EXTERNAL_SERVICE_ERROR";

    /**
     * Classification of a service failure.
     */
    public enum Failure {
        RATE_LIMITED(true),
        CONNECTION(true),
        TIMEOUT(true),
        SERVER_ERROR(true),
        AUTHENTICATION(false),
        BAD_REQUEST(false),
        MALFORMED_RESPONSE(false);

        private final boolean retryable;

        Failure(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final int status;
    private final Failure failure;

    public AnalysisServiceException(Failure failure, int status, String message) {
        super(ERROR_CODE, message);
        this.failure = failure;
        this.status = status;
    }

    public AnalysisServiceException(Failure failure, int status, String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.failure = failure;
        this.status = status;
    }

    /**
     * Maps an HTTP status code to a failure kind.
     *
     * @param status HTTP status code
     * @return failure classification
     */
    public static Failure classify(int status) {
        if (status == 429) {
            return Failure.RATE_LIMITED;
        }
        if (status == 401 || status == 403) {
            return Failure.AUTHENTICATION;
        }
        if (status == 408) {
            return Failure.TIMEOUT;
        }
        if (status >= 500) {
            return Failure.SERVER_ERROR;
        }
        return Failure.BAD_REQUEST;
    }

    /**
     * Returns the HTTP status, or -1 when no response was received.
     *
     * @return HTTP status code or -1
     */
    public int getStatus() {
        return status;
    }

    public Failure getFailure() {
        return failure;
    }

    public boolean isRetryable() {
        return failure.isRetryable();
    }

    /**
     * Returns true for client-side validation and authentication errors.
     *
     * <p>These describe a problem with the request, not with the service, so
     * they do not count toward opening the circuit breaker.
     *
     * @return true if the failure is a client error
     */
    public boolean isClientError() {
        return failure == Failure.AUTHENTICATION || failure == Failure.BAD_REQUEST;
    }

    /**
     * Returns true if the failure says the service itself is unhealthy.
     *
     * <p>Client errors and malformed responses come from a service that answered,
     * so they are not held against it.
     *
     * @return true if the failure should count toward opening a circuit breaker
     */
    public boolean indicatesServiceFailure() {
        return !isClientError() && failure != Failure.MALFORMED_RESPONSE;
    }
}
