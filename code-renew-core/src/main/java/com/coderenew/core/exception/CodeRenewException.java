package com.coderenew.core.exception;

/**
 * Base of the unchecked exception hierarchy thrown by the scanning pipeline.
 *
 * <p>Every subtype carries a stable error code string that callers can map to
 * their own error responses without inspecting the exception class.
 *
 * @since 1.0.0
 */
public class CodeRenewException extends RuntimeException {

    private final String errorCode;

    public CodeRenewException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CodeRenewException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the stable error code (e.g. "SCAN_ERROR").
     *
     * @return error code
     */
    public String getErrorCode() {
        return errorCode;
    }
}
