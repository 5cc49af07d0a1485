package com.coderenew.core.exception;

/**
 * Failure outside the batch loop that prevents a scan from completing,
 * such as an unreadable input archive.
 *
 * @since 1.0.0
 */
public class ScanException extends CodeRenewException {

    public static final String ERROR_CODE = "SCAN_ERROR";

    public ScanException(String message) {
        super(ERROR_CODE, message);
    }

    public ScanException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
