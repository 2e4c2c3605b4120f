package com.kernelworx.common.exception;

/**
 * Exception thrown when a caller lacks the permission an operation requires
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends FundraiserException {

    public AccessDeniedException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }

    public AccessDeniedException(String message, Throwable cause) {
        super(ErrorKind.FORBIDDEN, message, cause);
    }
}
