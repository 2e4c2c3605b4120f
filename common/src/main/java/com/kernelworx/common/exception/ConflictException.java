package com.kernelworx.common.exception;

/**
 * Exception thrown when a conditional write loses against existing state
 * HTTP Status: 409 Conflict
 */
public class ConflictException extends FundraiserException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}
