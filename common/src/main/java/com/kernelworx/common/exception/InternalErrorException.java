package com.kernelworx.common.exception;

/**
 * Exception thrown for unexpected store or arithmetic failures
 * HTTP Status: 500 Internal Server Error
 */
public class InternalErrorException extends FundraiserException {

    public InternalErrorException(String message) {
        super(ErrorKind.INTERNAL_ERROR, message);
    }

    public InternalErrorException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL_ERROR, message, cause);
    }
}
