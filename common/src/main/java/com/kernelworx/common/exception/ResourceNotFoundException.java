package com.kernelworx.common.exception;

/**
 * Exception thrown when a requested resource does not exist
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends FundraiserException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
