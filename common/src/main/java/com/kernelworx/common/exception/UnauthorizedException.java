package com.kernelworx.common.exception;

/**
 * Exception thrown when the caller identity cannot be established
 * HTTP Status: 401 Unauthorized
 */
public class UnauthorizedException extends FundraiserException {

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(ErrorKind.UNAUTHORIZED, message, cause);
    }
}
