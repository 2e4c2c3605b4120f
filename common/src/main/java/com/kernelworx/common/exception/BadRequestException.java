package com.kernelworx.common.exception;

/**
 * Exception thrown when input fails a business rule
 * HTTP Status: 400 Bad Request
 */
public class BadRequestException extends FundraiserException {

    public BadRequestException(String message) {
        super(ErrorKind.BAD_REQUEST, message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(ErrorKind.BAD_REQUEST, message, cause);
    }
}
