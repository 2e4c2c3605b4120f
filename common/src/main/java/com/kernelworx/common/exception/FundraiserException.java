package com.kernelworx.common.exception;

/**
 * Base class of every typed domain error raised by the service.
 * The {@link ErrorKind} decides the HTTP status in the exception handler.
 */
public abstract class FundraiserException extends RuntimeException {

    private final ErrorKind kind;

    protected FundraiserException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected FundraiserException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
