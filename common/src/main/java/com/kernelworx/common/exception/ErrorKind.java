package com.kernelworx.common.exception;

/**
 * Kinds of domain failures and the HTTP status each one maps to.
 */
public enum ErrorKind {
    UNAUTHORIZED(401, "UNAUTHORIZED"),
    FORBIDDEN(403, "ACCESS_DENIED"),
    BAD_REQUEST(400, "BAD_REQUEST"),
    NOT_FOUND(404, "RESOURCE_NOT_FOUND"),
    CONFLICT(409, "CONFLICT"),
    INTERNAL_ERROR(500, "INTERNAL_ERROR");

    private final int httpStatus;
    private final String errorCode;

    ErrorKind(int httpStatus, String errorCode) {
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
