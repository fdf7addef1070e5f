package com.wtwr.common;

/**
 * Closed set of failure kinds. Each kind is bound to exactly one HTTP status and a default
 * message; no other status codes are produced by the request pipeline.
 */
public enum ErrorKind {

    BAD_REQUEST(400, "Bad Request"),
    UNAUTHORIZED(401, "Unauthorized"),
    FORBIDDEN(403, "Forbidden"),
    NOT_FOUND(404, "Not Found"),
    CONFLICT(409, "Conflict"),
    INTERNAL(500, "Internal Server Error");

    private final int status;
    private final String defaultMessage;

    ErrorKind(int status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    /** HTTP status code for this kind. */
    public int status() {
        return status;
    }

    /** Message used when no custom message is supplied, and always for {@link #INTERNAL}. */
    public String defaultMessage() {
        return defaultMessage;
    }

    /** True for kinds caused by the caller (4xx). */
    public boolean isClientError() {
        return status < 500;
    }
}
