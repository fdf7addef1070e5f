package com.wtwr.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A failure produced at the point of fault and consumed once by the error dispatcher.
 *
 * @param kind    taxonomy kind, which fixes the HTTP status
 * @param message human-readable message; defaults to the kind's default message
 * @param context structured detail (field name, violated constraint, offending value when safe);
 *                never null, insertion-ordered, unmodifiable
 * @param cause   underlying collaborator fault, if any; logged, never sent to the caller
 */
public record ApiError(ErrorKind kind, String message, Map<String, Object> context, Throwable cause) {

    public ApiError {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (message == null || message.isBlank()) {
            message = kind.defaultMessage();
        }
        context = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static ApiError of(ErrorKind kind) {
        return new ApiError(kind, null, null, null);
    }

    public static ApiError of(ErrorKind kind, String message) {
        return new ApiError(kind, message, null, null);
    }

    public static ApiError badRequest(String message) {
        return of(ErrorKind.BAD_REQUEST, message);
    }

    public static ApiError unauthorized(String message) {
        return of(ErrorKind.UNAUTHORIZED, message);
    }

    public static ApiError forbidden(String message) {
        return of(ErrorKind.FORBIDDEN, message);
    }

    public static ApiError notFound(String message) {
        return of(ErrorKind.NOT_FOUND, message);
    }

    public static ApiError conflict(String message) {
        return of(ErrorKind.CONFLICT, message);
    }

    /** An internal failure wrapping an unexpected fault. The message stays the kind default. */
    public static ApiError internal(Throwable cause) {
        return new ApiError(ErrorKind.INTERNAL, null, null, cause);
    }

    /** HTTP status of this error's kind. */
    public int status() {
        return kind.status();
    }

    /** Returns a copy with one more context entry. */
    public ApiError withContext(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(context);
        merged.put(key, value);
        return new ApiError(kind, message, merged, cause);
    }

    /** Returns a copy carrying the given cause. */
    public ApiError withCause(Throwable cause) {
        return new ApiError(kind, message, context, cause);
    }
}
