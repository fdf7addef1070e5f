package com.wtwr.wardrobe.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wtwr.common.ApiError;
import com.wtwr.common.ErrorKind;
import com.wtwr.observability.MetricFactory;
import com.wtwr.observability.SensitiveDataRedactor;
import com.wtwr.wardrobe.domain.DuplicateKeyException;
import com.wtwr.wardrobe.domain.MalformedIdentifierException;
import com.wtwr.wardrobe.domain.SchemaViolationException;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Component;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Terminal stage of the request pipeline. Turns an {@link ApiError}, or any fault thrown by a
 * collaborator, into a status code and a {@code {"message"}} body.
 *
 * <p>Collaborator faults are classified by type, walking the cause chain: store schema
 * violations and malformed identifiers become {@code BadRequest}, duplicate keys
 * {@code Conflict}, credential library faults {@code Unauthorized}; anything unrecognised is
 * {@code Internal}, whose body is always the fixed default message.
 *
 * <p>Each request is recorded once: one log record and one increment of
 * {@value #FAILED_REQUESTS}. A request already marked with {@link #DISPATCHED_ATTRIBUTE} still
 * gets its response rendered but is not logged or counted again.
 */
@Component
public class ErrorDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ErrorDispatcher.class);

    public static final String DISPATCHED_ATTRIBUTE = ErrorDispatcher.class.getName() + ".DISPATCHED";

    public static final String FAILED_REQUESTS = "wtwr.requests.failed";

    static final String ROUTE_NOT_FOUND = "Requested resource not found";

    static final String UNREADABLE_BODY = "Request body must be a JSON object";

    private static final int MAX_CAUSE_DEPTH = 10;

    private final ObjectMapper objectMapper;
    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor;

    public ErrorDispatcher(ObjectMapper objectMapper, MetricFactory metrics, SensitiveDataRedactor redactor) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.redactor = redactor;
    }

    /** Classifies a thrown fault. Never returns null. */
    public ApiError resolve(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            ApiError mapped = classify(current);
            if (mapped != null) {
                return mapped.withCause(failure);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return ApiError.internal(failure);
    }

    /** The caller-facing body for an error. Pure; equal errors render equal bodies. */
    public ErrorResponse render(ApiError error) {
        String message = error.kind() == ErrorKind.INTERNAL ? ErrorKind.INTERNAL.defaultMessage() : error.message();
        return new ErrorResponse(message);
    }

    public ResponseEntity<ErrorResponse> dispatch(ApiError error, HttpServletRequest request) {
        record(error, request);
        return ResponseEntity.status(error.status())
                .contentType(MediaType.APPLICATION_JSON)
                .body(render(error));
    }

    public ResponseEntity<ErrorResponse> dispatch(Throwable failure, HttpServletRequest request) {
        return dispatch(resolve(failure), request);
    }

    /**
     * Writes the error straight to the servlet response, for stages that run before Spring MVC
     * (filters). A response that is already committed is left untouched.
     */
    public void write(ApiError error, HttpServletRequest request, HttpServletResponse response) throws IOException {
        if (response.isCommitted()) {
            log.debug("Response already committed, dropping {} for {} {}",
                    error.kind(), request.getMethod(), request.getRequestURI());
            request.setAttribute(DISPATCHED_ATTRIBUTE, Boolean.TRUE);
            return;
        }
        record(error, request);
        response.setStatus(error.status());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getOutputStream().write(objectMapper.writeValueAsBytes(render(error)));
        response.flushBuffer();
    }

    private void record(ApiError error, HttpServletRequest request) {
        if (request.getAttribute(DISPATCHED_ATTRIBUTE) != null) {
            return;
        }
        request.setAttribute(DISPATCHED_ATTRIBUTE, Boolean.TRUE);

        metrics.counter(FAILED_REQUESTS, "Requests answered with an error", "kind", error.kind().name())
                .increment();

        var context = redactor.redact(error.context());
        if (error.kind().isClientError()) {
            log.warn("Request failed kind={} status={} method={} path={} message=\"{}\" context={} fault={}",
                    error.kind(), error.status(), request.getMethod(), request.getRequestURI(),
                    error.message(), context, describe(error.cause()));
        } else {
            log.error("Request failed kind={} status={} method={} path={} message=\"{}\" context={}",
                    error.kind(), error.status(), request.getMethod(), request.getRequestURI(),
                    error.message(), context, error.cause());
        }
    }

    private static ApiError classify(Throwable fault) {
        if (fault instanceof SchemaViolationException schemaViolation) {
            return ApiError.of(ErrorKind.BAD_REQUEST).withContext("field", schemaViolation.field());
        }
        if (fault instanceof MalformedIdentifierException) {
            return ApiError.of(ErrorKind.BAD_REQUEST);
        }
        if (fault instanceof DuplicateKeyException duplicateKey) {
            return ApiError.of(ErrorKind.CONFLICT).withContext("key", duplicateKey.key());
        }
        if (fault instanceof JwtException) {
            return ApiError.of(ErrorKind.UNAUTHORIZED);
        }
        if (fault instanceof HttpMessageNotReadableException) {
            return ApiError.badRequest(UNREADABLE_BODY);
        }
        if (fault instanceof MissingServletRequestParameterException
                || fault instanceof MethodArgumentTypeMismatchException
                || fault instanceof HttpMediaTypeNotSupportedException) {
            return ApiError.of(ErrorKind.BAD_REQUEST);
        }
        if (fault instanceof NoResourceFoundException
                || fault instanceof NoHandlerFoundException
                || fault instanceof HttpRequestMethodNotSupportedException) {
            return ApiError.notFound(ROUTE_NOT_FOUND);
        }
        return null;
    }

    private static String describe(Throwable cause) {
        return cause == null ? "none" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
