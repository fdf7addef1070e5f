package com.wtwr.wardrobe.infrastructure.web;

import com.wtwr.common.ApiError;
import com.wtwr.common.Result;
import com.wtwr.security.CallerIdentity;
import com.wtwr.validation.RequestValidator;
import com.wtwr.validation.ValidatedInput;
import com.wtwr.validation.ValidationSchema;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Runs the per-route stages after authentication: caller lookup, validation against the route's
 * schema, publication of the validated input, then the handler. The first stage that fails
 * short-circuits the rest and its error goes to the {@link ErrorDispatcher}.
 */
@Component
public class RequestPipeline {

    private final RequestValidator validator;
    private final ErrorDispatcher dispatcher;

    public RequestPipeline(RequestValidator validator, ErrorDispatcher dispatcher) {
        this.validator = validator;
        this.dispatcher = dispatcher;
    }

    /** Public route with input. */
    public ResponseEntity<?> run(
            ValidationSchema schema,
            Map<String, ?> body,
            Map<String, String> pathVariables,
            HttpServletRequest request,
            Function<ValidatedInput, Result<Reply>> handler) {
        return finish(validate(schema, body, pathVariables, request).flatMap(handler), request);
    }

    /** Protected route with input. */
    public ResponseEntity<?> runAuthenticated(
            ValidationSchema schema,
            Map<String, ?> body,
            Map<String, String> pathVariables,
            HttpServletRequest request,
            BiFunction<CallerIdentity, ValidatedInput, Result<Reply>> handler) {
        Result<Reply> outcome = caller(request).flatMap(identity ->
                validate(schema, body, pathVariables, request).flatMap(input -> handler.apply(identity, input)));
        return finish(outcome, request);
    }

    /** Protected route without input. */
    public ResponseEntity<?> runAuthenticated(
            HttpServletRequest request, Function<CallerIdentity, Result<Reply>> handler) {
        return finish(caller(request).flatMap(handler), request);
    }

    /** Public route without input. */
    public ResponseEntity<?> run(HttpServletRequest request, Supplier<Result<Reply>> handler) {
        return finish(handler.get(), request);
    }

    /**
     * The identity the authentication filter attached, or {@code Unauthorized} if the request
     * never passed through it.
     */
    public static Result<CallerIdentity> caller(HttpServletRequest request) {
        if (request.getAttribute(CallerIdentity.REQUEST_ATTRIBUTE) instanceof CallerIdentity identity) {
            return Result.ok(identity);
        }
        return Result.err(ApiError.unauthorized(AuthenticationFilter.MISSING_CREDENTIAL));
    }

    private Result<ValidatedInput> validate(
            ValidationSchema schema, Map<String, ?> body, Map<String, String> pathVariables, HttpServletRequest request) {
        return validator.validate(schema, body, pathVariables)
                .peek(input -> request.setAttribute(ValidatedInput.REQUEST_ATTRIBUTE, input));
    }

    private ResponseEntity<?> finish(Result<Reply> outcome, HttpServletRequest request) {
        return outcome.<ResponseEntity<?>>fold(Reply::toResponse, error -> dispatcher.dispatch(error, request));
    }
}
