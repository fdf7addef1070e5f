package com.wtwr.wardrobe.infrastructure.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Catches every exception escaping a controller, including Spring MVC's own binding, parsing
 * and routing faults, and hands it to the {@link ErrorDispatcher}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final ErrorDispatcher dispatcher;

    public GlobalExceptionHandler(ErrorDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handle(Exception ex, HttpServletRequest request) {
        return dispatcher.dispatch(ex, request);
    }
}
