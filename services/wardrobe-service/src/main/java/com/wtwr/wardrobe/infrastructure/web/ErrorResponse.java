package com.wtwr.wardrobe.infrastructure.web;

/**
 * Wire body of every failed request: {@code {"message": "..."}}.
 *
 * @param message caller-facing message; never internal detail
 */
public record ErrorResponse(String message) {}
