package com.wtwr.wardrobe.infrastructure.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Successful outcome of a route handler: status plus body.
 */
public record Reply(HttpStatus status, Object body) {

    public static Reply ok(Object body) {
        return new Reply(HttpStatus.OK, body);
    }

    public static Reply created(Object body) {
        return new Reply(HttpStatus.CREATED, body);
    }

    public ResponseEntity<Object> toResponse() {
        return ResponseEntity.status(status).body(body);
    }
}
