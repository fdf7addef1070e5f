package com.wtwr.wardrobe.api.dto;

/** {@code {"data": ...}} envelope used by item mutations. */
public record DataResponse<T>(T data) {}
