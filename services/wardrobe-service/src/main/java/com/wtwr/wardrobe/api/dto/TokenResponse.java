package com.wtwr.wardrobe.api.dto;

public record TokenResponse(String token) {}
