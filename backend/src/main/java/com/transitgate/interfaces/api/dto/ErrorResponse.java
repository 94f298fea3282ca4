package com.transitgate.interfaces.api.dto;

public record ErrorResponse(
        String code,
        String message
) {}
