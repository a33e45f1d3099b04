package com.example.gsiprojection.api.dto;

import com.example.gsiprojection.exception.ErrorCode;

import java.time.Instant;
import java.util.Map;

// Uniform error envelope returned by the exception handler
public record ApiErrorResponse(boolean success, ErrorDetail error) {

    public record ErrorDetail(
            String code,
            String message,
            Map<String, Object> details,
            Instant timestamp,
            String path
    ) {}

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(false, new ErrorDetail(errorCode.getCode(), message, details, Instant.now(), path));
    }
}
