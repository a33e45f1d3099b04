package com.example.gsiprojection.exception;

import java.util.Map;

/**
 * Raised before any computation when an input cannot produce a finite projection:
 * non-positive investment, master cost basis, years, spot or strike.
 */
public class ProjectionValidationException extends BaseException {

    public ProjectionValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ProjectionValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of(field, String.valueOf(rejectedValue)));
    }
}
