package com.example.gsiprojection.exception;

import com.example.gsiprojection.api.dto.ApiErrorResponse;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps projection failures to {@link ApiErrorResponse}. Details are keyed by the rejected
 * projection parameter (investment, years, ...) so the caller can point at the offending input.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // @Valid on the request body: one entry per rejected parameter
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidInputs(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        log.warn("Rejected projection inputs: {}", details.keySet());
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Invalid projection inputs", details, request);
    }

    // In-process validation inside ProjectionService
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getConstraintViolations()
                .forEach(violation -> details.put(violation.getPropertyPath().toString(), violation.getMessage()));
        log.warn("Rejected projection inputs: {}", details.keySet());
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Invalid projection inputs", details, request);
    }

    // Missing, null or mistyped parameters fail in Jackson before validation runs
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        if (ex.getCause() instanceof MismatchedInputException mismatch) {
            String field = mismatch.getPath().stream()
                    .map(JsonMappingException.Reference::getFieldName)
                    .filter(name -> name != null)
                    .collect(Collectors.joining("."));
            // a missing creator property is reported before any path is recorded
            String key = field.isEmpty() ? "request" : field;
            Map<String, Object> details = Map.of(key, describe(mismatch) + ": " + mismatch.getOriginalMessage());
            log.warn("Unreadable projection parameter: {}", key);
            return buildResponse(ErrorCode.VALIDATION_ERROR, "Invalid projection inputs", details, request);
        }
        return buildResponse(ErrorCode.BAD_REQUEST, "Malformed request body", null, request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBase(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("Projection failed: {}", ex.getMessage(), ex);
        } else {
            log.warn("Projection rejected: {}", ex.getMessage());
        }
        return buildResponse(errorCode, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        // Spring MVC's own failures (unknown path, wrong method, wrong content type) carry their status
        if (ex instanceof ErrorResponse errorResponse) {
            int status = errorResponse.getStatusCode().value();
            ErrorCode errorCode = ErrorCode.forStatus(status);
            if (status >= 500) {
                log.error("Request failed: {}", ex.getMessage(), ex);
            } else {
                log.warn("Request rejected ({}): {}", status, ex.getMessage());
            }
            return ResponseEntity.status(status)
                    .body(ApiErrorResponse.of(errorCode, ex.getMessage(), null, request.getRequestURI()));
        }
        log.error("Unexpected error", ex);
        return buildResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private static String describe(MismatchedInputException mismatch) {
        Class<?> target = mismatch.getTargetType();
        if (target == int.class || target == Integer.class) return "expected a whole number";
        if (target == double.class || target == Double.class) return "expected a number";
        return "expected a value";
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        ApiErrorResponse response = ApiErrorResponse.of(errorCode, message, details, request.getRequestURI());
        return ResponseEntity.status(errorCode.getHttpStatus()).body(response);
    }
}
