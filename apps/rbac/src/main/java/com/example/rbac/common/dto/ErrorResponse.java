package com.example.rbac.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by all endpoints.
 *
 * <pre>{@code
 * {
 *   "error": "access_denied",
 *   "code": "FEATURE_ACCESS_DENIED",
 *   "message": "You do not have access to this feature",
 *   "timestamp": "2024-12-19T10:30:00.000Z",
 *   "path": "/api/pjo/42/approve",
 *   "details": { "feature": "pjo.approve" }
 * }
 * }</pre>
 *
 * @param error     stable error category
 * @param code      specific error code
 * @param message   human-readable message
 * @param timestamp when the error occurred
 * @param path      request path, if known
 * @param details   additional context
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String code,
        String message,
        Instant timestamp,
        String path,
        Map<String, Object> details
) {
    public static ErrorResponse of(String error, String code, String message, String path) {
        return new ErrorResponse(error, code, message, Instant.now(), path, null);
    }

    public static ErrorResponse of(String error, String code, String message, String path,
                                   Map<String, Object> details) {
        return new ErrorResponse(error, code, message, Instant.now(), path, details);
    }

    public static final class Categories {
        public static final String ACCESS_DENIED = "access_denied";
        public static final String VALIDATION_ERROR = "validation_error";
        public static final String INTERNAL_ERROR = "internal_error";

        private Categories() {
        }
    }

    public static final class Codes {
        public static final String FEATURE_ACCESS_DENIED = "FEATURE_ACCESS_DENIED";
        public static final String UNAUTHENTICATED = "UNAUTHENTICATED";
        public static final String INVALID_REQUEST = "INVALID_REQUEST";

        private Codes() {
        }
    }
}
