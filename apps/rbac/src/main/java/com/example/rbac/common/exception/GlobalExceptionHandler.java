package com.example.rbac.common.exception;

import com.example.rbac.common.dto.ErrorResponse;
import com.example.rbac.common.util.StringSanitizer;
import com.example.rbac.engine.AccessDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;

import java.util.Map;

/**
 * Maps authorization failures to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;

    /**
     * Missing profile is 401, anything else 403. The response never reveals why the
     * rule failed beyond the feature key.
     */
    @ExceptionHandler(FeatureAccessDeniedException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleFeatureAccessDenied(@NonNull FeatureAccessDeniedException ex,
                                                                   @NonNull ServerWebExchange exchange) {
        LOG.warn("Feature access denied: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));

        String path = exchange.getRequest().getPath().value();
        if (ex.getReason() == AccessDecision.Reason.NO_PROFILE) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(ErrorResponse.of(
                            ErrorResponse.Categories.ACCESS_DENIED,
                            ErrorResponse.Codes.UNAUTHENTICATED,
                            "Sign in to continue",
                            path));
        }
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.ACCESS_DENIED,
                        ErrorResponse.Codes.FEATURE_ACCESS_DENIED,
                        "You do not have access to this feature",
                        path,
                        Map.of("feature", ex.getFeatureKey())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleIllegalArgument(@NonNull IllegalArgumentException ex,
                                                               @NonNull ServerWebExchange exchange) {
        LOG.warn("Rejected request: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.VALIDATION_ERROR,
                        ErrorResponse.Codes.INVALID_REQUEST,
                        "The request could not be processed",
                        exchange.getRequest().getPath().value()));
    }
}
