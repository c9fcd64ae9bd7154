package com.example.rbac.audit;

import com.example.rbac.common.util.StringSanitizer;
import com.example.rbac.engine.AccessDecision;
import com.example.rbac.profile.UserProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Publishes feature-access decisions as JSON lines on the {@code ACCESS_AUDIT} logger.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.rbac.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AccessAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("ACCESS_AUDIT");

    private static final int MAX_PATH_LENGTH = 2000;

    private final ObjectMapper objectMapper;

    public void logDecision(
            @Nullable UserProfile profile,
            @NonNull AccessDecision decision,
            @NonNull String operation,
            @Nullable ServerHttpRequest request) {

        logEvent(AccessAuditEvent.from(profile, decision, extractRequestContext(operation, request)));
    }

    public void logError(
            @NonNull String featureKey,
            @NonNull String errorReason,
            @NonNull String operation,
            @Nullable ServerHttpRequest request) {

        logEvent(AccessAuditEvent.error(featureKey, errorReason, extractRequestContext(operation, request)));
    }

    private void logEvent(@NonNull AccessAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            switch (event.outcome()) {
                case ALLOW -> AUDIT_LOG.info(json);
                case DENY -> AUDIT_LOG.warn(json);
                case ERROR -> AUDIT_LOG.error(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logFallback(@NonNull AccessAuditEvent event) {
        AUDIT_LOG.warn("Access {} - profile={}, feature={}, reason={}, operation={}",
                event.outcome(),
                StringSanitizer.forLog(event.profileId()),
                StringSanitizer.forLog(event.featureKey()),
                StringSanitizer.forLog(event.reason()),
                StringSanitizer.forLog(event.operation()));
    }

    @NonNull
    private AccessAuditEvent.RequestContext extractRequestContext(@NonNull String operation,
                                                                  @Nullable ServerHttpRequest request) {
        if (request == null) {
            return AccessAuditEvent.RequestContext.of(operation);
        }
        String path = StringSanitizer.forLog(request.getPath().value(), MAX_PATH_LENGTH);
        String method = request.getMethod() != null ? request.getMethod().name() : "UNKNOWN";
        return new AccessAuditEvent.RequestContext(operation, path, method);
    }
}
