package com.example.rbac.audit;

import com.example.rbac.engine.AccessDecision;
import com.example.rbac.profile.UserProfile;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit record of a guarded feature check.
 */
public record AccessAuditEvent(
        String eventId,
        Instant timestamp,

        Outcome outcome,
        String featureKey,
        String reason,
        String matchedRole,

        String profileId,
        String email,
        String role,

        String operation,
        String path,
        String method
) {
    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    public static AccessAuditEvent from(@Nullable UserProfile profile, AccessDecision decision, RequestContext context) {
        return new AccessAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                decision.isAllowed() ? Outcome.ALLOW : Outcome.DENY,
                decision.featureKey(),
                decision.reason().name(),
                decision.matchedRole() != null ? decision.matchedRole().getValue() : null,
                profile != null ? profile.id() : null,
                profile != null ? profile.email() : null,
                profile != null && profile.role() != null ? profile.role().getValue() : null,
                context.operation(),
                context.path(),
                context.method()
        );
    }

    public static AccessAuditEvent error(String featureKey, String errorReason, RequestContext context) {
        return new AccessAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                Outcome.ERROR,
                featureKey,
                errorReason,
                null,
                null,
                null,
                null,
                context.operation(),
                context.path(),
                context.method()
        );
    }

    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "feature_access"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("outcome", outcome.name()),
                Map.entry("feature", featureKey != null ? featureKey : ""),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("matched_role", matchedRole != null ? matchedRole : ""),
                Map.entry("profile_id", profileId != null ? profileId : ""),
                Map.entry("email", email != null ? email : ""),
                Map.entry("role", role != null ? role : ""),
                Map.entry("operation", operation != null ? operation : ""),
                Map.entry("path", path != null ? path : ""),
                Map.entry("method", method != null ? method : "")
        );
    }

    /**
     * Where the check happened.
     */
    public record RequestContext(String operation, String path, String method) {
        public static RequestContext of(String operation) {
            return new RequestContext(operation, null, null);
        }
    }
}
