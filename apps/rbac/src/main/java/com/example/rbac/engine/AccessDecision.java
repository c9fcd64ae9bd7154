package com.example.rbac.engine;

import com.example.rbac.role.Role;
import org.springframework.lang.Nullable;

/**
 * Outcome of a feature check.
 *
 * @param featureKey  the evaluated feature
 * @param reason      why the check passed or failed
 * @param matchedRole inherited role that granted access; {@code null} unless {@link Reason#GRANTED_INHERITED}
 */
public record AccessDecision(
        String featureKey,
        Reason reason,
        @Nullable Role matchedRole
) {
    public enum Reason {
        GRANTED_DIRECT,
        GRANTED_INHERITED,
        DENIED,
        NO_PROFILE,
        UNKNOWN_FEATURE
    }

    public static AccessDecision grantedDirect(String featureKey) {
        return new AccessDecision(featureKey, Reason.GRANTED_DIRECT, null);
    }

    public static AccessDecision grantedInherited(String featureKey, Role matchedRole) {
        return new AccessDecision(featureKey, Reason.GRANTED_INHERITED, matchedRole);
    }

    public static AccessDecision denied(String featureKey) {
        return new AccessDecision(featureKey, Reason.DENIED, null);
    }

    public static AccessDecision noProfile(String featureKey) {
        return new AccessDecision(featureKey, Reason.NO_PROFILE, null);
    }

    public static AccessDecision unknownFeature(String featureKey) {
        return new AccessDecision(featureKey, Reason.UNKNOWN_FEATURE, null);
    }

    public boolean isAllowed() {
        return reason == Reason.GRANTED_DIRECT || reason == Reason.GRANTED_INHERITED;
    }

    public boolean isDenied() {
        return !isAllowed();
    }
}
