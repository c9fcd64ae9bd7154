package com.example.rbac.common.exception;

import com.example.rbac.engine.AccessDecision;
import lombok.Getter;

/**
 * Raised when a guarded action is invoked without access to its feature.
 */
@Getter
public class FeatureAccessDeniedException extends RuntimeException {

    private final String featureKey;
    private final AccessDecision.Reason reason;

    public FeatureAccessDeniedException(AccessDecision decision) {
        super("Access to feature " + decision.featureKey() + " denied: " + decision.reason());
        this.featureKey = decision.featureKey();
        this.reason = decision.reason();
    }
}
