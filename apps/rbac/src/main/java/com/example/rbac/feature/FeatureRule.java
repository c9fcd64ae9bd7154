package com.example.rbac.feature;

import com.example.rbac.profile.UserProfile;
import org.springframework.lang.Nullable;

import java.util.function.Predicate;

/**
 * A single feature gate: a key and the predicate that grants it.
 *
 * <p>Predicates are pure and must not read department scope; inheritance is
 * applied by the resolution engine through role substitution.
 */
public record FeatureRule(String key, Predicate<UserProfile> predicate) {

    public FeatureRule {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Feature key must not be blank");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("Feature '" + key + "' has no predicate");
        }
    }

    public boolean test(@Nullable UserProfile profile) {
        return profile != null && predicate.test(profile);
    }
}
