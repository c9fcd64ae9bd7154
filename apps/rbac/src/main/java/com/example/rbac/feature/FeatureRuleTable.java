package com.example.rbac.feature;

import com.example.rbac.profile.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable mapping of feature keys to their predicates.
 */
@Slf4j
public class FeatureRuleTable {

    private final Map<String, FeatureRule> rules;

    private FeatureRuleTable(Map<String, FeatureRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        log.info("Feature rule table initialized with {} features", this.rules.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<FeatureRule> find(@Nullable String featureKey) {
        if (featureKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(featureKey));
    }

    public boolean contains(@Nullable String featureKey) {
        return featureKey != null && rules.containsKey(featureKey);
    }

    /**
     * Declared keys in declaration order.
     */
    public Set<String> keys() {
        return rules.keySet();
    }

    public int size() {
        return rules.size();
    }

    public static final class Builder {

        private final Map<String, FeatureRule> rules = new LinkedHashMap<>();

        private Builder() {}

        public Builder rule(String key, Predicate<UserProfile> predicate) {
            FeatureRule rule = new FeatureRule(key, predicate);
            if (rules.putIfAbsent(key, rule) != null) {
                throw new IllegalStateException("Duplicate feature key: " + key);
            }
            return this;
        }

        public FeatureRuleTable build() {
            return new FeatureRuleTable(rules);
        }
    }
}
