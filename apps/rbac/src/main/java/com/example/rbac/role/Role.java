package com.example.rbac.role;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Locale;

/**
 * Closed set of roles a user profile can hold.
 *
 * <p>The wire value is the lower-case name stored in {@code user_profiles.role}.
 * {@link #OWNER} is never assigned through administration; it is derived from the
 * configured owner e-mail only.
 */
public enum Role {
    OWNER("owner", "Owner"),
    DIRECTOR("director", "Director"),
    MANAGER("manager", "Manager"),
    SYSADMIN("sysadmin", "System Administrator"),
    ADMINISTRATION("administration", "Administration"),
    FINANCE("finance", "Finance"),
    MARKETING("marketing", "Marketing"),
    OPS("ops", "Operations"),
    ENGINEER("engineer", "Engineer"),
    HR("hr", "Human Resources"),
    HSE("hse", "HSE");

    private final String value;
    private final String displayName;

    Role(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a stored role value. Unknown or blank values yield {@code null}
     * so that callers fall through to the most restrictive treatment.
     */
    @JsonCreator
    @Nullable
    public static Role fromValue(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        return null;
    }
}
