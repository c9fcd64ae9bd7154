package com.example.rbac.department;

import org.springframework.lang.Nullable;

import java.util.Locale;
import java.util.Optional;

/**
 * Organizational domains a manager can be scoped to.
 */
public enum Department {
    MARKETING("marketing"),
    ENGINEERING("engineering"),
    ADMINISTRATION("administration"),
    FINANCE("finance"),
    OPERATIONS("operations"),
    ASSETS("assets"),
    HR("hr"),
    HSE("hse");

    private final String value;

    Department(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<Department> fromValue(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Department department : values()) {
            if (department.value.equals(normalized)) {
                return Optional.of(department);
            }
        }
        return Optional.empty();
    }
}
