package com.example.rbac.dashboard;

import com.example.rbac.profile.UserProfile;
import com.example.rbac.role.Role;
import org.springframework.lang.Nullable;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Landing dashboards.
 */
public enum DashboardType {
    EXECUTIVE("executive", "executive"),
    MANAGER("manager", "manager"),
    MARKETING("marketing", "marketing"),
    ADMIN_FINANCE("admin_finance", "admin-finance"),
    OPERATIONS("operations", "operations"),
    ENGINEERING("engineering", "engineering"),
    HR("hr", "hr"),
    HSE("hse", "hse"),
    SYSADMIN("sysadmin", "sysadmin"),
    DEFAULT("default", "");

    // Values stored by earlier releases in custom_dashboard
    private static final Map<String, DashboardType> LEGACY_VALUES = Map.of(
            "owner", EXECUTIVE,
            "admin", EXECUTIVE,
            "ops", OPERATIONS,
            "finance", ADMIN_FINANCE,
            "sales", MARKETING,
            "viewer", DEFAULT);

    private final String value;
    private final String path;

    DashboardType(String value, String path) {
        this.value = value;
        this.path = path;
    }

    public String getValue() {
        return value;
    }

    /**
     * Route of the dashboard, {@code /dashboard} for the default one.
     */
    public String getRoute() {
        return path.isEmpty() ? "/dashboard" : "/dashboard/" + path;
    }

    public static DashboardType forRole(@Nullable Role role) {
        if (role == null) {
            return DEFAULT;
        }
        return switch (role) {
            case OWNER, DIRECTOR -> EXECUTIVE;
            case MANAGER -> MANAGER;
            case SYSADMIN -> SYSADMIN;
            case ADMINISTRATION, FINANCE -> ADMIN_FINANCE;
            case MARKETING -> MARKETING;
            case OPS -> OPERATIONS;
            case ENGINEER -> ENGINEERING;
            case HR -> HR;
            case HSE -> HSE;
        };
    }

    /**
     * Parse a stored dashboard value, accepting legacy aliases.
     */
    public static Optional<DashboardType> fromValue(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DashboardType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.ofNullable(LEGACY_VALUES.get(normalized));
    }

    /**
     * A custom dashboard other than {@code default} wins over the role's dashboard.
     */
    public static DashboardType resolve(@Nullable UserProfile profile) {
        if (profile == null || profile.role() == null) {
            return DEFAULT;
        }
        return fromValue(profile.customDashboard())
                .filter(custom -> custom != DEFAULT)
                .orElseGet(() -> forRole(profile.role()));
    }
}
