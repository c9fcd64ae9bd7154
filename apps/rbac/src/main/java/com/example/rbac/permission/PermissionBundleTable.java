package com.example.rbac.permission;

import com.example.rbac.role.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

import static com.example.rbac.permission.PermissionFlag.*;

/**
 * Default permission bundle for every role.
 *
 * <p>A stored profile's flags take precedence over these defaults; the table is
 * used when a profile is provisioned, when a role changes, and when a manager is
 * evaluated as one of its inherited staff roles.
 */
@Slf4j
public class PermissionBundleTable {

    private final Map<Role, PermissionBundle> defaults;

    public PermissionBundleTable(Map<Role, PermissionBundle> defaults) {
        EnumMap<Role, PermissionBundle> copy = new EnumMap<>(Role.class);
        copy.putAll(defaults);

        String missing = Arrays.stream(Role.values())
                .filter(role -> copy.get(role) == null)
                .map(Role::getValue)
                .collect(Collectors.joining(", "));
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No default permissions declared for roles: " + missing);
        }

        this.defaults = Collections.unmodifiableMap(copy);
        log.info("Permission bundle table initialized for {} roles", this.defaults.size());
    }

    /**
     * The shipped defaults.
     */
    public static PermissionBundleTable standard() {
        EnumMap<Role, PermissionBundle> table = new EnumMap<>(Role.class);

        table.put(Role.OWNER, PermissionBundle.all());
        table.put(Role.DIRECTOR, PermissionBundle.all());
        table.put(Role.MANAGER, PermissionBundle.of(
                CAN_SEE_REVENUE, CAN_SEE_PROFIT, CAN_APPROVE_PJO, CAN_CREATE_PJO,
                CAN_CHECK_PJO, CAN_CHECK_JO, CAN_CHECK_BKK, CAN_ESTIMATE_COSTS, CAN_SEE_ACTUAL_COSTS));
        table.put(Role.SYSADMIN, PermissionBundle.of(CAN_MANAGE_USERS));
        table.put(Role.ADMINISTRATION, PermissionBundle.of(
                CAN_SEE_REVENUE, CAN_MANAGE_INVOICES, CAN_CREATE_PJO, CAN_SEE_ACTUAL_COSTS));
        table.put(Role.FINANCE, PermissionBundle.of(
                CAN_SEE_REVENUE, CAN_SEE_PROFIT, CAN_MANAGE_INVOICES, CAN_CHECK_BKK, CAN_SEE_ACTUAL_COSTS));
        table.put(Role.MARKETING, PermissionBundle.of(
                CAN_SEE_REVENUE, CAN_CREATE_PJO, CAN_ESTIMATE_COSTS));
        table.put(Role.OPS, PermissionBundle.of(CAN_FILL_COSTS, CAN_SEE_ACTUAL_COSTS));
        table.put(Role.ENGINEER, PermissionBundle.of(CAN_ESTIMATE_COSTS));
        table.put(Role.HR, PermissionBundle.none());
        table.put(Role.HSE, PermissionBundle.none());

        return new PermissionBundleTable(table);
    }

    /**
     * Default bundle for the role; the all-false bundle for a null role.
     */
    public PermissionBundle getDefaultPermissions(@Nullable Role role) {
        if (role == null) {
            return PermissionBundle.none();
        }
        return defaults.getOrDefault(role, PermissionBundle.none());
    }

    public Map<Role, PermissionBundle> asMap() {
        return defaults;
    }
}
