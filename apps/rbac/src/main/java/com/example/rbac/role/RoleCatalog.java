package com.example.rbac.role;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Role catalog and the owner identity rule.
 */
@Slf4j
public class RoleCatalog {

    /**
     * Roles allowed to administer other users and receive role-request notifications.
     */
    public static final Set<Role> ADMIN_ROLES = Set.of(Role.OWNER, Role.DIRECTOR, Role.SYSADMIN);

    @Nullable
    private final String ownerEmail;
    private final List<Role> assignableRoles;

    public RoleCatalog(@Nullable String ownerEmail) {
        this.ownerEmail = ownerEmail == null || ownerEmail.isBlank()
                ? null
                : ownerEmail.trim().toLowerCase(Locale.ROOT);
        this.assignableRoles = Arrays.stream(Role.values())
                .filter(role -> role != Role.OWNER)
                .toList();

        if (this.ownerEmail == null) {
            log.warn("No owner e-mail configured; no identity will be recognized as owner");
        }
    }

    public List<Role> allRoles() {
        return List.of(Role.values());
    }

    /**
     * Every role except {@link Role#OWNER}, in declaration order.
     */
    public List<Role> assignableRoles() {
        return assignableRoles;
    }

    public boolean isAssignable(@Nullable Role role) {
        return role != null && role != Role.OWNER;
    }

    public boolean isAdminRole(@Nullable Role role) {
        return role != null && ADMIN_ROLES.contains(role);
    }

    /**
     * Case-insensitive exact match against the configured owner address.
     */
    public boolean isOwnerEmail(@Nullable String email) {
        if (ownerEmail == null || email == null) {
            return false;
        }
        return ownerEmail.equals(email.toLowerCase(Locale.ROOT));
    }
}
