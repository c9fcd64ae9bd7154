package com.example.rbac.admin;

import com.example.rbac.permission.PermissionBundleTable;
import com.example.rbac.profile.UserProfile;
import com.example.rbac.role.Role;
import com.example.rbac.role.RoleCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Rules governing who may change whose role and permissions.
 */
@Slf4j
@RequiredArgsConstructor
public class UserAdministrationRules {

    static final String LAST_ADMIN_REASON =
            "Cannot remove your own admin permission when you are the last admin";

    private final RoleCatalog roleCatalog;
    private final PermissionBundleTable bundleTable;

    /**
     * The owner is never modifiable. Otherwise only owner, director and sysadmin
     * may modify other users.
     */
    public boolean canModifyUser(@Nullable Role actorRole, @Nullable Role targetRole) {
        if (actorRole == null || targetRole == null) {
            return false;
        }
        if (targetRole == Role.OWNER) {
            return false;
        }
        return roleCatalog.isAdminRole(actorRole);
    }

    public List<Role> getAssignableRoles() {
        return roleCatalog.assignableRoles();
    }

    /**
     * Blocks the last remaining admin from revoking their own admin permission.
     * Missing ids on both sides count as the same user.
     */
    public AdminPermissionCheck canRemoveAdminPermission(int currentAdminCount,
                                                        @Nullable String targetUserId,
                                                        @Nullable String actingUserId) {
        if (currentAdminCount <= 1 && Objects.equals(targetUserId, actingUserId)) {
            log.warn("Refused self-removal of admin permission by last admin {}", actingUserId);
            return AdminPermissionCheck.deny(LAST_ADMIN_REASON);
        }
        return AdminPermissionCheck.allow();
    }

    /**
     * A profile created by an administrator that has not signed in yet.
     */
    public boolean isPendingUser(@Nullable UserProfile profile) {
        return profile != null && profile.isPending();
    }

    public boolean isOwnerEmail(@Nullable String email) {
        return roleCatalog.isOwnerEmail(email);
    }

    /**
     * Apply a role change: permissions reset to the new role's defaults and department
     * scope is cleared unless the new role is manager.
     *
     * @throws IllegalArgumentException when the actor may not modify the target or the role is not assignable
     */
    public UserProfile changeRole(Role actorRole, UserProfile target, Role newRole) {
        if (!canModifyUser(actorRole, target.role())) {
            throw new IllegalArgumentException("Role " + actorRole + " may not modify user " + target.id());
        }
        if (!roleCatalog.isAssignable(newRole)) {
            throw new IllegalArgumentException("Role is not assignable: " + newRole);
        }
        log.info("Role of user {} changed from {} to {}", target.id(), target.role(), newRole);
        return target.toBuilder()
                .role(newRole)
                .permissions(bundleTable.getDefaultPermissions(newRole))
                .departmentScope(newRole == Role.MANAGER ? target.departmentScope() : List.of())
                .build();
    }
}
