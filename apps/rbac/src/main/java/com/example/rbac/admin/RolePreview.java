package com.example.rbac.admin;

import com.example.rbac.permission.PermissionBundle;
import com.example.rbac.permission.PermissionBundleTable;
import com.example.rbac.profile.UserProfile;
import com.example.rbac.role.Role;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;

/**
 * Lets the owner view the application as another role.
 *
 * <p>A preview never touches the stored profile. For any other role the preview role is ignored.
 */
@RequiredArgsConstructor
public class RolePreview {

    private final PermissionBundleTable bundleTable;

    public boolean canUsePreviewFeature(@Nullable Role actualRole) {
        return actualRole == Role.OWNER;
    }

    @Nullable
    public Role getEffectiveRole(@Nullable Role actualRole, @Nullable Role previewRole) {
        if (canUsePreviewFeature(actualRole) && previewRole != null) {
            return previewRole;
        }
        return actualRole;
    }

    public PermissionBundle getEffectivePermissions(@Nullable Role actualRole,
                                                    PermissionBundle actualPermissions,
                                                    @Nullable Role previewRole) {
        if (canUsePreviewFeature(actualRole) && previewRole != null) {
            return bundleTable.getDefaultPermissions(previewRole);
        }
        return actualPermissions;
    }

    /**
     * Profile copy carrying the effective role and permissions.
     */
    public UserProfile previewProfile(UserProfile profile, @Nullable Role previewRole) {
        if (!canUsePreviewFeature(profile.role()) || previewRole == null) {
            return profile;
        }
        return profile.withRole(previewRole)
                .withPermissions(bundleTable.getDefaultPermissions(previewRole));
    }
}
