package com.example.rbac.engine;

import com.example.rbac.common.util.StringSanitizer;
import com.example.rbac.dashboard.DashboardType;
import com.example.rbac.department.DepartmentInheritanceMap;
import com.example.rbac.feature.FeatureRule;
import com.example.rbac.feature.FeatureRuleTable;
import com.example.rbac.permission.PermissionBundle;
import com.example.rbac.permission.PermissionBundleTable;
import com.example.rbac.permission.PermissionFlag;
import com.example.rbac.profile.UserProfile;
import com.example.rbac.role.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves feature access for a user profile.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>unknown feature key or null profile: denied</li>
 *   <li>the rule evaluated against the profile as stored</li>
 *   <li>for a manager with department scope, the rule evaluated against a virtual profile
 *       per inherited staff role; first match wins</li>
 * </ol>
 *
 * <p>All collaborators are immutable, so a single instance is safe to share.
 */
@Slf4j
public class FeatureAccessEngine {

    private final PermissionBundleTable bundleTable;
    private final DepartmentInheritanceMap inheritanceMap;
    private final FeatureRuleTable ruleTable;
    private final VirtualPermissions virtualPermissions;

    public FeatureAccessEngine(PermissionBundleTable bundleTable,
                               DepartmentInheritanceMap inheritanceMap,
                               FeatureRuleTable ruleTable,
                               VirtualPermissions virtualPermissions) {
        this.bundleTable = bundleTable;
        this.inheritanceMap = inheritanceMap;
        this.ruleTable = ruleTable;
        this.virtualPermissions = virtualPermissions;

        log.info("Feature access engine initialized: {} features, virtual permissions {}",
                ruleTable.size(), virtualPermissions);
    }

    /**
     * Evaluate a feature and report how the verdict was reached.
     *
     * @param profile    the subject, may be null
     * @param featureKey the feature key
     * @return the decision; never null
     */
    public AccessDecision evaluate(@Nullable UserProfile profile, String featureKey) {
        Optional<FeatureRule> rule = ruleTable.find(featureKey);
        if (rule.isEmpty()) {
            log.debug("Unknown feature key: {}", StringSanitizer.forLog(featureKey));
            return AccessDecision.unknownFeature(featureKey);
        }
        if (profile == null) {
            return AccessDecision.noProfile(featureKey);
        }

        if (rule.get().test(profile)) {
            return AccessDecision.grantedDirect(featureKey);
        }

        if (!profile.isManager() || !profile.hasDepartmentScope()) {
            return AccessDecision.denied(featureKey);
        }

        for (Role inherited : inheritanceMap.getInheritedRoles(profile)) {
            if (rule.get().test(virtualProfile(profile, inherited))) {
                log.debug("Feature {} granted to profile {} through inherited role {}",
                        featureKey, profile.id(), inherited.getValue());
                return AccessDecision.grantedInherited(featureKey, inherited);
            }
        }
        return AccessDecision.denied(featureKey);
    }

    public boolean canAccessFeature(@Nullable UserProfile profile, String featureKey) {
        return evaluate(profile, featureKey).isAllowed();
    }

    public PermissionBundle getDefaultPermissions(@Nullable Role role) {
        return bundleTable.getDefaultPermissions(role);
    }

    public Set<Role> getInheritedRoles(@Nullable UserProfile profile) {
        return inheritanceMap.getInheritedRoles(profile);
    }

    /**
     * Direct flag test on the stored bundle. Department inheritance does not apply.
     */
    public boolean hasPermission(@Nullable UserProfile profile, String flagName) {
        if (profile == null) {
            return false;
        }
        return PermissionFlag.fromName(flagName)
                .map(flag -> flag.isGrantedIn(profile.permissions()))
                .orElse(false);
    }

    public boolean isRole(@Nullable UserProfile profile, Role... roles) {
        if (profile == null || profile.role() == null) {
            return false;
        }
        return Arrays.asList(roles).contains(profile.role());
    }

    /**
     * Wire value of the dashboard the profile lands on.
     */
    public String getDashboardType(@Nullable UserProfile profile) {
        return DashboardType.resolve(profile).getValue();
    }

    public VirtualPermissions getVirtualPermissions() {
        return virtualPermissions;
    }

    private UserProfile virtualProfile(UserProfile actor, Role inherited) {
        UserProfile virtual = actor.withRole(inherited);
        if (virtualPermissions == VirtualPermissions.ROLE_DEFAULTS) {
            virtual = virtual.withPermissions(bundleTable.getDefaultPermissions(inherited));
        }
        return virtual;
    }
}
