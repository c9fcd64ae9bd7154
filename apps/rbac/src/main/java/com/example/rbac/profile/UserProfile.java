package com.example.rbac.profile;

import com.example.rbac.permission.PermissionBundle;
import com.example.rbac.role.Role;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.With;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * The subject of every authorization check, as loaded by the persistence layer.
 *
 * @param id              profile identifier
 * @param userId          identity-provider user id; {@code null} while the profile is pending
 * @param email           login e-mail
 * @param fullName        display name
 * @param role            assigned role; {@code null} when the stored value is not recognized
 * @param permissions     capability flags, possibly overridden from the role defaults
 * @param departmentScope department names; always empty unless {@code role} is manager
 * @param customDashboard dashboard override, {@code null} or {@code "default"} for none
 * @param active          whether the account is enabled
 */
@Builder(toBuilder = true)
public record UserProfile(
        @JsonProperty("id") String id,
        @JsonProperty("user_id") @Nullable String userId,
        @JsonProperty("email") String email,
        @JsonProperty("full_name") String fullName,
        @With @JsonProperty("role") @Nullable Role role,
        @With @JsonProperty("permissions") PermissionBundle permissions,
        @JsonProperty("department_scope") List<String> departmentScope,
        @JsonProperty("custom_dashboard") @Nullable String customDashboard,
        @JsonProperty("is_active") boolean active
) {
    public UserProfile {
        if (permissions == null) {
            permissions = PermissionBundle.none();
        }
        if (role != Role.MANAGER || departmentScope == null) {
            departmentScope = List.of();
        } else {
            departmentScope = departmentScope.stream()
                    .filter(Objects::nonNull)
                    .toList();
        }
    }

    @JsonIgnore
    public boolean isPending() {
        return userId == null;
    }

    @JsonIgnore
    public boolean isManager() {
        return role == Role.MANAGER;
    }

    @JsonIgnore
    public boolean hasDepartmentScope() {
        return !departmentScope.isEmpty();
    }
}
