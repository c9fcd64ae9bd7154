package com.example.rbac.admin;

import com.example.rbac.permission.PermissionBundle;
import com.example.rbac.permission.PermissionBundleTable;
import com.example.rbac.profile.UserProfile;
import com.example.rbac.role.Role;
import com.example.rbac.role.RoleCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.example.rbac.util.UserProfileTestBuilder.aProfile;
import static com.example.rbac.util.UserProfileTestBuilder.aScopedManager;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UserAdministrationRules")
class UserAdministrationRulesTest {

    private UserAdministrationRules rules;

    @BeforeEach
    void setUp() {
        rules = new UserAdministrationRules(new RoleCatalog("Owner@Example.com"), PermissionBundleTable.standard());
    }

    @Nested
    @DisplayName("canModifyUser")
    class CanModifyUser {

        @ParameterizedTest
        @EnumSource(Role.class)
        @DisplayName("nobody can modify the owner")
        void ownerIsImmutable(Role actor) {
            assertThat(rules.canModifyUser(actor, Role.OWNER)).isFalse();
        }

        @ParameterizedTest
        @EnumSource(value = Role.class, names = {"OWNER", "DIRECTOR", "SYSADMIN"})
        @DisplayName("owner, director and sysadmin can modify non-owner users")
        void adminsCanModify(Role actor) {
            for (Role target : Role.values()) {
                if (target != Role.OWNER) {
                    assertThat(rules.canModifyUser(actor, target)).as(target.getValue()).isTrue();
                }
            }
        }

        @ParameterizedTest
        @EnumSource(value = Role.class, names = {"OWNER", "DIRECTOR", "SYSADMIN"}, mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("other roles cannot modify anyone")
        void othersCannotModify(Role actor) {
            assertThat(rules.canModifyUser(actor, Role.OPS)).isFalse();
            assertThat(rules.canModifyUser(actor, Role.HR)).isFalse();
        }

        @Test
        @DisplayName("should deny null roles")
        void nullRoles() {
            assertThat(rules.canModifyUser(null, Role.OPS)).isFalse();
            assertThat(rules.canModifyUser(Role.OWNER, null)).isFalse();
        }
    }

    @Test
    @DisplayName("getAssignableRoles excludes owner")
    void assignableRoles() {
        assertThat(rules.getAssignableRoles())
                .doesNotContain(Role.OWNER)
                .hasSize(Role.values().length - 1)
                .startsWith(Role.DIRECTOR, Role.MANAGER);
    }

    @Nested
    @DisplayName("canRemoveAdminPermission")
    class CanRemoveAdminPermission {

        @Test
        @DisplayName("should block the last admin removing their own permission")
        void lastAdminSelfRemoval() {
            AdminPermissionCheck check = rules.canRemoveAdminPermission(1, "user-1", "user-1");

            assertThat(check.allowed()).isFalse();
            assertThat(check.reason())
                    .isEqualTo("Cannot remove your own admin permission when you are the last admin");
        }

        @Test
        @DisplayName("should treat a zero count like a single admin")
        void zeroCount() {
            assertThat(rules.canRemoveAdminPermission(0, "user-1", "user-1").allowed()).isFalse();
        }

        @Test
        @DisplayName("should block the last admin when neither user id is known")
        void missingIds() {
            AdminPermissionCheck check = rules.canRemoveAdminPermission(1, null, null);

            assertThat(check.allowed()).isFalse();
            assertThat(check.reason()).isEqualTo(UserAdministrationRules.LAST_ADMIN_REASON);
        }

        @Test
        @DisplayName("should allow removal when another admin remains")
        void otherAdminsRemain() {
            assertThat(rules.canRemoveAdminPermission(2, "user-1", "user-1")).isEqualTo(AdminPermissionCheck.allow());
        }

        @Test
        @DisplayName("should allow removing someone else's permission")
        void removingOtherUser() {
            AdminPermissionCheck check = rules.canRemoveAdminPermission(1, "user-2", "user-1");

            assertThat(check.allowed()).isTrue();
            assertThat(check.reason()).isNull();
        }
    }

    @Nested
    @DisplayName("identity")
    class Identity {

        @Test
        @DisplayName("should detect the owner e-mail case-insensitively")
        void ownerEmail() {
            assertThat(rules.isOwnerEmail("owner@example.com")).isTrue();
            assertThat(rules.isOwnerEmail("OWNER@EXAMPLE.COM")).isTrue();
            assertThat(rules.isOwnerEmail("owner@example.co")).isFalse();
            assertThat(rules.isOwnerEmail("someone@example.com")).isFalse();
            assertThat(rules.isOwnerEmail(null)).isFalse();
        }

        @Test
        @DisplayName("should treat a profile without user id as pending")
        void pendingUser() {
            assertThat(rules.isPendingUser(aProfile().pending().build())).isTrue();
            assertThat(rules.isPendingUser(aProfile().withUserId("auth-42").build())).isFalse();
            assertThat(rules.isPendingUser(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("changeRole")
    class ChangeRole {

        @Test
        @DisplayName("should reset permissions to the new role's defaults and clear scope")
        void resetsPermissionsAndScope() {
            UserProfile manager = aScopedManager("finance");

            UserProfile changed = rules.changeRole(Role.DIRECTOR, manager, Role.HSE);

            assertThat(changed.role()).isEqualTo(Role.HSE);
            assertThat(changed.permissions()).isEqualTo(PermissionBundle.none());
            assertThat(changed.departmentScope()).isEmpty();
            assertThat(changed.id()).isEqualTo(manager.id());
        }

        @Test
        @DisplayName("should refuse to assign the owner role")
        void ownerNotAssignable() {
            assertThatThrownBy(() -> rules.changeRole(Role.OWNER, aProfile().build(), Role.OWNER))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should refuse actors that may not modify the target")
        void unauthorizedActor() {
            assertThatThrownBy(() -> rules.changeRole(Role.MANAGER, aProfile().build(), Role.HR))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> rules.changeRole(Role.DIRECTOR, aProfile().withRole(Role.OWNER).build(), Role.HR))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
