package com.example.rbac.department;

import com.example.rbac.profile.UserProfile;
import com.example.rbac.role.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.example.rbac.util.UserProfileTestBuilder.aProfile;
import static com.example.rbac.util.UserProfileTestBuilder.aScopedManager;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DepartmentInheritanceMap")
class DepartmentInheritanceMapTest {

    private final DepartmentInheritanceMap map = DepartmentInheritanceMap.standard();

    @ParameterizedTest
    @EnumSource(Department.class)
    @DisplayName("should map every department to at least one staff role")
    void everyDepartmentIsMapped(Department department) {
        assertThat(map.rolesFor(department)).isNotEmpty().doesNotContain(Role.OWNER, Role.MANAGER);
    }

    @Nested
    @DisplayName("getInheritedRoles")
    class GetInheritedRoles {

        @Test
        @DisplayName("should resolve a single scope")
        void singleScope() {
            assertThat(map.getInheritedRoles(aScopedManager("operations"))).containsExactly(Role.OPS);
        }

        @Test
        @DisplayName("should deduplicate departments sharing a role")
        void deduplicates() {
            assertThat(map.getInheritedRoles(aScopedManager("operations", "assets"))).containsExactly(Role.OPS);
        }

        @Test
        @DisplayName("should union roles of several departments")
        void unionOfScopes() {
            assertThat(map.getInheritedRoles(aScopedManager("finance", "hse", "marketing")))
                    .containsExactlyInAnyOrder(Role.FINANCE, Role.HSE, Role.MARKETING);
        }

        @Test
        @DisplayName("should accept scope values in any case")
        void caseInsensitiveScope() {
            assertThat(map.getInheritedRoles(aScopedManager(" Engineering "))).containsExactly(Role.ENGINEER);
        }

        @Test
        @DisplayName("should ignore unknown scope values")
        void ignoresUnknownScope() {
            assertThat(map.getInheritedRoles(aScopedManager("legal", "hr"))).containsExactly(Role.HR);
            assertThat(map.getInheritedRoles(aScopedManager("legal"))).isEmpty();
        }

        @Test
        @DisplayName("should be empty for a manager without scope")
        void managerWithoutScope() {
            assertThat(map.getInheritedRoles(aScopedManager())).isEmpty();
        }

        @ParameterizedTest
        @EnumSource(value = Role.class, names = "MANAGER", mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("should be empty for any non-manager role even with scope")
        void nonManagerRoles(Role role) {
            UserProfile profile = aProfile()
                    .withRole(role)
                    .withDepartmentScope("finance", "operations")
                    .build();

            assertThat(map.getInheritedRoles(profile)).isEmpty();
        }

        @Test
        @DisplayName("should be empty for a null profile")
        void nullProfile() {
            assertThat(map.getInheritedRoles(null)).isEmpty();
        }
    }
}
