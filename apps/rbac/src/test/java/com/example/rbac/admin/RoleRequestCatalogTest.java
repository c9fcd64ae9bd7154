package com.example.rbac.admin;

import com.example.rbac.role.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoleRequestCatalog")
class RoleRequestCatalogTest {

    private final RoleRequestCatalog catalog = new RoleRequestCatalog();

    @Test
    @DisplayName("should map departments to requestable roles")
    void departmentRoles() {
        assertThat(catalog.getDepartmentRoles("Operations")).containsExactly(Role.OPS);
        assertThat(catalog.getDepartmentRoles("Finance")).containsExactly(Role.FINANCE, Role.ADMINISTRATION);
        assertThat(catalog.getDepartmentRoles("Engineering")).containsExactly(Role.ENGINEER);
        assertThat(catalog.getDepartmentNames()).hasSize(7).startsWith("Operations");
    }

    @ParameterizedTest
    @ValueSource(strings = {"operations", "FINANCE", "Legal", "", "constructor"})
    @DisplayName("should return no roles for unknown or differently cased departments")
    void unknownDepartments(String department) {
        assertThat(catalog.getDepartmentRoles(department)).isEmpty();
    }

    @Test
    @DisplayName("should never offer the owner role")
    void neverOwner() {
        for (String department : catalog.getDepartmentNames()) {
            assertThat(catalog.getDepartmentRoles(department)).doesNotContain(Role.OWNER);
        }
        assertThat(catalog.getDepartmentRoles(null)).isEmpty();
    }

    @Test
    @DisplayName("should notify owner, director and sysadmin of new requests")
    void notificationRoles() {
        assertThat(catalog.getAdminNotificationRoles())
                .containsExactlyInAnyOrder(Role.OWNER, Role.DIRECTOR, Role.SYSADMIN);
    }
}
