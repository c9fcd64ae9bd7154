package com.example.rbac.role;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoleCatalog")
class RoleCatalogTest {

    @Test
    @DisplayName("should recognize no owner when the address is not configured")
    void noOwnerConfigured() {
        RoleCatalog catalog = new RoleCatalog("  ");

        assertThat(catalog.isOwnerEmail("")).isFalse();
        assertThat(catalog.isOwnerEmail("owner@example.com")).isFalse();
    }

    @Test
    @DisplayName("should normalize the configured address")
    void normalizesConfiguredAddress() {
        RoleCatalog catalog = new RoleCatalog(" Owner@Example.com ");

        assertThat(catalog.isOwnerEmail("owner@example.com")).isTrue();
        assertThat(catalog.isOwnerEmail(" owner@example.com")).isFalse();
    }

    @Test
    @DisplayName("should list all eleven roles with owner first")
    void allRoles() {
        assertThat(new RoleCatalog(null).allRoles()).hasSize(11).first().isEqualTo(Role.OWNER);
    }

    @Test
    @DisplayName("should only treat owner, director and sysadmin as admins")
    void adminRoles() {
        RoleCatalog catalog = new RoleCatalog(null);

        assertThat(catalog.isAdminRole(Role.SYSADMIN)).isTrue();
        assertThat(catalog.isAdminRole(Role.MANAGER)).isFalse();
        assertThat(catalog.isAdminRole(null)).isFalse();
        assertThat(catalog.isAssignable(Role.OWNER)).isFalse();
        assertThat(catalog.isAssignable(Role.HSE)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"ops", "OPS", " Ops "})
    @DisplayName("should parse stored role values")
    void parsesRoleValues(String value) {
        assertThat(Role.fromValue(value)).isEqualTo(Role.OPS);
    }

    @ParameterizedTest
    @ValueSource(strings = {"admin", "viewer", "marketing_manager", ""})
    @DisplayName("should map unknown role values to no role")
    void unknownRoleValues(String value) {
        assertThat(Role.fromValue(value)).isNull();
    }

    @Test
    @DisplayName("should expose display names")
    void displayNames() {
        assertThat(Role.OPS.getDisplayName()).isEqualTo("Operations");
        assertThat(Role.HSE.getDisplayName()).isEqualTo("HSE");
        assertThat(Role.SYSADMIN.getDisplayName()).isEqualTo("System Administrator");
    }
}
