package com.example.rbac.admin;

import com.example.rbac.role.Role;
import com.example.rbac.role.RoleCatalog;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Roles a new user may request, grouped by the department picked on the request-access form.
 */
public class RoleRequestCatalog {

    private static final Map<String, List<Role>> DEPARTMENT_ROLES = departmentRoles();

    private static Map<String, List<Role>> departmentRoles() {
        Map<String, List<Role>> map = new LinkedHashMap<>();
        map.put("Operations", List.of(Role.OPS));
        map.put("Finance", List.of(Role.FINANCE, Role.ADMINISTRATION));
        map.put("Marketing", List.of(Role.MARKETING));
        map.put("HR", List.of(Role.HR));
        map.put("HSE", List.of(Role.HSE));
        map.put("Engineering", List.of(Role.ENGINEER));
        map.put("Administration", List.of(Role.ADMINISTRATION));
        return Collections.unmodifiableMap(map);
    }

    /**
     * Department names exactly as shown on the form; matching is case-sensitive.
     */
    public List<Role> getDepartmentRoles(@Nullable String departmentName) {
        if (departmentName == null) {
            return List.of();
        }
        return DEPARTMENT_ROLES.getOrDefault(departmentName, List.of());
    }

    public Set<String> getDepartmentNames() {
        return DEPARTMENT_ROLES.keySet();
    }

    /**
     * Recipients of new role-request notifications.
     */
    public Set<Role> getAdminNotificationRoles() {
        return RoleCatalog.ADMIN_ROLES;
    }
}
