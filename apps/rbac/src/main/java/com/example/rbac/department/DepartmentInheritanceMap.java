package com.example.rbac.department;

import com.example.rbac.common.util.StringSanitizer;
import com.example.rbac.profile.UserProfile;
import com.example.rbac.role.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Staff roles a scoped manager is additionally evaluated as.
 *
 * <p>Inherited roles only widen feature checks. They never change the display
 * role or the default-permission lookup of the manager.
 */
@Slf4j
public class DepartmentInheritanceMap {

    private final Map<Department, Set<Role>> inheritedRoles;

    public DepartmentInheritanceMap(Map<Department, Set<Role>> inheritedRoles) {
        EnumMap<Department, Set<Role>> copy = new EnumMap<>(Department.class);
        inheritedRoles.forEach((department, roles) -> copy.put(department, Set.copyOf(roles)));
        this.inheritedRoles = Collections.unmodifiableMap(copy);
        log.info("Department inheritance map initialized with {} departments", this.inheritedRoles.size());
    }

    /**
     * The shipped mapping. Operations and assets share the ops staff pool.
     */
    public static DepartmentInheritanceMap standard() {
        EnumMap<Department, Set<Role>> map = new EnumMap<>(Department.class);
        map.put(Department.MARKETING, Set.of(Role.MARKETING));
        map.put(Department.ENGINEERING, Set.of(Role.ENGINEER));
        map.put(Department.ADMINISTRATION, Set.of(Role.ADMINISTRATION));
        map.put(Department.FINANCE, Set.of(Role.FINANCE));
        map.put(Department.OPERATIONS, Set.of(Role.OPS));
        map.put(Department.ASSETS, Set.of(Role.OPS));
        map.put(Department.HR, Set.of(Role.HR));
        map.put(Department.HSE, Set.of(Role.HSE));
        return new DepartmentInheritanceMap(map);
    }

    public Set<Role> rolesFor(Department department) {
        return inheritedRoles.getOrDefault(department, Set.of());
    }

    /**
     * Union of the staff roles for every recognized scope value of a manager profile.
     * Empty for any other role, for an empty scope, or for a null profile.
     */
    public Set<Role> getInheritedRoles(@Nullable UserProfile profile) {
        if (profile == null || profile.role() != Role.MANAGER) {
            return Set.of();
        }
        List<String> scope = profile.departmentScope();
        if (scope.isEmpty()) {
            return Set.of();
        }

        EnumSet<Role> roles = EnumSet.noneOf(Role.class);
        for (String value : scope) {
            Optional<Department> department = Department.fromValue(value);
            if (department.isEmpty()) {
                log.debug("Ignoring unrecognized department scope '{}' on profile {}",
                        StringSanitizer.forLog(value), profile.id());
                continue;
            }
            roles.addAll(rolesFor(department.get()));
        }
        return Collections.unmodifiableSet(roles);
    }
}
