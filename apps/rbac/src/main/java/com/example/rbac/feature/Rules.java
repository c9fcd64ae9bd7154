package com.example.rbac.feature;

import com.example.rbac.permission.PermissionFlag;
import com.example.rbac.profile.UserProfile;
import com.example.rbac.role.Role;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Predicate building blocks for the feature rule table.
 */
public final class Rules {

    public static final Set<Role> EXECUTIVES = Set.of(Role.OWNER, Role.DIRECTOR);
    public static final Set<Role> ADMINS = Set.of(Role.OWNER, Role.DIRECTOR, Role.SYSADMIN);
    public static final Set<Role> MANAGEMENT = Set.of(Role.OWNER, Role.DIRECTOR, Role.MANAGER);

    private Rules() {}

    /**
     * Role is one of the given roles.
     */
    public static Predicate<UserProfile> roles(Role first, Role... rest) {
        Set<Role> allowed = EnumSet.of(first, rest);
        return profile -> profile.role() != null && allowed.contains(profile.role());
    }

    public static Predicate<UserProfile> roles(Set<Role> allowed) {
        Set<Role> copy = Set.copyOf(allowed);
        return profile -> profile.role() != null && copy.contains(profile.role());
    }

    /**
     * Role set extended with extra roles.
     */
    public static Predicate<UserProfile> roles(Set<Role> base, Role... extra) {
        EnumSet<Role> allowed = EnumSet.copyOf(base);
        allowed.addAll(List.of(extra));
        return roles(allowed);
    }

    public static Predicate<UserProfile> executives() {
        return roles(EXECUTIVES);
    }

    public static Predicate<UserProfile> admins() {
        return roles(ADMINS);
    }

    /**
     * Any recognized role.
     */
    public static Predicate<UserProfile> anyRole() {
        return profile -> profile.role() != null;
    }

    public static Predicate<UserProfile> flag(PermissionFlag flag) {
        return profile -> flag.isGrantedIn(profile.permissions());
    }

    public static Predicate<UserProfile> not(Predicate<UserProfile> predicate) {
        return predicate.negate();
    }

    @SafeVarargs
    public static Predicate<UserProfile> anyOf(Predicate<UserProfile>... predicates) {
        List<Predicate<UserProfile>> all = List.of(predicates);
        return profile -> all.stream().anyMatch(p -> p.test(profile));
    }

    @SafeVarargs
    public static Predicate<UserProfile> allOf(Predicate<UserProfile>... predicates) {
        List<Predicate<UserProfile>> all = List.of(predicates);
        return profile -> all.stream().allMatch(p -> p.test(profile));
    }
}
