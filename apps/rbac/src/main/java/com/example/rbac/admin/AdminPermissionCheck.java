package com.example.rbac.admin;

import org.springframework.lang.Nullable;

/**
 * Result of an administrative precondition check.
 */
public record AdminPermissionCheck(boolean allowed, @Nullable String reason) {

    public static AdminPermissionCheck allow() {
        return new AdminPermissionCheck(true, null);
    }

    public static AdminPermissionCheck deny(String reason) {
        return new AdminPermissionCheck(false, reason);
    }
}
