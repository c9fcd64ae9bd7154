package com.example.rbac.engine;

/**
 * Which flags a manager's virtual profile carries when it is evaluated as an inherited role.
 */
public enum VirtualPermissions {
    /** Default bundle of the inherited role. */
    ROLE_DEFAULTS,
    /** The manager's own stored flags. */
    ACTOR_FLAGS
}
