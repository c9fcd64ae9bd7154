package com.example.rbac.config.properties;

import com.example.rbac.engine.VirtualPermissions;
import jakarta.validation.constraints.Email;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for role-based access control.
 */
@Validated
@ConfigurationProperties(prefix = "app.rbac")
public record RbacProperties(
        @Email String ownerEmail,
        InheritanceProperties inheritance,
        AuditProperties audit,
        GuardProperties guard
) {
    public RbacProperties {
        if (inheritance == null) {
            inheritance = new InheritanceProperties(VirtualPermissions.ROLE_DEFAULTS);
        }
        if (audit == null) {
            audit = new AuditProperties(true);
        }
        if (guard == null) {
            guard = new GuardProperties(true);
        }
    }

    /**
     * Department-scope inheritance for managers.
     */
    public record InheritanceProperties(
            VirtualPermissions virtualPermissions
    ) {
        public InheritanceProperties {
            if (virtualPermissions == null) {
                virtualPermissions = VirtualPermissions.ROLE_DEFAULTS;
            }
        }
    }

    public record AuditProperties(
            boolean enabled
    ) {}

    public record GuardProperties(
            boolean enabled
    ) {}
}
