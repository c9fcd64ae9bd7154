package com.example.rbac.config;

import com.example.rbac.admin.RolePreview;
import com.example.rbac.admin.RoleRequestCatalog;
import com.example.rbac.admin.UserAdministrationRules;
import com.example.rbac.audit.AccessAuditService;
import com.example.rbac.config.properties.RbacProperties;
import com.example.rbac.department.DepartmentInheritanceMap;
import com.example.rbac.engine.FeatureAccessEngine;
import com.example.rbac.feature.FeatureCatalog;
import com.example.rbac.feature.FeatureRuleTable;
import com.example.rbac.guard.CurrentProfileResolver;
import com.example.rbac.guard.FeatureGuardAspect;
import com.example.rbac.permission.PermissionBundleTable;
import com.example.rbac.role.RoleCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the immutable access-control tables and the services built on them.
 */
@Slf4j
@Configuration
public class RbacConfig {

    @Bean
    public RoleCatalog roleCatalog(RbacProperties properties) {
        return new RoleCatalog(properties.ownerEmail());
    }

    @Bean
    public PermissionBundleTable permissionBundleTable() {
        return PermissionBundleTable.standard();
    }

    @Bean
    public DepartmentInheritanceMap departmentInheritanceMap() {
        return DepartmentInheritanceMap.standard();
    }

    @Bean
    public FeatureRuleTable featureRuleTable() {
        return FeatureCatalog.standard();
    }

    @Bean
    public FeatureAccessEngine featureAccessEngine(PermissionBundleTable bundleTable,
                                                   DepartmentInheritanceMap inheritanceMap,
                                                   FeatureRuleTable ruleTable,
                                                   RbacProperties properties) {
        return new FeatureAccessEngine(bundleTable, inheritanceMap, ruleTable,
                properties.inheritance().virtualPermissions());
    }

    @Bean
    public UserAdministrationRules userAdministrationRules(RoleCatalog roleCatalog,
                                                           PermissionBundleTable bundleTable) {
        return new UserAdministrationRules(roleCatalog, bundleTable);
    }

    @Bean
    public RolePreview rolePreview(PermissionBundleTable bundleTable) {
        return new RolePreview(bundleTable);
    }

    @Bean
    public RoleRequestCatalog roleRequestCatalog() {
        return new RoleRequestCatalog();
    }

    @Bean
    @ConditionalOnProperty(name = "app.rbac.guard.enabled", havingValue = "true", matchIfMissing = true)
    public FeatureGuardAspect featureGuardAspect(FeatureAccessEngine engine,
                                                 ObjectProvider<CurrentProfileResolver> profileResolver,
                                                 ObjectProvider<AccessAuditService> auditService) {
        log.info("Feature guard enabled for @RequiresFeature methods");
        return new FeatureGuardAspect(engine, profileResolver.getIfAvailable(), auditService.getIfAvailable());
    }
}
