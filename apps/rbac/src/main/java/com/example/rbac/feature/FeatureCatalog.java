package com.example.rbac.feature;

import static com.example.rbac.feature.Rules.*;
import static com.example.rbac.permission.PermissionFlag.*;
import static com.example.rbac.role.Role.*;

/**
 * Declared feature gates, grouped by business module.
 *
 * <p>Keys are append-only: a retired key stays declared until no client references it.
 */
public final class FeatureCatalog {

    private FeatureCatalog() {}

    public static FeatureRuleTable standard() {
        FeatureRuleTable.Builder builder = FeatureRuleTable.builder();
        customers(builder);
        quotations(builder);
        jobOrders(builder);
        invoicing(builder);
        disbursements(builder);
        finance(builder);
        humanResources(builder);
        hse(builder);
        assets(builder);
        engineering(builder);
        customs(builder);
        agency(builder);
        reports(builder);
        dashboards(builder);
        administration(builder);
        workspace(builder);
        return builder.build();
    }

    private static void customers(FeatureRuleTable.Builder b) {
        b.rule("customers.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, MARKETING))
                .rule("customers.create", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, MARKETING))
                .rule("customers.edit", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, MARKETING))
                .rule("customers.delete", executives())
                .rule("customers.view_financials", flag(CAN_SEE_REVENUE))
                .rule("projects.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, MARKETING, OPS, ENGINEER))
                .rule("projects.create", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, MARKETING))
                .rule("projects.edit", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, MARKETING))
                .rule("projects.delete", executives());
    }

    private static void quotations(FeatureRuleTable.Builder b) {
        b.rule("quotations.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, MARKETING, ENGINEER))
                .rule("quotations.create", roles(OWNER, DIRECTOR, MANAGER, MARKETING))
                .rule("quotations.edit", roles(OWNER, DIRECTOR, MANAGER, MARKETING))
                .rule("quotations.submit", roles(OWNER, DIRECTOR, MANAGER, MARKETING))
                .rule("quotations.approve", roles(MANAGEMENT))
                .rule("quotations.delete", executives())
                .rule("quotations.view_revenue", flag(CAN_SEE_REVENUE))
                .rule("quotations.view_profit", flag(CAN_SEE_PROFIT))
                .rule("quotations.estimate_costs", flag(CAN_ESTIMATE_COSTS))
                .rule("quotations.engineering_review", roles(OWNER, DIRECTOR, MANAGER, ENGINEER))
                .rule("pjo.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, MARKETING, OPS))
                .rule("pjo.create", flag(CAN_CREATE_PJO))
                .rule("pjo.edit", flag(CAN_CREATE_PJO))
                .rule("pjo.check", flag(CAN_CHECK_PJO))
                .rule("pjo.approve", flag(CAN_APPROVE_PJO))
                .rule("pjo.reject", anyOf(flag(CAN_CHECK_PJO), flag(CAN_APPROVE_PJO)))
                .rule("pjo.delete", executives())
                .rule("pjo.view_revenue", flag(CAN_SEE_REVENUE))
                .rule("pjo.view_profit", flag(CAN_SEE_PROFIT))
                .rule("pjo.estimate_costs", flag(CAN_ESTIMATE_COSTS));
    }

    private static void jobOrders(FeatureRuleTable.Builder b) {
        b.rule("jo.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, MARKETING, OPS, ENGINEER))
                .rule("jo.create", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION))
                .rule("jo.edit", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION))
                .rule("jo.fill_costs", flag(CAN_FILL_COSTS))
                .rule("jo.view_actual_costs", flag(CAN_SEE_ACTUAL_COSTS))
                .rule("jo.check", flag(CAN_CHECK_JO))
                .rule("jo.approve", flag(CAN_APPROVE_JO))
                .rule("jo.reject", anyOf(flag(CAN_CHECK_JO), flag(CAN_APPROVE_JO)))
                .rule("jo.submit_to_finance", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, OPS))
                .rule("jo.assign_equipment", roles(OWNER, DIRECTOR, MANAGER, OPS))
                .rule("jo.delete", executives())
                .rule("jo.view_revenue", flag(CAN_SEE_REVENUE))
                .rule("jo.view_profit", flag(CAN_SEE_PROFIT))
                .rule("cost_entry.view", anyOf(flag(CAN_FILL_COSTS), flag(CAN_SEE_ACTUAL_COSTS)))
                .rule("cost_entry.edit", flag(CAN_FILL_COSTS))
                .rule("cost_entry.confirm", allOf(roles(MANAGEMENT), flag(CAN_SEE_ACTUAL_COSTS)));
    }

    private static void invoicing(FeatureRuleTable.Builder b) {
        b.rule("invoices.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE))
                .rule("invoices.create", flag(CAN_MANAGE_INVOICES))
                .rule("invoices.edit", flag(CAN_MANAGE_INVOICES))
                .rule("invoices.send", flag(CAN_MANAGE_INVOICES))
                .rule("invoices.record_payment", roles(OWNER, DIRECTOR, FINANCE))
                .rule("invoices.void", executives())
                .rule("invoices.delete", executives())
                .rule("invoices.view_aging", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE))
                .rule("vendor_invoices.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, OPS))
                .rule("vendor_invoices.create", roles(OWNER, DIRECTOR, ADMINISTRATION, FINANCE, OPS))
                .rule("vendor_invoices.edit", roles(OWNER, DIRECTOR, ADMINISTRATION, FINANCE, OPS))
                .rule("vendor_invoices.verify", roles(OWNER, DIRECTOR, FINANCE))
                .rule("vendor_invoices.approve",
                        anyOf(executives(), allOf(roles(FINANCE), flag(CAN_MANAGE_INVOICES))))
                .rule("vendor_invoices.record_payment", roles(OWNER, DIRECTOR, FINANCE))
                .rule("vendor_invoices.delete", executives());
    }

    private static void disbursements(FeatureRuleTable.Builder b) {
        b.rule("bkk.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE))
                .rule("bkk.create", roles(OWNER, DIRECTOR, ADMINISTRATION, FINANCE))
                .rule("bkk.check", flag(CAN_CHECK_BKK))
                .rule("bkk.approve", flag(CAN_APPROVE_BKK))
                .rule("bkk.reject", anyOf(flag(CAN_CHECK_BKK), flag(CAN_APPROVE_BKK)))
                .rule("bkk.mark_paid", roles(OWNER, DIRECTOR, FINANCE))
                .rule("bkk.delete", executives());
    }

    private static void finance(FeatureRuleTable.Builder b) {
        b.rule("finance.view_dashboard", roles(OWNER, DIRECTOR, ADMINISTRATION, FINANCE))
                .rule("finance.view_revenue", flag(CAN_SEE_REVENUE))
                .rule("finance.view_profit", flag(CAN_SEE_PROFIT))
                .rule("finance.view_cash_flow", roles(OWNER, DIRECTOR, FINANCE))
                .rule("finance.manage_settings", roles(OWNER, DIRECTOR, FINANCE))
                .rule("finance.manage_bank_accounts", roles(OWNER, DIRECTOR, FINANCE))
                .rule("finance.manage_budgets", roles(OWNER, DIRECTOR, MANAGER, FINANCE))
                .rule("finance.export_accounting", roles(OWNER, DIRECTOR, FINANCE));
    }

    private static void humanResources(FeatureRuleTable.Builder b) {
        b.rule("employees.view", roles(OWNER, DIRECTOR, MANAGER, HR))
                .rule("employees.create", roles(OWNER, DIRECTOR, HR))
                .rule("employees.edit", roles(OWNER, DIRECTOR, HR))
                .rule("employees.delete", executives())
                .rule("employees.view_salary", roles(OWNER, DIRECTOR, FINANCE, HR))
                .rule("employees.edit_salary", roles(OWNER, DIRECTOR, HR))
                .rule("employees.nav", roles(OWNER, DIRECTOR, MANAGER, HR))
                .rule("hr.view_dashboard", roles(OWNER, DIRECTOR, HR))
                .rule("hr.view_payroll", roles(OWNER, DIRECTOR, FINANCE, HR))
                .rule("hr.run_payroll", roles(OWNER, DIRECTOR, HR))
                .rule("hr.approve_payroll", executives())
                .rule("hr.view_attendance", roles(OWNER, DIRECTOR, MANAGER, HR))
                .rule("hr.edit_attendance", roles(OWNER, DIRECTOR, HR))
                .rule("hr.manual_attendance_entry", roles(OWNER, DIRECTOR, HR))
                .rule("hr.manage_schedules", roles(OWNER, DIRECTOR, HR))
                .rule("hr.view_leave", roles(OWNER, DIRECTOR, MANAGER, HR))
                .rule("hr.approve_leave", roles(OWNER, DIRECTOR, MANAGER, HR))
                .rule("hr.manage_leave_types", roles(OWNER, DIRECTOR, HR))
                .rule("hr.view_manpower_cost", roles(OWNER, DIRECTOR, SYSADMIN, MANAGER, FINANCE))
                .rule("hr.manage_skills", roles(OWNER, DIRECTOR, HR))
                .rule("hr.view_performance", roles(OWNER, DIRECTOR, MANAGER, HR))
                .rule("hr.manage_performance", roles(OWNER, DIRECTOR, HR));
    }

    private static void hse(FeatureRuleTable.Builder b) {
        b.rule("hse.view_dashboard", roles(OWNER, DIRECTOR, MANAGER, HSE))
                .rule("hse.view_incidents", roles(OWNER, DIRECTOR, MANAGER, HR, HSE, OPS, ENGINEER))
                .rule("hse.report_incident", anyRole())
                .rule("hse.investigate_incident", roles(OWNER, DIRECTOR, HSE))
                .rule("hse.close_incident", roles(OWNER, DIRECTOR, HSE))
                .rule("hse.view_permits", roles(OWNER, DIRECTOR, MANAGER, HSE, OPS))
                .rule("hse.request_permit", roles(OWNER, DIRECTOR, MANAGER, HSE, OPS))
                .rule("hse.approve_permit", roles(OWNER, DIRECTOR, HSE))
                .rule("hse.view_ppe", roles(OWNER, DIRECTOR, MANAGER, HR, HSE, OPS))
                .rule("hse.issue_ppe", roles(OWNER, DIRECTOR, HSE, OPS))
                .rule("hse.manage_ppe", roles(OWNER, DIRECTOR, HSE))
                .rule("hse.view_documents", anyRole())
                .rule("hse.manage_documents", roles(OWNER, DIRECTOR, HSE))
                .rule("hse.approve_documents", roles(OWNER, DIRECTOR, HSE))
                .rule("hse.view_audits", roles(OWNER, DIRECTOR, MANAGER, HSE))
                .rule("hse.conduct_audit", roles(OWNER, DIRECTOR, HSE))
                .rule("hse.view_training", roles(OWNER, DIRECTOR, MANAGER, HR, HSE))
                .rule("hse.manage_training", roles(OWNER, DIRECTOR, HSE))
                .rule("hse.view_medical_checkups", roles(OWNER, DIRECTOR, HR, HSE))
                .rule("hse.manage_medical_checkups", roles(OWNER, DIRECTOR, HSE))
                .rule("hse.view_jmp", roles(OWNER, DIRECTOR, MANAGER, HSE, OPS))
                .rule("hse.approve_jmp", roles(OWNER, DIRECTOR, HSE));
    }

    private static void assets(FeatureRuleTable.Builder b) {
        b.rule("assets.view", roles(OWNER, DIRECTOR, MANAGER, FINANCE, OPS, ENGINEER))
                .rule("assets.create", roles(OWNER, DIRECTOR, MANAGER, OPS))
                .rule("assets.edit", roles(OWNER, DIRECTOR, MANAGER, OPS))
                .rule("assets.dispose", executives())
                .rule("assets.view_costs", flag(CAN_SEE_ACTUAL_COSTS))
                .rule("assets.view_depreciation", roles(OWNER, DIRECTOR, FINANCE))
                .rule("assets.run_depreciation", roles(OWNER, DIRECTOR, FINANCE))
                .rule("maintenance.view", roles(OWNER, DIRECTOR, MANAGER, OPS, ENGINEER))
                .rule("maintenance.schedule", roles(OWNER, DIRECTOR, MANAGER, OPS))
                .rule("maintenance.record", roles(OWNER, DIRECTOR, OPS, ENGINEER))
                .rule("maintenance.approve", roles(MANAGEMENT))
                .rule("maintenance.view_costs", flag(CAN_SEE_ACTUAL_COSTS));
    }

    private static void engineering(FeatureRuleTable.Builder b) {
        b.rule("engineering.view_surveys", roles(OWNER, DIRECTOR, MANAGER, MARKETING, ENGINEER))
                .rule("engineering.create_survey", roles(OWNER, DIRECTOR, ENGINEER))
                .rule("engineering.edit_survey", roles(OWNER, DIRECTOR, ENGINEER))
                .rule("engineering.approve_survey", roles(MANAGEMENT))
                .rule("engineering.view_assessments", roles(OWNER, DIRECTOR, MANAGER, ENGINEER))
                .rule("engineering.create_assessment", roles(OWNER, DIRECTOR, ENGINEER))
                .rule("engineering.approve_assessment", roles(MANAGEMENT))
                .rule("engineering.estimate_costs", allOf(roles(OWNER, DIRECTOR, MANAGER, ENGINEER),
                        flag(CAN_ESTIMATE_COSTS)));
    }

    private static void customs(FeatureRuleTable.Builder b) {
        b.rule("pib.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, OPS))
                .rule("pib.create", roles(OWNER, DIRECTOR, ADMINISTRATION, OPS))
                .rule("pib.edit", roles(OWNER, DIRECTOR, ADMINISTRATION, OPS))
                .rule("pib.submit", roles(OWNER, DIRECTOR, ADMINISTRATION))
                .rule("pib.view_duties", roles(OWNER, DIRECTOR, ADMINISTRATION, FINANCE))
                .rule("pib.delete", admins())
                .rule("peb.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, OPS))
                .rule("peb.create", roles(OWNER, DIRECTOR, ADMINISTRATION, OPS))
                .rule("peb.edit", roles(OWNER, DIRECTOR, ADMINISTRATION, OPS))
                .rule("peb.submit", roles(OWNER, DIRECTOR, ADMINISTRATION))
                .rule("peb.delete", admins())
                .rule("customs.view_dashboard", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION))
                .rule("customs.view_fees", roles(OWNER, DIRECTOR, ADMINISTRATION, FINANCE))
                .rule("customs.manage_fees", roles(OWNER, DIRECTOR, FINANCE));
    }

    private static void agency(FeatureRuleTable.Builder b) {
        b.rule("agency.view_vessels", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, MARKETING, OPS))
                .rule("agency.manage_vessels", roles(OWNER, DIRECTOR, OPS))
                .rule("agency.view_schedules", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, MARKETING, OPS))
                .rule("agency.manage_schedules", roles(OWNER, DIRECTOR, MARKETING, OPS))
                .rule("agency.view_tracking", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, MARKETING, OPS))
                .rule("agency.view_bookings", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, MARKETING, OPS))
                .rule("agency.create_booking", roles(OWNER, DIRECTOR, ADMINISTRATION, MARKETING))
                .rule("agency.confirm_booking", roles(OWNER, DIRECTOR, OPS))
                .rule("agency.cancel_booking", roles(OWNER, DIRECTOR, MARKETING))
                .rule("agency.view_bl", roles(OWNER, DIRECTOR, ADMINISTRATION, OPS))
                .rule("agency.issue_bl", roles(OWNER, DIRECTOR, ADMINISTRATION));
    }

    private static void reports(FeatureRuleTable.Builder b) {
        b.rule("reports.view", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, MARKETING, OPS))
                .rule("reports.profit_loss", flag(CAN_SEE_PROFIT))
                .rule("reports.revenue_by_customer", flag(CAN_SEE_REVENUE))
                .rule("reports.revenue_by_project", flag(CAN_SEE_REVENUE))
                .rule("reports.ar_aging", roles(OWNER, DIRECTOR, MANAGER, FINANCE))
                .rule("reports.budget_variance", roles(OWNER, DIRECTOR, MANAGER, FINANCE))
                .rule("reports.customer_payment_history", roles(OWNER, DIRECTOR, ADMINISTRATION, FINANCE))
                .rule("reports.jo_summary", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, OPS))
                .rule("reports.on_time_delivery", roles(OWNER, DIRECTOR, MANAGER, OPS))
                .rule("reports.vendor_performance", roles(OWNER, DIRECTOR, MANAGER, FINANCE, OPS))
                .rule("reports.quotation_conversion", roles(OWNER, DIRECTOR, MANAGER, MARKETING))
                .rule("reports.sales_pipeline", roles(OWNER, DIRECTOR, MANAGER, MARKETING))
                .rule("reports.customer_acquisition", roles(OWNER, DIRECTOR, MANAGER, MARKETING))
                .rule("reports.export", roles(OWNER, DIRECTOR, MANAGER, FINANCE));
    }

    private static void dashboards(FeatureRuleTable.Builder b) {
        b.rule("dashboard.executive", executives())
                .rule("dashboard.manager", roles(MANAGEMENT))
                .rule("dashboard.finance_manager", roles(MANAGEMENT))
                .rule("dashboard.operations_manager", roles(MANAGEMENT))
                .rule("dashboard.marketing", roles(OWNER, DIRECTOR, MARKETING))
                .rule("dashboard.admin_finance", roles(OWNER, DIRECTOR, ADMINISTRATION, FINANCE))
                .rule("dashboard.operations", roles(OWNER, DIRECTOR, OPS))
                .rule("dashboard.engineering", roles(OWNER, DIRECTOR, ENGINEER))
                .rule("dashboard.hr", roles(OWNER, DIRECTOR, HR))
                .rule("dashboard.hse", roles(OWNER, DIRECTOR, HSE))
                .rule("dashboard.sysadmin", roles(OWNER, SYSADMIN))
                .rule("dashboard.assets", roles(OWNER, DIRECTOR, MANAGER, OPS))
                .rule("dashboard.view_kpis", roles(MANAGEMENT))
                .rule("dashboard.view_alerts", roles(MANAGEMENT, SYSADMIN));
    }

    private static void administration(FeatureRuleTable.Builder b) {
        b.rule("users.view", flag(CAN_MANAGE_USERS))
                .rule("users.invite", flag(CAN_MANAGE_USERS))
                .rule("users.edit", flag(CAN_MANAGE_USERS))
                .rule("users.deactivate", flag(CAN_MANAGE_USERS))
                .rule("users.assign_department_scope", admins())
                .rule("users.view_login_history", admins())
                .rule("roles.approve_requests", admins())
                .rule("roles.preview", roles(OWNER))
                .rule("settings.view", admins())
                .rule("settings.company", executives())
                .rule("settings.integrations", admins())
                .rule("settings.automation", admins())
                .rule("settings.scheduled_tasks", admins())
                .rule("settings.notification_templates", admins())
                .rule("settings.notification_logs", admins())
                .rule("settings.system_logs", admins())
                .rule("settings.system_logs_export", admins())
                .rule("settings.audit_logs", admins())
                .rule("settings.data_sync", admins())
                .rule("settings.external_ids", admins())
                .rule("settings.backup", roles(OWNER, SYSADMIN));
    }

    private static void workspace(FeatureRuleTable.Builder b) {
        b.rule("notifications.view", anyRole())
                .rule("notifications.manage_preferences", anyRole())
                .rule("notifications.broadcast", admins())
                .rule("feedback.submit", anyRole())
                .rule("feedback.view_all", admins())
                .rule("feedback.resolve", admins())
                .rule("help.view", anyRole())
                .rule("help.manage_articles", admins())
                .rule("changelog.view", anyRole())
                .rule("changelog.manage", admins())
                .rule("attachments.upload", anyRole())
                .rule("attachments.delete", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION))
                .rule("documents.generate_pdf", roles(OWNER, DIRECTOR, MANAGER, ADMINISTRATION, FINANCE, MARKETING))
                .rule("templates.manage", roles(OWNER, DIRECTOR, ADMINISTRATION))
                .rule("ai.query", roles(MANAGEMENT))
                .rule("ai.view_insights", roles(MANAGEMENT, FINANCE))
                .rule("ai.predictive_analytics", executives())
                .rule("co_builder.use", anyRole())
                .rule("co_builder.view_results", admins())
                .rule("co_builder.admin", admins());
    }
}
