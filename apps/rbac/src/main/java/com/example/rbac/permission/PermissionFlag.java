package com.example.rbac.permission;

import org.springframework.lang.Nullable;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Named capability flags of a {@link PermissionBundle}.
 *
 * <p>The column name matches the {@code user_profiles} column and the JSON property.
 */
public enum PermissionFlag {
    CAN_SEE_REVENUE("can_see_revenue", PermissionBundle::canSeeRevenue),
    CAN_SEE_PROFIT("can_see_profit", PermissionBundle::canSeeProfit),
    CAN_APPROVE_PJO("can_approve_pjo", PermissionBundle::canApprovePjo),
    CAN_MANAGE_INVOICES("can_manage_invoices", PermissionBundle::canManageInvoices),
    CAN_MANAGE_USERS("can_manage_users", PermissionBundle::canManageUsers),
    CAN_CREATE_PJO("can_create_pjo", PermissionBundle::canCreatePjo),
    CAN_FILL_COSTS("can_fill_costs", PermissionBundle::canFillCosts),
    CAN_CHECK_PJO("can_check_pjo", PermissionBundle::canCheckPjo),
    CAN_CHECK_JO("can_check_jo", PermissionBundle::canCheckJo),
    CAN_CHECK_BKK("can_check_bkk", PermissionBundle::canCheckBkk),
    CAN_APPROVE_JO("can_approve_jo", PermissionBundle::canApproveJo),
    CAN_APPROVE_BKK("can_approve_bkk", PermissionBundle::canApproveBkk),
    CAN_ESTIMATE_COSTS("can_estimate_costs", PermissionBundle::canEstimateCosts),
    CAN_SEE_ACTUAL_COSTS("can_see_actual_costs", PermissionBundle::canSeeActualCosts);

    private final String columnName;
    private final Predicate<PermissionBundle> accessor;

    PermissionFlag(String columnName, Predicate<PermissionBundle> accessor) {
        this.columnName = columnName;
        this.accessor = accessor;
    }

    public String getColumnName() {
        return columnName;
    }

    public boolean isGrantedIn(PermissionBundle bundle) {
        return bundle != null && accessor.test(bundle);
    }

    /**
     * Look up a flag by column name ({@code can_see_revenue}) or constant name
     * ({@code CAN_SEE_REVENUE}).
     */
    public static Optional<PermissionFlag> fromName(@Nullable String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (PermissionFlag flag : values()) {
            if (flag.columnName.equals(normalized)) {
                return Optional.of(flag);
            }
        }
        return Optional.empty();
    }
}
