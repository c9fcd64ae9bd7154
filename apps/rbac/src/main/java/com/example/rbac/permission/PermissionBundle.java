package com.example.rbac.permission;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Fixed-shape set of capability flags attached to a user profile.
 *
 * <p>Every flag is a primitive boolean, so a bundle is always complete. Builder
 * flags that are not set default to {@code false}.
 */
@Builder(toBuilder = true)
public record PermissionBundle(
        @JsonProperty("can_see_revenue") boolean canSeeRevenue,
        @JsonProperty("can_see_profit") boolean canSeeProfit,
        @JsonProperty("can_approve_pjo") boolean canApprovePjo,
        @JsonProperty("can_manage_invoices") boolean canManageInvoices,
        @JsonProperty("can_manage_users") boolean canManageUsers,
        @JsonProperty("can_create_pjo") boolean canCreatePjo,
        @JsonProperty("can_fill_costs") boolean canFillCosts,
        @JsonProperty("can_check_pjo") boolean canCheckPjo,
        @JsonProperty("can_check_jo") boolean canCheckJo,
        @JsonProperty("can_check_bkk") boolean canCheckBkk,
        @JsonProperty("can_approve_jo") boolean canApproveJo,
        @JsonProperty("can_approve_bkk") boolean canApproveBkk,
        @JsonProperty("can_estimate_costs") boolean canEstimateCosts,
        @JsonProperty("can_see_actual_costs") boolean canSeeActualCosts
) {
    private static final PermissionBundle NONE = PermissionBundle.builder().build();

    /**
     * The most restrictive bundle: every flag false.
     */
    public static PermissionBundle none() {
        return NONE;
    }

    /**
     * Bundle with exactly the given flags granted.
     */
    public static PermissionBundle of(PermissionFlag... granted) {
        PermissionBundle bundle = NONE;
        for (PermissionFlag flag : granted) {
            bundle = bundle.with(flag, true);
        }
        return bundle;
    }

    /**
     * Bundle with every flag granted.
     */
    public static PermissionBundle all() {
        return of(PermissionFlag.values());
    }

    public boolean has(PermissionFlag flag) {
        return flag.isGrantedIn(this);
    }

    public PermissionBundle with(PermissionFlag flag, boolean granted) {
        PermissionBundleBuilder builder = toBuilder();
        switch (flag) {
            case CAN_SEE_REVENUE -> builder.canSeeRevenue(granted);
            case CAN_SEE_PROFIT -> builder.canSeeProfit(granted);
            case CAN_APPROVE_PJO -> builder.canApprovePjo(granted);
            case CAN_MANAGE_INVOICES -> builder.canManageInvoices(granted);
            case CAN_MANAGE_USERS -> builder.canManageUsers(granted);
            case CAN_CREATE_PJO -> builder.canCreatePjo(granted);
            case CAN_FILL_COSTS -> builder.canFillCosts(granted);
            case CAN_CHECK_PJO -> builder.canCheckPjo(granted);
            case CAN_CHECK_JO -> builder.canCheckJo(granted);
            case CAN_CHECK_BKK -> builder.canCheckBkk(granted);
            case CAN_APPROVE_JO -> builder.canApproveJo(granted);
            case CAN_APPROVE_BKK -> builder.canApproveBkk(granted);
            case CAN_ESTIMATE_COSTS -> builder.canEstimateCosts(granted);
            case CAN_SEE_ACTUAL_COSTS -> builder.canSeeActualCosts(granted);
        }
        return builder.build();
    }
}
