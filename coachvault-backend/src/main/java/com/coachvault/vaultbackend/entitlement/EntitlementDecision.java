package com.coachvault.vaultbackend.entitlement;

/**
 * Result of one entitlement check. {@link Outcome#STORAGE_ERROR} keeps a failed
 * read apart from a confirmed denial; both are reported as "not allowed".
 */
public record EntitlementDecision(Outcome outcome, String reason) {

    public enum Outcome {
        ALLOW,
        DENY,
        STORAGE_ERROR
    }

    public static final String ACTIVE_MEMBER = "active_member";
    public static final String MEMBERSHIP_INACTIVE = "membership_inactive";
    public static final String MEMBERSHIP_EXPIRED = "membership_expired";
    public static final String NO_PROFILE = "no_profile";
    public static final String CREATOR_ENABLED = "creator_enabled";
    public static final String CREATOR_DISABLED = "creator_disabled";
    public static final String OWNER = "owner";
    public static final String PURCHASE = "purchase";
    public static final String NO_PURCHASE = "no_purchase";
    public static final String STORAGE_FAILURE = "storage_error";

    public static EntitlementDecision allow(String reason) {
        return new EntitlementDecision(Outcome.ALLOW, reason);
    }

    public static EntitlementDecision deny(String reason) {
        return new EntitlementDecision(Outcome.DENY, reason);
    }

    public static EntitlementDecision storageError() {
        return new EntitlementDecision(Outcome.STORAGE_ERROR, STORAGE_FAILURE);
    }

    public boolean allowed() {
        return outcome == Outcome.ALLOW;
    }
}
