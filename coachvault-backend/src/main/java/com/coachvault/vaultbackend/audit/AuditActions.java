package com.coachvault.vaultbackend.audit;

/**
 * Normalized action and subject names written to {@code audit_events}.
 */
public final class AuditActions {

    public static final String DOWNLOAD_ALLOW = "download.allow";
    public static final String DOWNLOAD_DENY = "download.deny";
    public static final String DOWNLOAD_REDEEM = "download.redeem";
    public static final String TOKEN_ISSUE = "token.issue";
    public static final String TOKEN_REJECT = "token.reject";
    public static final String FEE_COMPUTE = "fee.compute";

    public static final String SUBJECT_RESOURCE = "resource";

    private AuditActions() {
    }
}
