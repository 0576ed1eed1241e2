package com.coachvault.vaultbackend.profile;

public enum MembershipStatus {
    ACTIVE,
    INACTIVE,
    CANCELED,
    PAST_DUE,
    NONE
}
