package com.coachvault.vaultbackend.purchase;

public enum PurchaseStatus {
    PENDING,
    SUCCEEDED,
    FAILED,
    REFUNDED
}
