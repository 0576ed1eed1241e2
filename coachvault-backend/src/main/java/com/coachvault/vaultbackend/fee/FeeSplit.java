package com.coachvault.vaultbackend.fee;

/**
 * Platform fee and seller earnings for one gross amount, all in cents.
 * The two parts always add up to the gross.
 */
public record FeeSplit(long grossCents, long platformFeeCents, long sellerEarningsCents) {
}
