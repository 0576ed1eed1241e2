package com.coachvault.vaultbackend.fee;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Single source of truth for the platform/seller split. Used at checkout and
 * for any later report so quoted and paid amounts never drift apart.
 */
@Component
public class FeeCalculator {

    private final BigDecimal platformRate;

    public FeeCalculator(@Value("${app.fees.platform-rate}") BigDecimal platformRate) {
        if (platformRate == null || !isValidRate(platformRate)) {
            throw new IllegalStateException("app.fees.platform-rate must be between 0 and 1, got " + platformRate);
        }
        this.platformRate = platformRate;
    }

    public BigDecimal getPlatformRate() {
        return platformRate;
    }

    public FeeSplit split(long grossCents) {
        long fee = platformFee(grossCents, platformRate);
        return new FeeSplit(grossCents, fee, grossCents - fee);
    }

    public long platformFee(long grossCents) {
        return platformFee(grossCents, platformRate);
    }

    public long sellerEarnings(long grossCents) {
        return sellerEarnings(grossCents, platformRate);
    }

    /**
     * {@code round(grossCents * rate)}, halves rounded away from zero.
     */
    public static long platformFee(long grossCents, BigDecimal rate) {
        requireValid(grossCents, rate);
        return BigDecimal.valueOf(grossCents)
                .multiply(rate)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    public static long sellerEarnings(long grossCents, BigDecimal rate) {
        return grossCents - platformFee(grossCents, rate);
    }

    private static void requireValid(long grossCents, BigDecimal rate) {
        if (grossCents < 0) throw new IllegalArgumentException("grossCents must be non-negative");
        if (rate == null || !isValidRate(rate)) throw new IllegalArgumentException("rate must be between 0 and 1");
    }

    private static boolean isValidRate(BigDecimal rate) {
        return rate.signum() >= 0 && rate.compareTo(BigDecimal.ONE) <= 0;
    }
}
