package net.gpumeter.core.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Wallet(
        String userId,
        BigDecimal balance,
        BigDecimal reserved,
        boolean frozen,
        long version,
        Instant createdAt,
        Instant updatedAt
) {
    public BigDecimal available() {
        return balance.subtract(reserved);
    }

    public WalletBalance toBalance() {
        return new WalletBalance(userId, balance, reserved, available());
    }
}
