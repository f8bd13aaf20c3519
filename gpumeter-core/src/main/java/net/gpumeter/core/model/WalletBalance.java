package net.gpumeter.core.model;

import java.math.BigDecimal;

public record WalletBalance(String userId, BigDecimal balance, BigDecimal reserved, BigDecimal available) {
    public static WalletBalance empty(String userId) {
        return new WalletBalance(userId, Money.ZERO, Money.ZERO, Money.ZERO);
    }
}
