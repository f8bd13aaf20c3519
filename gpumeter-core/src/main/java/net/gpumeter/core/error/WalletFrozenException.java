package net.gpumeter.core.error;

public class WalletFrozenException extends LedgerCorruptionException {
    public WalletFrozenException(String userId) {
        super(userId, "wallet of user " + userId + " is frozen pending reconciliation");
    }
}
