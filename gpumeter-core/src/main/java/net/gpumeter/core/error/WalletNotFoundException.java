package net.gpumeter.core.error;

public class WalletNotFoundException extends GpuMeterException {
    public WalletNotFoundException(String userId) {
        super("wallet not found for user " + userId);
    }
}
