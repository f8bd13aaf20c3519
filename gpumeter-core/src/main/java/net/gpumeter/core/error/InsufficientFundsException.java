package net.gpumeter.core.error;

import java.math.BigDecimal;

public class InsufficientFundsException extends GpuMeterException {
    private final String userId;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientFundsException(String userId, BigDecimal required, BigDecimal available) {
        super("insufficient funds for user " + userId + ": required=" + required + ", available=" + available);
        this.userId = userId;
        this.required = required;
        this.available = available;
    }

    public String getUserId() {
        return userId;
    }

    public BigDecimal getRequired() {
        return required;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getShortfall() {
        return required.subtract(available).max(BigDecimal.ZERO);
    }
}
