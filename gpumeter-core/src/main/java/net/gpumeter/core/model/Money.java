package net.gpumeter.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** 지갑 금액 규칙: scale 2 고정소수점, float 금지 */
public final class Money {
    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {}

    public static BigDecimal of(String amount) {
        return normalize(new BigDecimal(amount));
    }

    public static BigDecimal normalize(BigDecimal amount) {
        return amount == null ? ZERO : amount.setScale(SCALE, RoundingMode.HALF_EVEN);
    }

    /** 양수 + 소수 둘째 자리까지만 허용 */
    public static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive: " + amount);
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new IllegalArgumentException("amount has more than " + SCALE + " decimals: " + amount);
        }
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /** 1틱 요금 = ratePerMinute * tickSeconds / 60 */
    public static BigDecimal tickCost(BigDecimal ratePerMinute, int tickSeconds) {
        return ratePerMinute.multiply(BigDecimal.valueOf(tickSeconds))
                .divide(BigDecimal.valueOf(60), SCALE, RoundingMode.HALF_EVEN);
    }
}
