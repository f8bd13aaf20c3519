package net.gpumeter.core.service;

import net.gpumeter.core.model.Money;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * 과금 파라미터. 요율/틱은 제출 시점에 잡 레코드로 복사된다.
 *
 * @param ratePerMinute       분당 요율
 * @param tickSeconds         과금 틱 T
 * @param reservationTicks    제출 시 예약할 틱 수
 * @param minimumStartBalance 제출 허용 최소 가용 잔액
 * @param heartbeatGrace      T + grace 동안 하트비트가 없으면 실패 처리
 * @param killAckTimeoutTicks kill ack 대기 = killAckTimeoutTicks * T
 * @param preparingTimeout    PREPARING 체류 한도
 */
public record BillingPolicy(
        BigDecimal ratePerMinute,
        int tickSeconds,
        int reservationTicks,
        BigDecimal minimumStartBalance,
        Duration heartbeatGrace,
        int killAckTimeoutTicks,
        Duration preparingTimeout
) {
    public BillingPolicy {
        if (ratePerMinute == null || ratePerMinute.signum() <= 0) throw new IllegalArgumentException("ratePerMinute must be positive");
        if (tickSeconds <= 0) throw new IllegalArgumentException("tickSeconds must be positive");
        // 반올림 후 0이 되는 틱 비용은 예약/차감 불가
        if (Money.tickCost(ratePerMinute, tickSeconds).signum() <= 0) {
            throw new IllegalArgumentException("tick cost rounds to zero: rate " + ratePerMinute + "/min, tick " + tickSeconds + "s");
        }
        if (reservationTicks < 1) throw new IllegalArgumentException("reservationTicks must be >= 1");
        if (killAckTimeoutTicks < 1) throw new IllegalArgumentException("killAckTimeoutTicks must be >= 1");
        minimumStartBalance = Money.normalize(minimumStartBalance);
    }

    public static BillingPolicy defaults() {
        return new BillingPolicy(Money.of("1.00"), 60, 2, Money.of("10.00"),
                Duration.ofSeconds(30), 3, Duration.ofMinutes(15));
    }

    public BigDecimal tickCost() {
        return Money.tickCost(ratePerMinute, tickSeconds);
    }

    public BigDecimal reservationAmount() {
        return tickCost().multiply(BigDecimal.valueOf(reservationTicks));
    }

    public Duration killAckTimeout(int jobTickSeconds) {
        return Duration.ofSeconds((long) jobTickSeconds * killAckTimeoutTicks);
    }
}
