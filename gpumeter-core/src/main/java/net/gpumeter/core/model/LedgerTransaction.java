package net.gpumeter.core.model;

import java.math.BigDecimal;
import java.time.Instant;

/** 불변 원장 레코드. amount는 항상 양수, 잔액 영향은 type으로 결정 */
public record LedgerTransaction(
        Long id,
        String userId,
        String jobId,           // credit이면 null
        Type type,
        BigDecimal amount,
        BigDecimal balanceAfter,
        BigDecimal reservedAfter,
        Long tickSeq,           // debit 전용
        String externalRef,     // credit/refund 참조
        String description,
        Instant createdAt
) {
    public enum Type {
        CREDIT, DEBIT, RESERVATION, RELEASE, REFUND, UNKNOWN;

        public static Type from(String s) {
            if (s == null) return UNKNOWN;
            try { return Type.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name().toLowerCase(); }
    }

    public static LedgerTransaction ofNew(String userId, String jobId, Type type, BigDecimal amount,
                                          BigDecimal balanceAfter, BigDecimal reservedAfter,
                                          Long tickSeq, String externalRef, String description, Instant at) {
        return new LedgerTransaction(null, userId, jobId, type, amount, balanceAfter, reservedAfter,
                tickSeq, externalRef, description, at);
    }

    public BigDecimal balanceEffect() {
        return switch (type) {
            case CREDIT, REFUND -> amount;
            case DEBIT -> amount.negate();
            case RESERVATION, RELEASE, UNKNOWN -> BigDecimal.ZERO;
        };
    }

    public LedgerTransaction withId(long newId) {
        return new LedgerTransaction(newId, userId, jobId, type, amount, balanceAfter, reservedAfter,
                tickSeq, externalRef, description, createdAt);
    }
}
