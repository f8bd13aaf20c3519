package net.gpumeter.core.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Reservation(
        Long id,
        String userId,
        String jobId,
        BigDecimal amount,      // 최초 예약액
        BigDecimal remaining,   // 아직 소진되지 않은 예약액
        Status status,
        Instant createdAt,
        Instant releasedAt
) {
    public enum Status {
        ACTIVE, RELEASED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    public ReservationToken token() {
        return new ReservationToken(id, userId, jobId, amount);
    }
}
