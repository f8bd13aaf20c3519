package net.gpumeter.core.model;

import java.time.Instant;

/** at-least-once kill 채널. ack 또는 ack_deadline 경과로 종결 */
public record KillCommand(
        Long id,
        String jobId,
        KillReason reason,
        Status status,
        Instant issuedAt,
        Instant ackDeadline,
        Instant ackedAt,
        int attempts
) {
    public enum Status {
        PENDING, ACKED, TIMED_OUT, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }
}
