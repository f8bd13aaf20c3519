package net.gpumeter.core.model;

import java.time.Instant;

public record DispatchMessage(
        Long id,
        String jobId,
        Status status,
        int attempt,
        Instant availableAt,
        Instant leaseUntil,
        String workerToken,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {
    public enum Status {
        READY, CLAIMED, DONE, CANCELLED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }
}
