package net.gpumeter.core.model;

import java.time.Instant;

public record RelayEvent(
        Type type,
        String jobId,
        String line,            // LOG
        JobStatus status,       // STATUS
        String exitReason,      // STATUS
        Instant at
) {
    public enum Type { LOG, STATUS }

    public static RelayEvent log(String jobId, String line, Instant at) {
        return new RelayEvent(Type.LOG, jobId, line, null, null, at);
    }

    public static RelayEvent status(String jobId, JobStatus status, String exitReason, Instant at) {
        return new RelayEvent(Type.STATUS, jobId, null, status, exitReason, at);
    }

    public boolean isTerminalStatus() {
        return type == Type.STATUS && status != null && status.isTerminal();
    }
}
