package net.gpumeter.core.model;

import java.time.Instant;

/** 상태 CAS 전이 요청 (from 일치 시에만 적용) */
public record JobTransition(
        String jobId,
        JobStatus from,
        JobStatus to,
        Instant at,
        String exitReason,
        Integer exitCode,
        String sandboxId
) {
    public JobTransition {
        from.checkTransition(to);
    }

    public static JobTransition of(String jobId, JobStatus from, JobStatus to, Instant at) {
        return new JobTransition(jobId, from, to, at, null, null, null);
    }

    public static JobTransition running(String jobId, String sandboxId, Instant at) {
        return new JobTransition(jobId, JobStatus.PREPARING, JobStatus.RUNNING, at, null, null, sandboxId);
    }

    public static JobTransition terminal(String jobId, JobStatus from, JobStatus to, Instant at,
                                         String exitReason, Integer exitCode) {
        if (!to.isTerminal()) throw new IllegalArgumentException("not a terminal status: " + to);
        return new JobTransition(jobId, from, to, at, exitReason, exitCode, null);
    }
}
