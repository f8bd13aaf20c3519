package net.gpumeter.core.service;

import net.gpumeter.core.model.JobStatus;
import net.gpumeter.core.relay.LogEventRelay;

/** 트랜잭션 커밋 뒤 릴레이로 내보낼 상태 변경 */
record StatusChange(String jobId, JobStatus status, String exitReason) {
    void publishTo(LogEventRelay relay) {
        relay.publishStatus(jobId, status, exitReason);
    }
}
