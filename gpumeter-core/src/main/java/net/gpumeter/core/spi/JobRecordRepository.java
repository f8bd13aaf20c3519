package net.gpumeter.core.spi;

import net.gpumeter.core.model.JobRecord;
import net.gpumeter.core.model.JobStatus;
import net.gpumeter.core.model.JobTransition;
import net.gpumeter.core.model.KillReason;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobRecordRepository {
    void insert(JobRecord job) throws Exception;

    Optional<JobRecord> findById(String jobId) throws Exception;

    /** SELECT ... FOR UPDATE. 잠금 순서: job → wallet */
    Optional<JobRecord> lockById(String jobId) throws Exception;

    /** status == null이면 전체, created_at 최신순 */
    List<JobRecord> findByOwner(String ownerId, JobStatus status, int limit, int offset) throws Exception;

    int countActiveByOwner(String ownerId) throws Exception;

    /** cancel/exhaustion 순서 판정용 단조 증가 시퀀스 */
    long nextEventSeq() throws Exception;

    /**
     * status == from 일 때만 적용 (CAS).
     * PREPARING이면 accepted_at, RUNNING이면 started_at/sandbox_id, 터미널이면 ended_at/exit_reason/exit_code 세팅.
     */
    boolean transition(JobTransition t) throws Exception;

    /** 틱 과금 반영: ticks_billed=tickSeq, total_cost, runtime_seconds, last_heartbeat_at */
    void recordTick(String jobId, long tickSeq, BigDecimal totalCost, long runtimeSeconds, Instant at) throws Exception;

    /** cancel_seq가 비어 있을 때만 기록 */
    void recordCancelRequest(String jobId, long seq) throws Exception;

    /** exhausted_seq가 비어 있을 때만 기록 */
    void recordExhaustion(String jobId, long seq) throws Exception;

    /** kill_reason이 비어 있을 때만 기록 */
    void recordKillReason(String jobId, KillReason reason) throws Exception;

    /** RUNNING 중 coalesce(last_heartbeat_at, started_at) < threshold */
    List<JobRecord> findRunningSilentSince(Instant threshold, int limit) throws Exception;

    /** PREPARING 중 accepted_at < threshold */
    List<JobRecord> findPreparingSince(Instant threshold, int limit) throws Exception;
}
