package net.gpumeter.core.service;

import net.gpumeter.core.error.LedgerCorruptionException;
import net.gpumeter.core.ledger.WalletLedgerService;
import net.gpumeter.core.model.ExitReasons;
import net.gpumeter.core.model.JobRecord;
import net.gpumeter.core.model.JobStatus;
import net.gpumeter.core.model.JobTransition;
import net.gpumeter.core.spi.Clock;
import net.gpumeter.core.spi.JobRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/** 터미널 전이 + 예약 해제. 잡 행 잠금을 쥔 트랜잭션 안에서만 호출 */
final class JobFinalizer {
    private static final Logger log = LoggerFactory.getLogger(JobFinalizer.class);

    private final JobRecordRepository jobs;
    private final WalletLedgerService ledger;
    private final Clock clock;

    JobFinalizer(JobRecordRepository jobs, WalletLedgerService ledger, Clock clock) {
        this.jobs = jobs;
        this.ledger = ledger;
        this.clock = clock;
    }

    Optional<StatusChange> finish(JobRecord job, JobStatus to, String exitReason, Integer exitCode) throws Exception {
        boolean moved = jobs.transition(JobTransition.terminal(job.id(), job.status(), to, clock.now(), exitReason, exitCode));
        if (!moved) {
            log.warn("job {} left {} concurrently, {} not applied", job.id(), job.status(), to);
            return Optional.empty();
        }
        try {
            ledger.releaseForJob(job.id());
        } catch (LedgerCorruptionException e) {
            // 지갑 동결 상태: 예약은 수동 정산 대상으로 남김
            log.error("job {} finished as {} but its reservation could not be released: {}", job.id(), to, e.getMessage());
        }
        log.info("job {} {} -> {} ({})", job.id(), job.status().code(), to.code(), exitReason);
        return Optional.of(new StatusChange(job.id(), to, exitReason));
    }

    /**
     * 요청된 kill의 최종 상태 결정.
     * 취소가 소진보다 먼저 기록됐으면 CANCELLED, 그 외에는 kill 사유를 따른다.
     */
    Optional<StatusChange> resolveKill(JobRecord job, Integer exitCode) throws Exception {
        if (job.cancelRequested() && !job.exhaustionWins()) {
            return finish(job, JobStatus.CANCELLED, ExitReasons.CANCELLED_BY_USER, exitCode);
        }
        if (job.killReason() == null) {
            return finish(job, JobStatus.FAILED, ExitReasons.KILL_ACK_TIMEOUT, exitCode);
        }
        return switch (job.killReason()) {
            case INSUFFICIENT_CREDITS -> job.status() == JobStatus.RUNNING
                    ? finish(job, JobStatus.KILLED_NO_CREDITS, ExitReasons.INSUFFICIENT_CREDITS, exitCode)
                    : finish(job, JobStatus.FAILED, ExitReasons.INSUFFICIENT_CREDITS, exitCode);
            case TIMEOUT -> finish(job, JobStatus.FAILED, ExitReasons.TIMEOUT, exitCode);
            case HEARTBEAT_TIMEOUT -> finish(job, JobStatus.FAILED, ExitReasons.HEARTBEAT_TIMEOUT, exitCode);
            case CANCELLED -> finish(job, JobStatus.CANCELLED, ExitReasons.CANCELLED_BY_USER, exitCode);
            case UNKNOWN -> finish(job, JobStatus.FAILED, ExitReasons.KILL_ACK_TIMEOUT, exitCode);
        };
    }
}
