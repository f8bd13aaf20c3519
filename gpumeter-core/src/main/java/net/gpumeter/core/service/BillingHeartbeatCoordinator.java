package net.gpumeter.core.service;

import net.gpumeter.core.error.LedgerCorruptionException;
import net.gpumeter.core.ledger.WalletLedgerService;
import net.gpumeter.core.model.DebitOutcome;
import net.gpumeter.core.model.ExitReasons;
import net.gpumeter.core.model.Heartbeat;
import net.gpumeter.core.model.HeartbeatVerdict;
import net.gpumeter.core.model.JobRecord;
import net.gpumeter.core.model.JobStatus;
import net.gpumeter.core.model.KillCommand;
import net.gpumeter.core.model.KillReason;
import net.gpumeter.core.relay.LogEventRelay;
import net.gpumeter.core.spi.Clock;
import net.gpumeter.core.spi.JobRecordRepository;
import net.gpumeter.core.spi.KillCommandRepository;
import net.gpumeter.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 과금 하트비트 처리 (컨트롤러 측 계량 시계).
 * 틱 하나 = 원장 debit 하나 + 잡 레코드 갱신 하나, 같은 트랜잭션에서 잡 행 잠금 아래 적용.
 */
public final class BillingHeartbeatCoordinator {
    private static final Logger log = LoggerFactory.getLogger(BillingHeartbeatCoordinator.class);

    private final JobRecordRepository jobs;
    private final KillCommandRepository commands;
    private final WalletLedgerService ledger;
    private final KillSwitch kills;
    private final LogEventRelay relay;
    private final BillingPolicy policy;
    private final TxRunner tx;
    private final Clock clock;
    private final JobFinalizer finalizer;

    private static final int SWEEP_BATCH = 100;

    public BillingHeartbeatCoordinator(JobRecordRepository jobs,
                                       KillCommandRepository commands,
                                       WalletLedgerService ledger,
                                       KillSwitch kills,
                                       LogEventRelay relay,
                                       BillingPolicy policy,
                                       TxRunner tx,
                                       Clock clock) {
        this.jobs = jobs;
        this.commands = commands;
        this.ledger = ledger;
        this.kills = kills;
        this.relay = relay;
        this.policy = policy;
        this.tx = tx;
        this.clock = clock;
        this.finalizer = new JobFinalizer(jobs, ledger, clock);
    }

    public HeartbeatVerdict onHeartbeat(Heartbeat hb) throws Exception {
        if (hb.tickSeq() < 1) return HeartbeatVerdict.REJECTED;

        Decision d = tx.required(() -> decide(hb));
        d.change().ifPresent(c -> c.publishTo(relay));
        return d.verdict();
    }

    private Decision decide(Heartbeat hb) throws Exception {
        Optional<JobRecord> opt = jobs.lockById(hb.jobId());
        if (opt.isEmpty()) {
            log.warn("heartbeat for unknown job {}", hb.jobId());
            return Decision.of(HeartbeatVerdict.REJECTED);
        }
        JobRecord job = opt.get();
        if (job.isTerminal()) {
            log.debug("dropping heartbeat tick={} for terminal job {} ({})", hb.tickSeq(), job.id(), job.status().code());
            return Decision.of(HeartbeatVerdict.STOP);
        }
        if (job.status() != JobStatus.RUNNING) {
            log.warn("heartbeat for job {} in status {}", job.id(), job.status().code());
            return Decision.of(HeartbeatVerdict.REJECTED);
        }
        if (hb.tickSeq() <= job.ticksBilled()) {
            log.debug("duplicate heartbeat job={} tick={} billed={}", job.id(), hb.tickSeq(), job.ticksBilled());
            return Decision.of(HeartbeatVerdict.DUPLICATE);
        }
        if (hb.tickSeq() != job.ticksBilled() + 1) {
            log.warn("out-of-order heartbeat job={} tick={} expected={}", job.id(), hb.tickSeq(), job.ticksBilled() + 1);
            return Decision.of(HeartbeatVerdict.REJECTED);
        }
        if (job.exhaustedSeq() != null) {
            return Decision.of(HeartbeatVerdict.STOP);
        }
        if (!hb.sandboxAlive()) {
            log.debug("heartbeat tick={} reports sandbox of job {} not alive", hb.tickSeq(), job.id());
        }

        DebitOutcome debit;
        try {
            debit = ledger.debit(job.ownerId(), job.tickCost(), job.id(), hb.tickSeq());
        } catch (LedgerCorruptionException e) {
            log.error("billing halted for job {}: {}", job.id(), e.getMessage());
            return new Decision(HeartbeatVerdict.STOP,
                    finalizer.finish(job, JobStatus.FAILED, ExitReasons.BILLING_HALTED, null));
        }

        return switch (debit.status()) {
            case INSUFFICIENT_FUNDS -> onExhausted(job);
            case DUPLICATE -> {
                // 원장에는 있으나 잡 레코드가 뒤처진 경우: 레코드만 맞춘다
                log.warn("ledger already holds tick {} of job {}; realigning job record", hb.tickSeq(), job.id());
                recordTick(job, hb.tickSeq());
                yield Decision.of(HeartbeatVerdict.DUPLICATE);
            }
            case APPLIED -> onCharged(job, hb.tickSeq());
        };
    }

    private Decision onCharged(JobRecord job, long tickSeq) throws Exception {
        long runtime = recordTick(job, tickSeq);
        if (job.killReason() != null) {
            return Decision.of(HeartbeatVerdict.STOP);
        }
        if (runtime >= job.resources().timeoutSeconds()) {
            jobs.recordKillReason(job.id(), KillReason.TIMEOUT);
            kills.issue(job, KillReason.TIMEOUT);
            log.info("job {} reached its timeout of {}s", job.id(), job.resources().timeoutSeconds());
            return Decision.of(HeartbeatVerdict.STOP);
        }
        return Decision.of(HeartbeatVerdict.CONTINUE);
    }

    private Decision onExhausted(JobRecord job) throws Exception {
        long seq = jobs.nextEventSeq();
        jobs.recordExhaustion(job.id(), seq);
        if (job.cancelSeq() != null && job.cancelSeq() < seq) {
            log.info("job {} exhausted funds after a cancel request; cancellation wins", job.id());
            return Decision.of(HeartbeatVerdict.STOP);
        }
        jobs.recordKillReason(job.id(), KillReason.INSUFFICIENT_CREDITS);
        Optional<StatusChange> change = finalizer.finish(job, JobStatus.KILLED_NO_CREDITS, ExitReasons.INSUFFICIENT_CREDITS, null);
        kills.issue(job, KillReason.INSUFFICIENT_CREDITS);
        return new Decision(HeartbeatVerdict.STOP, change);
    }

    private long recordTick(JobRecord job, long tickSeq) throws Exception {
        BigDecimal total = job.tickCost().multiply(BigDecimal.valueOf(tickSeq));
        long runtime = tickSeq * job.tickSeconds();
        jobs.recordTick(job.id(), tickSeq, total, runtime, clock.now());
        return runtime;
    }

    /**
     * RUNNING인데 T + grace 동안 하트비트가 없는 잡 → FAILED(heartbeat_timeout) + best-effort kill.
     * 취소 요청이 있던 잡은 CANCELLED
     */
    public int sweepMissedHeartbeats() throws Exception {
        Instant now = clock.now();
        List<JobRecord> candidates = tx.required(() -> jobs.findRunningSilentSince(now.minus(policy.heartbeatGrace()), SWEEP_BATCH));
        int failed = 0;
        for (JobRecord c : candidates) {
            Optional<StatusChange> change = tx.required(() -> {
                JobRecord job = jobs.lockById(c.id()).orElse(null);
                if (job == null || job.status() != JobStatus.RUNNING || !silentTooLong(job, now)) return Optional.<StatusChange>empty();
                log.warn("job {} missed heartbeats since {}", job.id(), lastSeen(job));
                // 취소가 먼저 기록됐으면 워커가 사라져도 취소로 끝낸다 (kill 명령은 이미 있음)
                if (job.cancelRequested()) return finalizer.resolveKill(job, null);
                jobs.recordKillReason(job.id(), KillReason.HEARTBEAT_TIMEOUT);
                Optional<StatusChange> ch = finalizer.finish(job, JobStatus.FAILED, ExitReasons.HEARTBEAT_TIMEOUT, null);
                kills.issue(job, KillReason.HEARTBEAT_TIMEOUT);
                return ch;
            });
            if (change.isPresent()) {
                change.get().publishTo(relay);
                failed++;
            }
        }
        return failed;
    }

    /** 워커가 준비 중 사라진 경우: PREPARING이 preparingTimeout을 넘으면 FAILED */
    public int sweepStalePreparing() throws Exception {
        Instant threshold = clock.now().minus(policy.preparingTimeout());
        List<JobRecord> candidates = tx.required(() -> jobs.findPreparingSince(threshold, SWEEP_BATCH));
        int failed = 0;
        for (JobRecord c : candidates) {
            Optional<StatusChange> change = tx.required(() -> {
                JobRecord job = jobs.lockById(c.id()).orElse(null);
                if (job == null || job.status() != JobStatus.PREPARING) return Optional.<StatusChange>empty();
                if (job.cancelRequested()) return finalizer.resolveKill(job, null);
                return finalizer.finish(job, JobStatus.FAILED, ExitReasons.PREPARING_TIMEOUT, null);
            });
            if (change.isPresent()) {
                change.get().publishTo(relay);
                failed++;
            }
        }
        return failed;
    }

    /** ack 기한이 지난 kill → 잡을 무조건 터미널로 (이미 터미널이면 명령만 TIMED_OUT) */
    public int sweepKillAckTimeouts() throws Exception {
        Instant now = clock.now();
        List<KillCommand> expired = tx.required(() -> commands.findExpired(now, SWEEP_BATCH));
        int resolved = 0;
        for (KillCommand cmd : expired) {
            Optional<StatusChange> change = tx.required(() -> {
                JobRecord job = jobs.lockById(cmd.jobId()).orElse(null);
                var current = commands.findById(cmd.id());
                if (current.isEmpty() || current.get().status() != KillCommand.Status.PENDING) return Optional.<StatusChange>empty();
                commands.markTimedOut(cmd.id(), now);
                if (job == null || job.isTerminal()) return Optional.<StatusChange>empty();
                log.warn("kill {} for job {} ({}) not acknowledged by {}; resolving without worker",
                        cmd.id(), job.id(), cmd.reason().code(), cmd.ackDeadline());
                return finalizer.resolveKill(job, null);
            });
            resolved++;
            change.ifPresent(c -> c.publishTo(relay));
        }
        return resolved;
    }

    private boolean silentTooLong(JobRecord job, Instant now) {
        Instant last = lastSeen(job);
        return last != null && last.plusSeconds(job.tickSeconds()).plus(policy.heartbeatGrace()).isBefore(now);
    }

    private static Instant lastSeen(JobRecord job) {
        return job.lastHeartbeatAt() != null ? job.lastHeartbeatAt() : job.startedAt();
    }

    private record Decision(HeartbeatVerdict verdict, Optional<StatusChange> change) {
        static Decision of(HeartbeatVerdict v) {
            return new Decision(v, Optional.empty());
        }
    }
}
