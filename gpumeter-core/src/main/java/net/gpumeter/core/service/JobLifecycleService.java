package net.gpumeter.core.service;

import net.gpumeter.core.dispatch.DispatchService;
import net.gpumeter.core.error.AlreadyTerminalException;
import net.gpumeter.core.error.InsufficientFundsException;
import net.gpumeter.core.error.JobNotFoundException;
import net.gpumeter.core.error.NotOwnerException;
import net.gpumeter.core.error.TooManyActiveJobsException;
import net.gpumeter.core.ledger.WalletLedgerService;
import net.gpumeter.core.model.CancelOutcome;
import net.gpumeter.core.model.ExitReasons;
import net.gpumeter.core.model.JobRecord;
import net.gpumeter.core.model.JobSpec;
import net.gpumeter.core.model.JobStatus;
import net.gpumeter.core.model.JobTransition;
import net.gpumeter.core.model.KillCommand;
import net.gpumeter.core.model.KillReason;
import net.gpumeter.core.model.RelayEvent;
import net.gpumeter.core.model.ResourceConfig;
import net.gpumeter.core.model.SubmitJobRequest;
import net.gpumeter.core.model.WalletBalance;
import net.gpumeter.core.relay.LogEventRelay;
import net.gpumeter.core.spi.BlobStore;
import net.gpumeter.core.spi.Clock;
import net.gpumeter.core.spi.JobRecordRepository;
import net.gpumeter.core.spi.KillCommandRepository;
import net.gpumeter.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 잡 생명주기: 제출/취소/조회 (사용자 API) + accept/running/exit/kill ack (워커 콜백).
 * 모든 상태 변경은 커밋 후 릴레이에 상태 이벤트로 발행된다.
 */
public final class JobLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(JobLifecycleService.class);

    public static final int MAX_LIST_LIMIT = 200;

    private final JobRecordRepository jobs;
    private final KillCommandRepository commands;
    private final WalletLedgerService ledger;
    private final DispatchService dispatch;
    private final KillSwitch kills;
    private final BlobStore blobs;
    private final LogEventRelay relay;
    private final BillingPolicy billing;
    private final SubmissionPolicy limits;
    private final Retrier retrier;
    private final TxRunner tx;
    private final Clock clock;
    private final JobFinalizer finalizer;

    public JobLifecycleService(JobRecordRepository jobs,
                               KillCommandRepository commands,
                               WalletLedgerService ledger,
                               DispatchService dispatch,
                               KillSwitch kills,
                               BlobStore blobs,
                               LogEventRelay relay,
                               BillingPolicy billing,
                               SubmissionPolicy limits,
                               Retrier retrier,
                               TxRunner tx,
                               Clock clock) {
        this.jobs = jobs;
        this.commands = commands;
        this.ledger = ledger;
        this.dispatch = dispatch;
        this.kills = kills;
        this.blobs = blobs;
        this.relay = relay;
        this.billing = billing;
        this.limits = limits;
        this.retrier = retrier;
        this.tx = tx;
        this.clock = clock;
        this.finalizer = new JobFinalizer(jobs, ledger, clock);
    }

    // ---------------------------------------------------------------- 사용자 API

    /**
     * 제출: 검증 → 지갑 오픈 → 최소 잔액 → (예약 + 동시 잡 한도 + PENDING 생성) → 입력 업로드 → 큐 적재.
     * 예약이 실패하면 아무것도 남지 않는다. 업로드/적재가 재시도 끝에 실패하면 잡은 FAILED로 남는다.
     */
    public String submit(SubmitJobRequest req) throws Exception {
        validate(req);
        String owner = req.ownerId();
        ledger.openWallet(owner);

        WalletBalance b = ledger.balance(owner);
        if (b.available().compareTo(billing.minimumStartBalance()) < 0) {
            throw new InsufficientFundsException(owner, billing.minimumStartBalance(), b.available());
        }

        String jobId = UUID.randomUUID().toString();
        BigDecimal reservation = billing.reservationAmount();
        tx.required(() -> {
            ledger.reserve(owner, reservation, jobId); // 지갑 행 잠금: 같은 사용자의 제출은 여기서 직렬화
            int active = jobs.countActiveByOwner(owner);
            if (active >= limits.maxActiveJobsPerUser()) {
                throw new TooManyActiveJobsException(owner, active, limits.maxActiveJobsPerUser());
            }
            jobs.insert(JobRecord.pending(jobId, owner, req.dockerImage(), req.scriptName(), req.resources(),
                    billing.ratePerMinute(), billing.tickSeconds(), clock.now()));
            return null;
        });
        log.info("job {} submitted by {} (image={}, reserved={})", jobId, owner, req.dockerImage(), reservation);
        relay.publishStatus(jobId, JobStatus.PENDING, null);

        try {
            for (Map.Entry<String, byte[]> in : req.inputs().entrySet()) {
                retrier.call("upload " + in.getKey() + " of job " + jobId,
                        () -> { blobs.write(jobId, "input/" + in.getKey(), in.getValue()); return null; });
            }
        } catch (Exception e) {
            log.error("input upload for job {} failed: {}", jobId, e.toString());
            failBeforeDispatch(jobId, ExitReasons.INPUT_UPLOAD_FAILED);
            return jobId;
        }

        try {
            retrier.call("enqueue job " + jobId, () -> dispatch.enqueue(jobId));
        } catch (Exception e) {
            log.error("dispatch of job {} failed: {}", jobId, e.toString());
            failBeforeDispatch(jobId, ExitReasons.DISPATCH_FAILED);
        }
        return jobId;
    }

    /**
     * 취소 요청. PENDING은 즉시 CANCELLED, PREPARING/RUNNING은 cancel_seq 기록 + kill 명령 (ack 시 CANCELLED).
     * 이미 요청된 취소의 반복은 변경 없이 ACCEPTED.
     */
    public CancelOutcome cancel(String jobId, String requesterId) throws Exception {
        Cancel c = tx.required(() -> {
            JobRecord job = jobs.lockById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (!job.ownerId().equals(requesterId)) throw new NotOwnerException(jobId, requesterId);
            if (job.isTerminal()) throw new AlreadyTerminalException(jobId, job.status());
            if (job.cancelRequested()) return new Cancel(CancelOutcome.ACCEPTED, Optional.empty());

            long seq = jobs.nextEventSeq();
            jobs.recordCancelRequest(jobId, seq);
            if (job.status() == JobStatus.PENDING) {
                dispatch.withdraw(jobId);
                return new Cancel(CancelOutcome.CANCELLED,
                        finalizer.finish(job, JobStatus.CANCELLED, ExitReasons.CANCELLED_BY_USER, null));
            }
            jobs.recordKillReason(jobId, KillReason.CANCELLED);
            kills.issue(job, KillReason.CANCELLED);
            return new Cancel(CancelOutcome.ACCEPTED, Optional.empty());
        });
        c.change().ifPresent(ch -> ch.publishTo(relay));
        log.info("cancel of job {} by {}: {}", jobId, requesterId, c.outcome());
        return c.outcome();
    }

    public JobRecord get(String jobId) throws Exception {
        return tx.required(() -> jobs.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId)));
    }

    /** status == null이면 전체 */
    public List<JobRecord> list(String ownerId, JobStatus status, int limit, int offset) throws Exception {
        if (limit < 1 || limit > MAX_LIST_LIMIT) throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIST_LIMIT);
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
        return tx.required(() -> jobs.findByOwner(ownerId, status, limit, offset));
    }

    /** 잡 로그/상태 스트림. 터미널 잡은 남은 replay, 채널이 정리됐으면 최종 상태 하나 */
    public Flux<RelayEvent> subscribe(String jobId) throws Exception {
        JobRecord job = get(jobId);
        if (job.isTerminal()) {
            return relay.replayTerminated(jobId)
                    .switchIfEmpty(Flux.just(RelayEvent.status(jobId, job.status(), job.exitReason(), job.endedAt())));
        }
        return relay.subscribe(jobId);
    }

    // ---------------------------------------------------------------- 워커 콜백

    /** PENDING → PREPARING + 메시지 완료 (한 트랜잭션). PENDING이 아니면 메시지만 완료 */
    public Optional<JobSpec> accept(long messageId, String jobId) throws Exception {
        Optional<JobSpec> spec = tx.required(() -> {
            Optional<JobRecord> job = jobs.lockById(jobId);
            dispatch.complete(messageId);
            if (job.isEmpty() || job.get().status() != JobStatus.PENDING) {
                log.info("dispatch {} skipped: job {} is {}", messageId, jobId,
                        job.map(j -> j.status().code()).orElse("missing"));
                return Optional.<JobSpec>empty();
            }
            jobs.transition(JobTransition.of(jobId, JobStatus.PENDING, JobStatus.PREPARING, clock.now()));
            return Optional.of(job.get().toSpec());
        });
        spec.ifPresent(s -> relay.publishStatus(s.jobId(), JobStatus.PREPARING, null));
        return spec;
    }

    /** PREPARING → RUNNING. 그 사이 잡이 끝났으면 false (워커는 샌드박스를 내려야 함) */
    public boolean markRunning(String jobId, String sandboxId) throws Exception {
        boolean running = tx.required(() -> {
            JobRecord job = jobs.lockById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (job.status() != JobStatus.PREPARING) {
                log.warn("job {} is {} when its sandbox {} started", jobId, job.status().code(), sandboxId);
                return false;
            }
            return jobs.transition(JobTransition.running(jobId, sandboxId, clock.now()));
        });
        if (running) relay.publishStatus(jobId, JobStatus.RUNNING, null);
        return running;
    }

    /**
     * 프로세스 종료 보고. kill이 요청돼 있었으면 kill 사유로 정리하고 명령을 ack,
     * 아니면 워커 사유 / OOM / 종료 코드로 결정. 부분 틱은 과금하지 않는다.
     */
    public void onProcessExit(String jobId, int exitCode, boolean oomKilled, String workerReason) throws Exception {
        Optional<StatusChange> change = tx.required(() -> {
            JobRecord job = jobs.lockById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (job.isTerminal()) {
                log.debug("exit of job {} after it became {}", jobId, job.status().code());
                ackPending(jobId);
                return Optional.<StatusChange>empty();
            }
            if (job.killReason() != null || job.cancelRequested()) {
                ackPending(jobId);
                return finalizer.resolveKill(job, exitCode);
            }
            if (workerReason != null) {
                return finalizer.finish(job, JobStatus.FAILED, workerReason, exitCode);
            }
            if (oomKilled) {
                return finalizer.finish(job, JobStatus.FAILED, ExitReasons.OOM_KILLED, exitCode);
            }
            if (job.status() != JobStatus.RUNNING) {
                return finalizer.finish(job, JobStatus.FAILED, ExitReasons.exitCode(exitCode), exitCode);
            }
            return exitCode == 0
                    ? finalizer.finish(job, JobStatus.COMPLETED, ExitReasons.COMPLETED, exitCode)
                    : finalizer.finish(job, JobStatus.FAILED, ExitReasons.exitCode(exitCode), exitCode);
        });
        change.ifPresent(c -> c.publishTo(relay));
    }

    /** 샌드박스 생성 실패 등 준비 단계 오류 → FAILED(sandbox_creation_failed), 취소 요청이 있었으면 CANCELLED */
    public void onSetupFailure(String jobId, String message) throws Exception {
        Optional<StatusChange> change = tx.required(() -> {
            JobRecord job = jobs.lockById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (job.isTerminal()) return Optional.<StatusChange>empty();
            log.warn("setup of job {} failed: {}", jobId, message);
            if (job.cancelRequested()) {
                ackPending(jobId);
                return finalizer.resolveKill(job, null);
            }
            ackPending(jobId);
            return finalizer.finish(job, JobStatus.FAILED, ExitReasons.SANDBOX_CREATION_FAILED, null);
        });
        change.ifPresent(c -> c.publishTo(relay));
    }

    /** kill ack: 명령 ACKED, 잡이 아직 살아 있으면 kill 사유대로 터미널 */
    public void onKillAcknowledged(long commandId, Integer exitCode) throws Exception {
        Optional<StatusChange> change = tx.required(() -> {
            KillCommand cmd = commands.findById(commandId)
                    .orElseThrow(() -> new IllegalArgumentException("unknown kill command " + commandId));
            JobRecord job = jobs.lockById(cmd.jobId()).orElseThrow(() -> new JobNotFoundException(cmd.jobId()));
            if (!commands.ack(commandId, clock.now())) {
                log.debug("kill {} already {}", commandId, cmd.status().code());
            }
            if (job.isTerminal()) return Optional.<StatusChange>empty();
            log.info("kill {} acknowledged for job {} (exit={})", commandId, job.id(), exitCode);
            return finalizer.resolveKill(job, exitCode);
        });
        change.ifPresent(c -> c.publishTo(relay));
    }

    // ---------------------------------------------------------------- internals

    private void ackPending(String jobId) throws Exception {
        var pending = commands.findPendingByJob(jobId);
        if (pending.isPresent()) commands.ack(pending.get().id(), clock.now());
    }

    private void failBeforeDispatch(String jobId, String reason) throws Exception {
        Optional<StatusChange> change = tx.required(() -> {
            JobRecord job = jobs.lockById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (job.status() != JobStatus.PENDING) return Optional.<StatusChange>empty();
            dispatch.withdraw(jobId);
            return finalizer.finish(job, JobStatus.FAILED, reason, null);
        });
        change.ifPresent(c -> c.publishTo(relay));
    }

    private void validate(SubmitJobRequest req) {
        if (req == null) throw new IllegalArgumentException("request is required");
        if (req.ownerId() == null || req.ownerId().isBlank()) throw new IllegalArgumentException("ownerId is required");
        if (req.dockerImage() == null || req.dockerImage().isBlank()) throw new IllegalArgumentException("dockerImage is required");
        if (req.resources() == null) throw new IllegalArgumentException("resources are required");
        requireRelativePath(req.scriptName(), "scriptName");

        ResourceConfig rc = req.resources();
        if (rc.timeoutSeconds() > limits.maxTimeoutSeconds()) {
            throw new IllegalArgumentException("timeoutSeconds exceeds " + limits.maxTimeoutSeconds());
        }
        if (rc.cpuCount() > limits.maxCpuCount()) {
            throw new IllegalArgumentException("cpuCount exceeds " + limits.maxCpuCount());
        }
        if (rc.memoryBytes() > limits.maxMemoryBytes()) {
            throw new IllegalArgumentException("memoryLimit exceeds " + limits.maxMemoryBytes() + " bytes");
        }
        long total = 0;
        for (Map.Entry<String, byte[]> in : req.inputs().entrySet()) {
            requireRelativePath(in.getKey(), "input path");
            total += in.getValue().length;
        }
        if (total > limits.maxInputBytes()) {
            throw new IllegalArgumentException("inputs exceed " + limits.maxInputBytes() + " bytes");
        }
        if (!req.inputs().containsKey(req.scriptName())) {
            throw new IllegalArgumentException("script " + req.scriptName() + " is not among the inputs");
        }
    }

    private static void requireRelativePath(String path, String what) {
        if (path == null || path.isBlank()) throw new IllegalArgumentException(what + " is required");
        if (path.startsWith("/") || path.startsWith("\\") || path.contains("..")) {
            throw new IllegalArgumentException(what + " must be a relative path inside the input directory: " + path);
        }
    }

    private record Cancel(CancelOutcome outcome, Optional<StatusChange> change) {}
}
