package net.gpumeter.core.worker;

import net.gpumeter.core.error.WorkerBusyException;
import net.gpumeter.core.model.ExitReasons;
import net.gpumeter.core.model.Heartbeat;
import net.gpumeter.core.model.HeartbeatVerdict;
import net.gpumeter.core.model.JobSpec;
import net.gpumeter.core.model.KillCommand;
import net.gpumeter.core.service.Retrier;
import net.gpumeter.core.service.RetryPolicy;
import net.gpumeter.core.spi.BlobStore;
import net.gpumeter.core.spi.Clock;
import net.gpumeter.core.spi.ControllerGateway;
import net.gpumeter.core.spi.SandboxExit;
import net.gpumeter.core.spi.SandboxHandle;
import net.gpumeter.core.spi.SandboxRequest;
import net.gpumeter.core.spi.SandboxRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * 워커 측 실행 감독. 슬롯은 하나.
 * <ul>
 *   <li>하트비트 타이머: 로그량과 무관하게 T마다 번호 붙은 틱 전송, 실패한 틱은 backlog에서 먼저 재전송</li>
 *   <li>로컬 deadline: timeout_seconds 경과 시 종료</li>
 *   <li>kill 명령 폴링 + ack</li>
 *   <li>stdout 펌프 스레드, 종료 대기 스레드</li>
 * </ul>
 */
public final class ExecutionSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionSupervisor.class);

    public static final String LOG_PATH = "logs/output.log";
    private static final Duration AWAIT_SLICE = Duration.ofMillis(500);
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final SandboxRuntime runtime;
    private final BlobStore blobs;
    private final ControllerGateway controller;
    private final WorkerSettings settings;
    private final Clock clock;
    private final LogForwarder forwarder;
    private final Retrier reportRetrier;
    private final ScheduledExecutorService scheduler;
    private final AtomicReference<ActiveJob> slot = new AtomicReference<>();
    private final Object admission = new Object();
    // accept 전에 잡아 둔 슬롯의 잡 id (admission으로 보호)
    private volatile String reservedFor;
    private final AtomicInteger threadSeq = new AtomicInteger();

    public ExecutionSupervisor(SandboxRuntime runtime,
                               BlobStore blobs,
                               ControllerGateway controller,
                               WorkerSettings settings,
                               Clock clock) {
        this.runtime = runtime;
        this.blobs = blobs;
        this.controller = controller;
        this.settings = settings;
        this.clock = clock;
        this.forwarder = new LogForwarder(controller, settings.forwarderCapacity(), settings.reconnect());
        this.reportRetrier = new Retrier(RetryPolicy.exponential(Duration.ofMillis(200), Duration.ofSeconds(5)), 5);
        // 하트비트/deadline 타이머, kill 폴링, SIGTERM→SIGKILL 대기
        this.scheduler = Executors.newScheduledThreadPool(3, r -> daemon(r, "gpumeter-supervisor-" + threadSeq.incrementAndGet()));
    }

    /** 잔여 샌드박스 정리 + kill 폴링 시작 */
    public void start() {
        try {
            int removed = runtime.removeOrphans();
            if (removed > 0) log.warn("removed {} orphaned sandboxes from a previous run", removed);
        } catch (Exception e) {
            log.warn("orphan sandbox cleanup failed: {}", e.toString());
        }
        long every = settings.killPollInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::pollKillCommands, every, every, TimeUnit.MILLISECONDS);
        log.info("execution supervisor {} started", settings.workerToken());
    }

    public boolean isBusy() {
        return slot.get() != null || reservedFor != null;
    }

    /** 디스패치 accept 전에 슬롯 확보. 이미 차 있거나 예약돼 있으면 false */
    public boolean reserve(String jobId) {
        synchronized (admission) {
            if (slot.get() != null || reservedFor != null) return false;
            reservedFor = jobId;
            return true;
        }
    }

    /** accept가 실패/무효일 때 예약 반환 */
    public void releaseReservation(String jobId) {
        synchronized (admission) {
            if (jobId.equals(reservedFor)) reservedFor = null;
        }
    }

    public Optional<String> activeJobId() {
        return Optional.ofNullable(slot.get()).map(ActiveJob::jobId);
    }

    /**
     * 샌드박스 생성 후 RUNNING 보고, 타이머/스레드 기동.
     * 슬롯이 차 있거나 다른 잡에 예약돼 있으면 WorkerBusyException. 생성 실패는 setup failure로 보고된다.
     */
    public void launch(JobSpec spec) {
        ActiveJob job = new ActiveJob(spec, clock.now(), settings.logBufferLines());
        synchronized (admission) {
            boolean reservedForOther = reservedFor != null && !reservedFor.equals(spec.jobId());
            if (reservedForOther || !slot.compareAndSet(null, job)) {
                ActiveJob current = slot.get();
                throw new WorkerBusyException(current != null ? current.jobId() : String.valueOf(reservedFor), spec.jobId());
            }
            reservedFor = null;
        }

        SandboxHandle handle;
        try {
            handle = runtime.create(sandboxRequest(spec));
        } catch (Exception e) {
            log.warn("sandbox creation for job {} failed: {}", spec.jobId(), e.getMessage());
            report("setup failure of " + spec.jobId(), () -> controller.reportSetupFailure(spec.jobId(), e.getMessage()));
            vacate(job);
            return;
        }
        job.attach(handle, clock.now());

        boolean running;
        try {
            running = controller.markRunning(spec.jobId(), handle.sandboxId());
        } catch (Exception e) {
            log.warn("could not report job {} as running: {}", spec.jobId(), e.toString());
            job.beginStopping(ExitReasons.CONTROLLER_UNREACHABLE);
            running = false;
        }
        if (!running || job.isStopping()) {
            log.info("job {} no longer runnable; tearing down sandbox {}", spec.jobId(), handle.sandboxId());
            job.beginStopping(null);
            startWaiter(job);
            terminate(job);
            return;
        }

        startPump(job);
        startWaiter(job);
        long tickMs = spec.tickSeconds() * 1000L;
        job.addTimer(scheduler.scheduleAtFixedRate(() -> heartbeat(job), tickMs, tickMs, TimeUnit.MILLISECONDS));
        job.addTimer(scheduler.schedule(() -> {
            log.info("job {} hit its local deadline of {}s", job.jobId(), spec.resources().timeoutSeconds());
            kill(job, ExitReasons.TIMEOUT);
        }, spec.resources().timeoutSeconds(), TimeUnit.SECONDS));
        log.info("job {} running in sandbox {}", spec.jobId(), handle.sandboxId());
    }

    /** 현재 잡 종료. 컨트롤러 지시면 reason == null */
    public boolean kill(String jobId, String reason) {
        ActiveJob job = slot.get();
        if (job == null || !job.jobId().equals(jobId)) return false;
        kill(job, reason);
        return true;
    }

    /** 종료 완료(슬롯 비움)까지 대기 */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        ActiveJob job = slot.get();
        return job == null || job.finished().await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // ------------------------------------------------------------------ heartbeat

    private void heartbeat(ActiveJob job) {
        if (job.isStopping()) return;
        job.enqueueNextTick();
        deliverBacklog(job);
        if (job.backlogSize() > settings.maxUndeliveredTicks()) {
            log.error("job {}: {} undelivered ticks, controller unreachable", job.jobId(), job.backlogSize());
            kill(job, ExitReasons.CONTROLLER_UNREACHABLE);
        }
    }

    /** backlog 앞에서부터 순서대로 전송, 실패하면 멈추고 다음 타이머에서 재시도 */
    private synchronized void deliverBacklog(ActiveJob job) {
        Long seq;
        while ((seq = job.peekTick()) != null) {
            Instant now = clock.now();
            long elapsed = Duration.between(job.lastDeliveredAt(), now).toSeconds();
            HeartbeatVerdict verdict;
            try {
                verdict = controller.heartbeat(new Heartbeat(job.jobId(), seq, now, elapsed, !job.isStopping()));
            } catch (Exception e) {
                log.warn("heartbeat tick {} of job {} not delivered: {}", seq, job.jobId(), e.toString());
                return;
            }
            job.tickDelivered(seq, now);
            switch (verdict) {
                case CONTINUE, DUPLICATE -> { }
                case STOP -> {
                    log.info("controller stopped job {} at tick {}", job.jobId(), seq);
                    kill(job, null);
                }
                case REJECTED -> log.warn("controller rejected tick {} of job {}", seq, job.jobId());
            }
        }
    }

    // ------------------------------------------------------------------ kill

    private void pollKillCommands() {
        List<KillCommand> cmds;
        try {
            cmds = controller.pollKillCommands();
        } catch (Exception e) {
            log.debug("kill poll failed: {}", e.toString());
            return;
        }
        for (KillCommand cmd : cmds) {
            ActiveJob job = slot.get();
            if (job != null && job.jobId().equals(cmd.jobId())) {
                job.addKillCommand(cmd.id());
                kill(job, null);
            } else {
                // 이 워커에서 돌고 있지 않음: 이미 끝났거나 이전 실행의 잔재
                report("ack of kill " + cmd.id(), () -> controller.acknowledgeKill(cmd.id(), null));
            }
        }
    }

    private void kill(ActiveJob job, String reason) {
        if (!job.beginStopping(reason)) return;
        if (job.handle() == null) return; // 생성 중: launch가 이어서 정리
        try {
            scheduler.execute(() -> terminate(job));
        } catch (RejectedExecutionException e) {
            log.warn("supervisor is shutting down; sandbox of job {} not signalled", job.jobId());
        }
    }

    /** SIGTERM → grace → SIGKILL. 종료 후처리는 waiter 스레드가 한다 */
    private void terminate(ActiveJob job) {
        SandboxHandle h = job.handle();
        try {
            runtime.signal(h, SandboxRuntime.Signal.TERM);
            if (runtime.await(h, settings.killGrace()).isEmpty()) {
                log.info("job {} ignored SIGTERM for {}, sending SIGKILL", job.jobId(), settings.killGrace());
                runtime.signal(h, SandboxRuntime.Signal.KILL);
            }
        } catch (Exception e) {
            log.error("failed to stop sandbox {} of job {}: {}", h.sandboxId(), job.jobId(), e.toString());
        }
    }

    // ------------------------------------------------------------------ threads

    private void startPump(ActiveJob job) {
        Thread t = new Thread(() -> {
            try (Stream<String> lines = runtime.stdout(job.handle())) {
                lines.forEach(line -> {
                    job.appendLog(line);
                    forwarder.offer(job.jobId(), line);
                });
            } catch (Exception e) {
                log.warn("log stream of job {} ended abnormally: {}", job.jobId(), e.toString());
            }
        }, "gpumeter-pump-" + job.jobId());
        t.setDaemon(true);
        job.attachPump(t);
        t.start();
    }

    private void startWaiter(ActiveJob job) {
        Thread t = new Thread(() -> {
            try {
                Optional<SandboxExit> exit = Optional.empty();
                while (exit.isEmpty()) {
                    exit = runtime.await(job.handle(), AWAIT_SLICE);
                }
                onExit(job, exit.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                vacate(job);
            } catch (Exception e) {
                log.error("waiting on sandbox of job {} failed: {}", job.jobId(), e.toString());
                onExit(job, new SandboxExit(-1, false));
            }
        }, "gpumeter-waiter-" + job.jobId());
        t.setDaemon(true);
        t.start();
    }

    private void onExit(ActiveJob job, SandboxExit exit) {
        String jobId = job.jobId();
        log.info("sandbox of job {} exited with code {} (oom={})", jobId, exit.exitCode(), exit.oomKilled());
        job.cancelTimers();
        try {
            Thread pump = job.pump();
            if (pump != null) pump.join(DRAIN_TIMEOUT.toMillis());
            if (!forwarder.flush(DRAIN_TIMEOUT)) log.warn("log forwarder did not drain for job {}", jobId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            blobs.write(jobId, LOG_PATH, job.logBytes());
        } catch (Exception e) {
            log.warn("could not persist logs of job {}: {}", jobId, e.toString());
        }
        deliverBacklog(job);

        String reason = job.workerReason();
        report("exit of " + jobId, () -> controller.reportExit(jobId, exit.exitCode(), exit.oomKilled(), reason));
        for (Long id : job.killCommandIds()) {
            report("ack of kill " + id, () -> controller.acknowledgeKill(id, exit.exitCode()));
        }
        try {
            runtime.remove(job.handle());
        } catch (Exception e) {
            log.warn("could not remove sandbox {} of job {}: {}", job.handle().sandboxId(), jobId, e.toString());
        }
        vacate(job);
    }

    private void vacate(ActiveJob job) {
        job.cancelTimers();
        slot.compareAndSet(job, null);
        job.markFinished();
    }

    private void report(String what, ControllerCall call) {
        try {
            reportRetrier.call(what, () -> { call.run(); return null; });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} could not be reported to the controller: {}", what, e.toString());
        }
    }

    private SandboxRequest sandboxRequest(JobSpec spec) throws Exception {
        Path in = blobs.inputDir(spec.jobId());
        Path out = blobs.outputDir(spec.jobId());
        List<String> command = new ArrayList<>(settings.interpreter());
        command.add(SandboxRequest.INPUT_MOUNT + "/" + spec.scriptName());
        Map<String, String> env = new LinkedHashMap<>();
        env.put("JOB_ID", spec.jobId());
        env.put("OUTPUT_DIR", SandboxRequest.OUTPUT_MOUNT);
        return new SandboxRequest(spec.jobId(), spec.dockerImage(), command, env, spec.resources(), in, out,
                settings.gpuCount(), settings.pidsLimit(), true);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        forwarder.close();
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    @FunctionalInterface
    private interface ControllerCall {
        void run() throws Exception;
    }
}
