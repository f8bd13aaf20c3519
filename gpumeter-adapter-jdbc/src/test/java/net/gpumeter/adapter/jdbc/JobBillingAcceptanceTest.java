package net.gpumeter.adapter.jdbc;

import net.gpumeter.adapter.jdbc.repo.*;
import net.gpumeter.core.dispatch.DispatchService;
import net.gpumeter.core.error.TooManyActiveJobsException;
import net.gpumeter.core.ledger.WalletLedgerService;
import net.gpumeter.core.model.*;
import net.gpumeter.core.relay.LogEventRelay;
import net.gpumeter.core.service.*;
import net.gpumeter.core.spi.*;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 컨트롤러 서비스 전체를 Oracle 저장소 위에서 구동하는 인수 테스트
 * - rate 1.00/min, T=60s (틱당 1.00), 예약 1틱
 * - 잡 행 → 지갑 행 잠금 순서, SQ_JOB_EVENT 로 취소/소진 선후 판정
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class JobBillingAcceptanceTest extends TestSupport {

    final AtomicReference<Instant> now = new AtomicReference<>();

    TxRunner tx;
    JobRecordRepository jobs;
    KillCommandRepository commands;
    WalletLedgerService ledger;
    DispatchService dispatch;
    BillingHeartbeatCoordinator billing;
    JobLifecycleService lifecycle;
    BillingPolicy policy;

    @BeforeAll
    void initAll() {
        Clock clock = now::get;
        tx = new JdbcTxRunner(ds);
        jobs = new JdbcJobRecordRepository(ds);
        commands = new JdbcKillCommandRepository(ds);
        policy = new BillingPolicy(Money.of("1.00"), 60, 1, Money.of("1.00"),
                Duration.ofSeconds(30), 3, Duration.ofMinutes(15));

        LogEventRelay relay = new LogEventRelay(100, 256, Duration.ofMinutes(5), Duration.ofHours(1), clock);
        ledger = new WalletLedgerService(new JdbcWalletRepository(ds), new JdbcLedgerRepository(ds),
                new JdbcReservationRepository(ds), tx, clock);
        dispatch = new DispatchService(new JdbcDispatchRepository(ds), tx, RetryPolicy.fixed(Duration.ZERO));
        KillSwitch kills = new KillSwitch(commands, policy, tx, clock);
        billing = new BillingHeartbeatCoordinator(jobs, commands, ledger, kills, relay, policy, tx, clock);
        lifecycle = new JobLifecycleService(jobs, commands, ledger, dispatch, kills, new MapBlobStore(), relay,
                policy, SubmissionPolicy.defaults(), new Retrier(RetryPolicy.fixed(Duration.ZERO), 3), tx, clock);
    }

    @BeforeEach
    void clean() throws Exception {
        cleanTables(tx);
        now.set(Instant.now());
    }

    // ========== t1: 잔액 5.00 → 4틱 과금 후 5번째 틱에서 KILLED_NO_CREDITS ==========
    @Test
    void t1_running_out_of_credits_kills_the_job() throws Exception {
        fund("alice", "5.00");
        String jobId = submit("alice");
        startRunning(jobId);

        for (long tick = 1; tick <= 4; tick++) {
            advance(60);
            assertEquals(HeartbeatVerdict.CONTINUE, tick(jobId, tick), "tick " + tick);
        }
        advance(60);
        assertEquals(HeartbeatVerdict.STOP, tick(jobId, 5));
        assertEquals(HeartbeatVerdict.STOP, tick(jobId, 5));

        JobRecord job = lifecycle.get(jobId);
        assertEquals(JobStatus.KILLED_NO_CREDITS, job.status());
        assertEquals(4, job.ticksBilled());
        assertEquals(Money.of("4.00"), job.totalCost());
        assertNotNull(job.exhaustedSeq());
        assertNotNull(job.endedAt());

        WalletBalance b = ledger.reconcile("alice");
        assertEquals(Money.of("1.00"), b.balance());
        assertEquals(Money.ZERO, b.reserved());

        KillCommand cmd = tx.required(() -> commands.findPendingByJob(jobId)).orElseThrow();
        assertEquals(KillReason.INSUFFICIENT_CREDITS, cmd.reason());
    }

    // ========== t2: 실행 중 취소 → kill 폴링 → ack → CANCELLED ==========
    @Test
    void t2_cancel_is_delivered_through_kill_commands() throws Exception {
        fund("alice", "5.00");
        String jobId = submit("alice");
        startRunning(jobId);
        advance(60);
        assertEquals(HeartbeatVerdict.CONTINUE, tick(jobId, 1));

        assertEquals(CancelOutcome.ACCEPTED, lifecycle.cancel(jobId, "alice"));
        assertEquals(CancelOutcome.ACCEPTED, lifecycle.cancel(jobId, "alice"));

        List<KillCommand> polled = tx.required(() -> commands.pollPending(10));
        assertEquals(1, polled.size());
        assertEquals(1, polled.get(0).attempts());
        assertEquals(2, tx.required(() -> commands.pollPending(10)).get(0).attempts());

        lifecycle.onKillAcknowledged(polled.get(0).id(), 143);

        JobRecord job = lifecycle.get(jobId);
        assertEquals(JobStatus.CANCELLED, job.status());
        assertEquals(ExitReasons.CANCELLED_BY_USER, job.exitReason());
        assertEquals(Integer.valueOf(143), job.exitCode());
        assertEquals(KillCommand.Status.ACKED, tx.required(() -> commands.findById(polled.get(0).id())).orElseThrow().status());
        assertEquals(Money.of("4.00"), ledger.balance("alice").available());
    }

    // ========== t3: 취소가 먼저 기록되면 이후 소진에도 CANCELLED ==========
    @Test
    void t3_cancel_recorded_before_exhaustion_wins() throws Exception {
        fund("alice", "1.00");
        String jobId = submit("alice");
        startRunning(jobId);

        lifecycle.cancel(jobId, "alice");
        advance(60);
        assertEquals(HeartbeatVerdict.STOP, tick(jobId, 1));

        JobRecord mid = lifecycle.get(jobId);
        assertEquals(JobStatus.RUNNING, mid.status());
        assertTrue(mid.cancelSeq() < mid.exhaustedSeq());

        KillCommand cmd = tx.required(() -> commands.findPendingByJob(jobId)).orElseThrow();
        lifecycle.onKillAcknowledged(cmd.id(), 143);
        assertEquals(JobStatus.CANCELLED, lifecycle.get(jobId).status());
    }

    // ========== t4: 하트비트 누락 / kill ack 기한 초과 스윕 ==========
    @Test
    void t4_sweeps_fail_silent_jobs_and_settle_unacked_kills() throws Exception {
        fund("alice", "10.00");
        String silent = submit("alice");
        startRunning(silent);
        String cancelled = submit("alice");
        startRunning(cancelled);
        lifecycle.cancel(cancelled, "alice");

        // 취소 요청된 잡도 살아 있는 동안의 틱은 과금, 응답은 STOP
        advance(60);
        assertEquals(HeartbeatVerdict.STOP, tick(cancelled, 1));
        advance(31);
        assertEquals(1, billing.sweepMissedHeartbeats());
        assertEquals(ExitReasons.HEARTBEAT_TIMEOUT, lifecycle.get(silent).exitReason());

        advance(90);
        billing.sweepKillAckTimeouts();
        assertEquals(JobStatus.CANCELLED, lifecycle.get(cancelled).status());

        assertEquals(Money.ZERO, ledger.reconcile("alice").reserved());
    }

    // ========== t5: 같은 사용자의 동시 제출: 활성 잡 한도(3) 정확히 준수 ==========
    @Test
    void t5_concurrent_submissions_respect_the_active_job_limit() throws Exception {
        fund("alice", "100.00");

        int threads = 6;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(es.submit(() -> {
                start.await();
                return submit("alice");
            }));
        }
        start.countDown();

        int accepted = 0;
        int refused = 0;
        for (Future<String> f : futures) {
            try {
                f.get(60, TimeUnit.SECONDS);
                accepted++;
            } catch (ExecutionException e) {
                assertInstanceOf(TooManyActiveJobsException.class, e.getCause());
                refused++;
            }
        }
        es.shutdown();

        assertEquals(3, accepted);
        assertEquals(3, refused);
        assertEquals(3, lifecycle.list("alice", JobStatus.PENDING, 10, 0).size());
        assertEquals(Money.of("3.00"), ledger.balance("alice").reserved());
    }

    // ---------- helpers ----------

    private void advance(long seconds) {
        now.updateAndGet(t -> t.plusSeconds(seconds));
    }

    private void fund(String user, String amount) throws Exception {
        ledger.credit(user, Money.of(amount), "topup-" + user + "-" + System.nanoTime());
    }

    private String submit(String owner) throws Exception {
        return lifecycle.submit(new SubmitJobRequest(owner, "pytorch/pytorch:2.2.0-cuda12.1", "train.py",
                new ResourceConfig("4g", 2, 3600),
                Map.of("train.py", "print('hello')".getBytes(StandardCharsets.UTF_8))));
    }

    /** 큐에서 해당 잡 메시지를 선점 → accept → RUNNING */
    private void startRunning(String jobId) throws Exception {
        DispatchMessage m = dispatch.claimNext("test-worker", Duration.ofMinutes(1)).orElseThrow();
        assertEquals(jobId, m.jobId());
        lifecycle.accept(m.id(), jobId).orElseThrow();
        assertTrue(lifecycle.markRunning(jobId, "sbx-" + jobId.substring(0, 8)));
    }

    private HeartbeatVerdict tick(String jobId, long seq) throws Exception {
        return billing.onHeartbeat(new Heartbeat(jobId, seq, now.get(), policy.tickSeconds(), true));
    }

    /** 테스트용 맵 blob 저장소 */
    static final class MapBlobStore implements BlobStore {
        private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();
        private final Path root;

        MapBlobStore() {
            try {
                root = Files.createTempDirectory("gpumeter-jdbc-blobs");
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }

        @Override public void write(String jobId, String path, byte[] content) {
            blobs.put(jobId + "/" + path, content.clone());
        }
        @Override public byte[] read(String jobId, String path) throws IOException {
            byte[] b = blobs.get(jobId + "/" + path);
            if (b == null) throw new NoSuchFileException(jobId + "/" + path);
            return b;
        }
        @Override public List<String> list(String jobId, String prefix) {
            return blobs.keySet().stream()
                    .filter(k -> k.startsWith(jobId + "/" + prefix))
                    .map(k -> k.substring(jobId.length() + 1))
                    .sorted()
                    .collect(Collectors.toList());
        }
        @Override public Path inputDir(String jobId) { return root.resolve(jobId).resolve("input"); }
        @Override public Path outputDir(String jobId) { return root.resolve(jobId).resolve("output"); }
    }
}
