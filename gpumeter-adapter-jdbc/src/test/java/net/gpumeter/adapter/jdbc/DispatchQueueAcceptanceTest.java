package net.gpumeter.adapter.jdbc;

import net.gpumeter.adapter.jdbc.repo.JdbcDispatchRepository;
import net.gpumeter.adapter.jdbc.repo.JdbcJobRecordRepository;
import net.gpumeter.core.model.DispatchMessage;
import net.gpumeter.core.model.JobRecord;
import net.gpumeter.core.model.Money;
import net.gpumeter.core.model.ResourceConfig;
import net.gpumeter.core.spi.DispatchRepository;
import net.gpumeter.core.spi.JobRecordRepository;
import net.gpumeter.core.spi.TxRunner;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 디스패치 큐 인수 테스트
 * - FOR UPDATE SKIP LOCKED 선점: 동시 워커에도 메시지당 1회
 * - 백오프 재적재, lease 만료 회수, withdraw
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class DispatchQueueAcceptanceTest extends TestSupport {

    TxRunner tx;
    JobRecordRepository jobs;
    DispatchRepository queue;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        jobs = new JdbcJobRecordRepository(ds);
        queue = new JdbcDispatchRepository(ds);
    }

    @BeforeEach
    void clean() throws Exception {
        cleanTables(tx);
    }

    // ========== t1: 동시 선점: 각 메시지는 정확히 한 워커에게 ==========
    @Test
    void t1_concurrent_workers_claim_each_message_once() throws Exception {
        int messages = 20;
        for (int i = 0; i < messages; i++) enqueue("job-" + i);

        int threads = 6;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<String>>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            final String worker = "w-" + i;
            futures.add(es.submit(() -> {
                start.await();
                List<String> mine = new ArrayList<>();
                while (true) {
                    Optional<DispatchMessage> m = tx.requiresNew(() -> queue.claimNext(worker, Duration.ofSeconds(30)));
                    if (m.isEmpty()) break;
                    assertEquals(worker, m.get().workerToken());
                    mine.add(m.get().jobId());
                }
                return mine;
            }));
        }
        start.countDown();

        List<String> all = new ArrayList<>();
        for (Future<List<String>> f : futures) all.addAll(f.get(60, TimeUnit.SECONDS));
        es.shutdown();

        assertEquals(messages, all.size());
        assertEquals(messages, new HashSet<>(all).size(), "no message may be claimed twice");
    }

    // ========== t2: FIFO, complete 는 CLAIMED 에서만 ==========
    @Test
    void t2_claims_are_fifo_and_complete_once() throws Exception {
        enqueue("job-a");
        enqueue("job-b");

        DispatchMessage a = claim("w1").orElseThrow();
        DispatchMessage b = claim("w2").orElseThrow();
        assertEquals("job-a", a.jobId());
        assertEquals("job-b", b.jobId());
        assertEquals(DispatchMessage.Status.CLAIMED, a.status());
        assertNotNull(a.leaseUntil());
        assertTrue(claim("w3").isEmpty());

        assertTrue(tx.required(() -> queue.complete(a.id())));
        assertFalse(tx.required(() -> queue.complete(a.id())));
        assertEquals(DispatchMessage.Status.DONE, tx.required(() -> queue.findByJob("job-a")).get(0).status());
    }

    // ========== t3: requeue 백오프 동안은 보이지 않는다 ==========
    @Test
    void t3_requeued_message_is_hidden_during_backoff() throws Exception {
        enqueue("job-a");
        DispatchMessage m = claim("w1").orElseThrow();

        tx.required(() -> { queue.requeue(m.id(), Duration.ofSeconds(2), "worker busy"); return null; });
        assertTrue(claim("w1").isEmpty());

        Thread.sleep(2_500);
        DispatchMessage again = claim("w2").orElseThrow();
        assertEquals(m.id(), again.id());
        assertEquals(2, again.attempt());
        assertEquals("worker busy", again.lastError());
    }

    // ========== t4: lease 만료 회수 ==========
    @Test
    void t4_expired_lease_is_reclaimed() throws Exception {
        enqueue("job-a");
        claim("w1").orElseThrow();

        assertEquals(0, tx.required(() -> queue.reclaimExpiredLeases()));
        // lease는 초 단위, 최소 1초
        tx.required(() -> {
            try (var st = TxContext.get().createStatement()) {
                st.executeUpdate("UPDATE TB_DISPATCH_MSG SET LEASE_UNTIL = CURRENT_TIMESTAMP - NUMTODSINTERVAL(1, 'SECOND')");
            }
            return null;
        });
        assertEquals(1, tx.required(() -> queue.reclaimExpiredLeases()));

        DispatchMessage m = claim("w2").orElseThrow();
        assertEquals(2, m.attempt());
        assertEquals("lease expired", m.lastError());
    }

    // ========== t5: withdraw 된 메시지는 선점되지 않는다 ==========
    @Test
    void t5_withdrawn_message_is_never_claimed() throws Exception {
        enqueue("job-a");

        assertEquals(1, tx.required(() -> queue.withdraw("job-a")));
        assertEquals(0, tx.required(() -> queue.withdraw("job-a")));
        assertTrue(claim("w1").isEmpty());
        assertEquals(DispatchMessage.Status.CANCELLED, tx.required(() -> queue.findByJob("job-a")).get(0).status());
    }

    // ---------- helpers ----------

    private void enqueue(String jobId) throws Exception {
        tx.required(() -> {
            jobs.insert(JobRecord.pending(jobId, "alice", "img", "train.py", new ResourceConfig("1g", 1, 60),
                    Money.of("1.00"), 60, Instant.now()));
            return queue.enqueue(jobId);
        });
    }

    private Optional<DispatchMessage> claim(String worker) throws Exception {
        return tx.required(() -> queue.claimNext(worker, Duration.ofSeconds(30)));
    }
}
