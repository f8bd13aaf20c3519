package net.gpumeter.core.dispatch;

import net.gpumeter.core.model.DispatchMessage;
import net.gpumeter.core.service.RetryPolicy;
import net.gpumeter.core.support.InMemoryStore;
import net.gpumeter.core.support.LockingTxRunner;
import net.gpumeter.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 디스패치 큐: lease 선점, 완료, 백오프 재적재, lease 만료 회수, 회수(withdraw)
 */
class DispatchServiceTest {

    private MutableClock clock;
    private InMemoryStore store;
    private DispatchService dispatch;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        store = new InMemoryStore(clock);
        dispatch = new DispatchService(store.dispatch(), new LockingTxRunner(store),
                RetryPolicy.exponential(Duration.ofSeconds(2), Duration.ofSeconds(30)));
    }

    @Test
    void claimed_message_is_invisible_to_other_workers() throws Exception {
        dispatch.enqueue("job-1");

        DispatchMessage m = dispatch.claimNext("w1", Duration.ofMinutes(1)).orElseThrow();
        assertEquals("job-1", m.jobId());
        assertEquals("w1", m.workerToken());
        assertTrue(dispatch.claimNext("w2", Duration.ofMinutes(1)).isEmpty());

        assertTrue(dispatch.complete(m.id()));
        assertFalse(dispatch.complete(m.id()));
    }

    @Test
    void messages_are_claimed_in_fifo_order() throws Exception {
        dispatch.enqueue("job-1");
        dispatch.enqueue("job-2");

        assertEquals("job-1", dispatch.claimNext("w1", Duration.ofMinutes(1)).orElseThrow().jobId());
        assertEquals("job-2", dispatch.claimNext("w2", Duration.ofMinutes(1)).orElseThrow().jobId());
    }

    @Test
    void requeued_message_waits_out_its_backoff() throws Exception {
        dispatch.enqueue("job-1");
        DispatchMessage m = dispatch.claimNext("w1", Duration.ofMinutes(1)).orElseThrow();

        dispatch.requeue(m.id(), 2, "worker busy");

        assertTrue(dispatch.claimNext("w1", Duration.ofMinutes(1)).isEmpty());
        clock.advanceSeconds(4);
        DispatchMessage again = dispatch.claimNext("w2", Duration.ofMinutes(1)).orElseThrow();
        assertEquals(m.id(), again.id());
        assertEquals(2, again.attempt());
        assertEquals("worker busy", again.lastError());
    }

    @Test
    void expired_lease_is_reclaimed() throws Exception {
        dispatch.enqueue("job-1");
        dispatch.claimNext("w1", Duration.ofSeconds(30)).orElseThrow();

        clock.advanceSeconds(20);
        assertEquals(0, dispatch.reclaimExpiredLeases());
        clock.advanceSeconds(11);
        assertEquals(1, dispatch.reclaimExpiredLeases());

        assertEquals("job-1", dispatch.claimNext("w2", Duration.ofSeconds(30)).orElseThrow().jobId());
    }

    @Test
    void withdrawn_message_is_never_claimed() throws Exception {
        dispatch.enqueue("job-1");

        assertEquals(1, dispatch.withdraw("job-1"));
        assertEquals(0, dispatch.withdraw("job-1"));
        assertTrue(dispatch.claimNext("w1", Duration.ofMinutes(1)).isEmpty());
        assertEquals(DispatchMessage.Status.CANCELLED, store.allMessages().get(0).status());
    }

    @Test
    void exponential_backoff_is_capped() {
        RetryPolicy p = RetryPolicy.exponential(Duration.ofSeconds(2), Duration.ofSeconds(30));
        assertEquals(Duration.ofSeconds(2), p.nextBackoff(1));
        assertEquals(Duration.ofSeconds(8), p.nextBackoff(3));
        assertEquals(Duration.ofSeconds(30), p.nextBackoff(10));
    }
}
