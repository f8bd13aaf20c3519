package net.gpumeter.core.dispatch;

import net.gpumeter.core.model.DispatchMessage;
import net.gpumeter.core.service.RetryPolicy;
import net.gpumeter.core.spi.DispatchRepository;
import net.gpumeter.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 영속 디스패치 큐. 선점은 lease이고, 잡 전이(PENDING → PREPARING)와 메시지 완료는
 * 호출자의 같은 트랜잭션에서 일어난다.
 */
public final class DispatchService {
    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    private final DispatchRepository messages;
    private final TxRunner tx;
    private final RetryPolicy busyBackoff;

    public DispatchService(DispatchRepository messages, TxRunner tx, RetryPolicy busyBackoff) {
        this.messages = messages; this.tx = tx; this.busyBackoff = busyBackoff;
    }

    public DispatchMessage enqueue(String jobId) throws Exception {
        DispatchMessage m = tx.required(() -> messages.enqueue(jobId));
        log.debug("enqueued job {} as message {}", jobId, m.id());
        return m;
    }

    /** READY 하나 선점 (SKIP LOCKED). 독립 트랜잭션으로 즉시 커밋 */
    public Optional<DispatchMessage> claimNext(String workerToken, Duration lease) throws Exception {
        return tx.requiresNew(() -> messages.claimNext(workerToken, lease));
    }

    public boolean complete(long messageId) throws Exception {
        return tx.required(() -> messages.complete(messageId));
    }

    /** 워커가 바쁘거나 준비 실패 → 백오프 후 READY */
    public void requeue(long messageId, long attempt, String error) throws Exception {
        Duration backoff = busyBackoff.nextBackoff(attempt);
        tx.required(() -> { messages.requeue(messageId, backoff, error); return null; });
        log.debug("requeued message {} in {}: {}", messageId, backoff, error);
    }

    public int withdraw(String jobId) throws Exception {
        return tx.required(() -> messages.withdraw(jobId));
    }

    public int reclaimExpiredLeases() throws Exception {
        int n = tx.required(messages::reclaimExpiredLeases);
        if (n > 0) log.info("reclaimed {} expired dispatch leases", n);
        return n;
    }
}
