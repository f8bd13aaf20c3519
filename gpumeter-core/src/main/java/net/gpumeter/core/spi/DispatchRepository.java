package net.gpumeter.core.spi;

import net.gpumeter.core.model.DispatchMessage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface DispatchRepository {
    DispatchMessage enqueue(String jobId) throws Exception;

    /** READY + available_at<=now 중 하나를 선점 (CLAIMED, lease_until 설정). SKIP LOCKED */
    Optional<DispatchMessage> claimNext(String workerToken, Duration lease) throws Exception;

    /** CLAIMED → DONE */
    boolean complete(long messageId) throws Exception;

    /** CLAIMED → READY, available_at = now + backoff, attempt++ */
    void requeue(long messageId, Duration backoff, String lastError) throws Exception;

    /** READY/CLAIMED → CANCELLED */
    int withdraw(String jobId) throws Exception;

    /** lease_until 지난 CLAIMED를 READY로 되돌림 */
    int reclaimExpiredLeases() throws Exception;

    List<DispatchMessage> findByJob(String jobId) throws Exception;
}
