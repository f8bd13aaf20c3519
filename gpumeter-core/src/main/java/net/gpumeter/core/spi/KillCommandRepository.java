package net.gpumeter.core.spi;

import net.gpumeter.core.model.KillCommand;
import net.gpumeter.core.model.KillReason;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface KillCommandRepository {
    KillCommand insert(String jobId, KillReason reason, Instant issuedAt, Instant ackDeadline) throws Exception;

    Optional<KillCommand> findById(long id) throws Exception;

    Optional<KillCommand> findPendingByJob(String jobId) throws Exception;

    /** PENDING 목록을 꺼내면서 attempts++ (재전달 횟수) */
    List<KillCommand> pollPending(int limit) throws Exception;

    /** PENDING → ACKED */
    boolean ack(long id, Instant at) throws Exception;

    /** PENDING 중 ack_deadline < now */
    List<KillCommand> findExpired(Instant now, int limit) throws Exception;

    /** PENDING → TIMED_OUT */
    boolean markTimedOut(long id, Instant at) throws Exception;
}
