package net.gpumeter.core.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 컨트롤러 소유 잡 레코드.
 * totalCost == tickCost() * ticksBilled, 터미널 이후 동결.
 */
public record JobRecord(
        String id,
        String ownerId,
        JobStatus status,
        String dockerImage,
        String scriptName,
        ResourceConfig resources,
        BigDecimal ratePerMinute,   // 제출 시점 요율 고정
        int tickSeconds,
        Instant createdAt,
        Instant queuedAt,
        Instant acceptedAt,
        Instant startedAt,
        Instant endedAt,
        Instant lastHeartbeatAt,
        long runtimeSeconds,
        long ticksBilled,
        BigDecimal totalCost,
        String exitReason,
        Integer exitCode,
        String sandboxId,
        Long cancelSeq,
        Long exhaustedSeq,
        KillReason killReason,
        long version
) {
    public static JobRecord pending(String id, String ownerId, String image, String scriptName,
                                    ResourceConfig resources, BigDecimal ratePerMinute, int tickSeconds, Instant now) {
        return new JobRecord(id, ownerId, JobStatus.PENDING, image, scriptName, resources,
                Money.normalize(ratePerMinute), tickSeconds, now, now, null, null, null, null,
                0L, 0L, Money.ZERO, null, null, null, null, null, null, 0L);
    }

    public BigDecimal tickCost() {
        return Money.tickCost(ratePerMinute, tickSeconds);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean cancelRequested() {
        return cancelSeq != null;
    }

    /** exhaustion이 취소보다 먼저 기록됐을 때만 KILLED_NO_CREDITS 우선 */
    public boolean exhaustionWins() {
        return exhaustedSeq != null && (cancelSeq == null || exhaustedSeq < cancelSeq);
    }

    public JobSpec toSpec() {
        return new JobSpec(id, ownerId, dockerImage, scriptName, resources, tickSeconds);
    }
}
