package net.gpumeter.core.relay;

import net.gpumeter.core.model.RelayEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;

/** 잡 하나의 이벤트 채널. 최근 N개 replay, 터미널 상태 이벤트 후 complete */
final class JobChannel {
    private final String jobId;
    private final Sinks.Many<RelayEvent> sink;
    private volatile Instant terminatedAt;
    private volatile Instant lastActivityAt;

    JobChannel(String jobId, int replaySize, Instant createdAt) {
        this.jobId = jobId;
        this.sink = Sinks.many().replay().limit(replaySize);
        this.lastActivityAt = createdAt;
    }

    /** 발행 직렬화. 터미널 이후 이벤트는 버림 */
    synchronized boolean emit(RelayEvent event) {
        if (terminatedAt != null) return false;
        Sinks.EmitResult r = sink.tryEmitNext(event);
        lastActivityAt = event.at();
        if (event.isTerminalStatus()) {
            terminatedAt = event.at();
            sink.tryEmitComplete();
        }
        return r.isSuccess();
    }

    /** 유휴 정리. 남은 구독자는 complete */
    synchronized void close() {
        sink.tryEmitComplete();
    }

    Flux<RelayEvent> asFlux() {
        return sink.asFlux();
    }

    String jobId() { return jobId; }

    boolean isTerminated() { return terminatedAt != null; }

    Instant terminatedAt() { return terminatedAt; }

    Instant lastActivityAt() { return lastActivityAt; }

    int subscriberCount() { return sink.currentSubscriberCount(); }
}
