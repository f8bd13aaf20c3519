package net.gpumeter.core.relay;

import net.gpumeter.core.model.JobStatus;
import net.gpumeter.core.model.RelayEvent;
import net.gpumeter.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 잡 로그/상태 이벤트 팬아웃.
 * 발행은 논블로킹이고, 구독자마다 별도 버퍼(가장 오래된 것부터 버림)를 가져서
 * 느린 구독자가 워커나 과금 경로를 막지 않는다.
 */
public final class LogEventRelay {
    private static final Logger log = LoggerFactory.getLogger(LogEventRelay.class);

    private final ConcurrentMap<String, JobChannel> channels = new ConcurrentHashMap<>();
    // 터미널 후 정리된 잡 → 정리 시각. 늦게 도착한 이벤트가 채널을 되살리지 못하게 idleTimeout 동안 유지
    private final ConcurrentMap<String, Instant> finished = new ConcurrentHashMap<>();
    private final int replaySize;
    private final int subscriberBufferSize;
    private final Duration retention;
    private final Duration idleTimeout;
    private final Clock clock;

    public LogEventRelay(int replaySize, int subscriberBufferSize, Duration retention, Duration idleTimeout, Clock clock) {
        if (replaySize < 1 || subscriberBufferSize < 1) throw new IllegalArgumentException("buffer sizes must be positive");
        this.replaySize = replaySize;
        this.subscriberBufferSize = subscriberBufferSize;
        this.retention = retention;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
    }

    public void publishLog(String jobId, String line) {
        JobChannel ch = channel(jobId);
        if (ch == null) {
            log.debug("log line for finished job {} dropped", jobId);
            return;
        }
        ch.emit(RelayEvent.log(jobId, line, clock.now()));
    }

    public void publishStatus(String jobId, JobStatus status, String exitReason) {
        JobChannel ch = channel(jobId);
        boolean ok = ch != null && ch.emit(RelayEvent.status(jobId, status, exitReason, clock.now()));
        if (!ok) log.debug("status {} for job {} not delivered (channel closed)", status, jobId);
    }

    /**
     * replay 후 라이브 tail. 터미널 상태 이벤트 뒤에 complete.
     * 터미널로 정리된 잡이면 빈 스트림
     */
    public Flux<RelayEvent> subscribe(String jobId) {
        JobChannel ch = channel(jobId);
        return ch == null ? Flux.empty() : buffered(jobId, ch);
    }

    /** 이미 터미널 이벤트를 받은 채널의 replay. 그런 채널이 없으면 빈 스트림 (채널을 만들지 않음) */
    public Flux<RelayEvent> replayTerminated(String jobId) {
        JobChannel ch = channels.get(jobId);
        return ch == null || !ch.isTerminated() ? Flux.empty() : buffered(jobId, ch);
    }

    public boolean hasChannel(String jobId) {
        return channels.containsKey(jobId);
    }

    /** 터미널 후 retention 경과, 또는 idleTimeout 동안 활동 없는 채널 제거 */
    public int evictExpired() {
        Instant now = clock.now();
        int evicted = 0;
        for (var it = channels.values().iterator(); it.hasNext(); ) {
            JobChannel ch = it.next();
            boolean expired = ch.isTerminated()
                    ? ch.terminatedAt().plus(retention).isBefore(now)
                    : ch.lastActivityAt().plus(idleTimeout).isBefore(now) && ch.subscriberCount() == 0;
            if (expired) {
                it.remove();
                if (ch.isTerminated()) {
                    finished.put(ch.jobId(), now);
                } else {
                    ch.close();
                }
                evicted++;
            }
        }
        finished.values().removeIf(at -> at.plus(idleTimeout).isBefore(now));
        if (evicted > 0) log.debug("evicted {} relay channels", evicted);
        return evicted;
    }

    public int channelCount() {
        return channels.size();
    }

    /** 터미널로 정리된 잡이면 null */
    private JobChannel channel(String jobId) {
        if (finished.containsKey(jobId)) return null;
        return channels.computeIfAbsent(jobId, id -> new JobChannel(id, replaySize, clock.now()));
    }

    private Flux<RelayEvent> buffered(String jobId, JobChannel ch) {
        return ch.asFlux()
                .onBackpressureBuffer(subscriberBufferSize,
                        dropped -> log.debug("slow subscriber on job {} dropped {}", jobId, dropped.type()),
                        BufferOverflowStrategy.DROP_OLDEST);
    }
}
