package net.gpumeter.core.worker;

import net.gpumeter.core.spi.ControllerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.util.concurrent.Queues;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 워커 → 컨트롤러 로그 전달.
 * 유한 큐에 논블로킹으로 넣고(가득 차면 버림), 전송 실패는 ReconnectPolicy로 재시도 후 버린다.
 * 과금 경로와는 무관하다.
 */
public final class LogForwarder implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LogForwarder.class);

    private final Sinks.Many<LogLine> queue;
    private final Disposable pump;
    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public LogForwarder(ControllerGateway controller, int capacity, ReconnectPolicy reconnect) {
        this.queue = Sinks.many().unicast().onBackpressureBuffer(
                Queues.<LogLine>get(capacity).get());
        this.pump = queue.asFlux()
                .publishOn(Schedulers.boundedElastic())
                .concatMap(line -> Mono.fromCallable(() -> { controller.forwardLog(line.jobId(), line.text()); return line; })
                        .retryWhen(reconnect.toRetry())
                        .onErrorResume(e -> {
                            dropped.incrementAndGet();
                            log.warn("dropping log line of job {} after retries: {}", line.jobId(), e.toString());
                            return Mono.empty();
                        })
                        .doFinally(s -> pending.decrementAndGet()))
                .subscribe();
    }

    /** false면 큐가 가득 차서 버려짐 */
    public boolean offer(String jobId, String text) {
        pending.incrementAndGet();
        Sinks.EmitResult r;
        synchronized (this) {
            r = queue.tryEmitNext(new LogLine(jobId, text));
        }
        if (r.isFailure()) {
            pending.decrementAndGet();
            dropped.incrementAndGet();
            return false;
        }
        return true;
    }

    /** 큐가 빌 때까지(또는 timeout) 대기 */
    public boolean flush(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() > deadline) return false;
            Thread.sleep(10);
        }
        return true;
    }

    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public void close() {
        synchronized (this) {
            queue.tryEmitComplete();
        }
        pump.dispose();
    }

    private record LogLine(String jobId, String text) {}
}
