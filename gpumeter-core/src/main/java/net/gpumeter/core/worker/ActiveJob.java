package net.gpumeter.core.worker;

import net.gpumeter.core.model.JobSpec;
import net.gpumeter.core.spi.SandboxHandle;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/** 워커 슬롯을 차지한 잡의 일시적 사본 */
final class ActiveJob {
    private final JobSpec spec;
    private final Instant acceptedAt;
    private final int logCapacity;

    private volatile SandboxHandle handle;
    private volatile Instant startedAt;
    private volatile Instant lastDeliveredAt;
    private volatile String workerReason;
    private volatile Thread pump;
    private final AtomicBoolean stopping = new AtomicBoolean();
    private final AtomicLong ticks = new AtomicLong();
    private final Deque<Long> backlog = new ArrayDeque<>();
    private final Deque<String> logTail = new ArrayDeque<>();
    private long truncatedLines;
    private final Set<Long> killCommandIds = ConcurrentHashMap.newKeySet();
    private final List<ScheduledFuture<?>> timers = new ArrayList<>();
    private final CountDownLatch finished = new CountDownLatch(1);

    ActiveJob(JobSpec spec, Instant acceptedAt, int logCapacity) {
        this.spec = spec;
        this.acceptedAt = acceptedAt;
        this.logCapacity = logCapacity;
    }

    String jobId() { return spec.jobId(); }
    JobSpec spec() { return spec; }
    Instant acceptedAt() { return acceptedAt; }

    SandboxHandle handle() { return handle; }
    void attach(SandboxHandle h, Instant at) { this.handle = h; this.startedAt = at; this.lastDeliveredAt = at; }
    Instant startedAt() { return startedAt; }

    void attachPump(Thread t) { this.pump = t; }
    Thread pump() { return pump; }

    /** 최초 1회만 true. 사유는 워커 자체 판단일 때만 (컨트롤러 지시면 null) */
    boolean beginStopping(String reason) {
        if (!stopping.compareAndSet(false, true)) return false;
        this.workerReason = reason;
        return true;
    }
    boolean isStopping() { return stopping.get(); }
    String workerReason() { return workerReason; }

    // --- ticks / backlog

    synchronized long enqueueNextTick() {
        long seq = ticks.incrementAndGet();
        backlog.addLast(seq);
        return seq;
    }
    synchronized Long peekTick() { return backlog.peekFirst(); }
    synchronized void tickDelivered(long seq, Instant at) {
        if (Long.valueOf(seq).equals(backlog.peekFirst())) backlog.pollFirst();
        lastDeliveredAt = at;
    }
    synchronized int backlogSize() { return backlog.size(); }
    long ticksGenerated() { return ticks.get(); }
    Instant lastDeliveredAt() { return lastDeliveredAt; }

    // --- logs

    synchronized void appendLog(String line) {
        if (logTail.size() >= logCapacity) {
            logTail.pollFirst();
            truncatedLines++;
        }
        logTail.addLast(line);
    }

    synchronized byte[] logBytes() {
        StringBuilder sb = new StringBuilder();
        if (truncatedLines > 0) sb.append("[").append(truncatedLines).append(" earlier lines truncated]\n");
        for (String l : logTail) sb.append(l).append('\n');
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    // --- kill commands / timers

    void addKillCommand(long id) { killCommandIds.add(id); }
    Set<Long> killCommandIds() { return killCommandIds; }

    synchronized void addTimer(ScheduledFuture<?> f) { timers.add(f); }
    synchronized void cancelTimers() {
        for (ScheduledFuture<?> f : timers) f.cancel(false);
        timers.clear();
    }

    void markFinished() { finished.countDown(); }
    CountDownLatch finished() { return finished; }
}
