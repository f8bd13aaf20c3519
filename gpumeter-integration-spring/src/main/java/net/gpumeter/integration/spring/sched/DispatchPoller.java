package net.gpumeter.integration.spring.sched;

import net.gpumeter.core.worker.DispatchLoop;
import org.springframework.scheduling.annotation.Scheduled;

/** 워커 측: 슬롯이 비면 큐에서 다음 잡을 가져온다 */
public class DispatchPoller {
    private final DispatchLoop loop;

    public DispatchPoller(DispatchLoop loop) {
        this.loop = loop;
    }

    @Scheduled(initialDelayString = "${gpumeter.scheduler.initial-delay-ms:5000}",
            fixedDelayString = "${gpumeter.worker.poll-delay-ms:2000}")
    public void poll() throws Exception {
        loop.pollOnce();
    }
}
