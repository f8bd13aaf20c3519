package net.gpumeter.core.maintenance;

import net.gpumeter.core.dispatch.DispatchService;
import net.gpumeter.core.relay.LogEventRelay;
import net.gpumeter.core.service.BillingHeartbeatCoordinator;
import net.gpumeter.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final DispatchService dispatch;
    private final BillingHeartbeatCoordinator billing;
    private final LogEventRelay relay;
    private final Clock clock;

    public MaintenanceService(DispatchService dispatch,
                              BillingHeartbeatCoordinator billing,
                              LogEventRelay relay,
                              Clock clock) {
        this.dispatch = dispatch;
        this.billing = billing;
        this.relay = relay;
        this.clock = clock;
    }

    /**
     * 주기 점검 메인 루틴.
     * - 만료된 디스패치 lease 회수
     * - ack 기한 지난 kill 강제 종결
     * - 하트비트 끊긴 RUNNING, 오래 멈춘 PREPARING 실패 처리
     * - 정리 대상 릴레이 채널 제거
     */
    public MaintenanceReport runOnce() throws Exception {
        MaintenanceReport r = new MaintenanceReport();
        r.timestamp = clock.now();

        // 1) 선점 후 사라진 워커의 메시지 재노출
        r.reclaimedLeases = dispatch.reclaimExpiredLeases();

        // 2) kill ack 타임아웃 → 잡 터미널
        r.killAckTimeouts = billing.sweepKillAckTimeouts();

        // 3) 하트비트 누락 → FAILED(heartbeat_timeout)
        r.missedHeartbeats = billing.sweepMissedHeartbeats();

        // 4) PREPARING 정체 → FAILED(preparing_timeout)
        r.stalePreparing = billing.sweepStalePreparing();

        // 5) 릴레이 채널 정리
        r.evictedChannels = relay.evictExpired();

        if (r.changedAnything()) log.info("{}", r);
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int reclaimedLeases;
        public int killAckTimeouts;
        public int missedHeartbeats;
        public int stalePreparing;
        public int evictedChannels;

        public boolean changedAnything() {
            return reclaimedLeases + killAckTimeouts + missedHeartbeats + stalePreparing + evictedChannels > 0;
        }

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", reclaimedLeases=" + reclaimedLeases +
                    ", killAckTimeouts=" + killAckTimeouts +
                    ", missedHeartbeats=" + missedHeartbeats +
                    ", stalePreparing=" + stalePreparing +
                    ", evictedChannels=" + evictedChannels +
                    '}';
        }
    }
}
