package net.gpumeter.integration.spring.sched;

import net.gpumeter.core.maintenance.MaintenanceService;
import org.springframework.scheduling.annotation.Scheduled;

/** 컨트롤러 측 주기 점검 (lease 회수, kill ack 타임아웃, 하트비트 누락, 릴레이 정리) */
public class GpuMeterSchedulers {
    private final MaintenanceService maintenance;

    public GpuMeterSchedulers(MaintenanceService maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(initialDelayString = "${gpumeter.scheduler.initial-delay-ms:5000}",
            fixedDelayString = "${gpumeter.scheduler.maintenance-delay-ms:10000}")
    public void maintenance() throws Exception {
        maintenance.runOnce();
    }
}
