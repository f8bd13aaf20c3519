package net.gpumeter.core.worker;

import net.gpumeter.core.model.JobSpec;
import net.gpumeter.core.spi.ControllerGateway;
import net.gpumeter.core.spi.ControllerGateway.ClaimedDispatch;

import java.util.Optional;

/** 슬롯이 비어 있을 때만 디스패치 메시지를 선점해 실행. 슬롯은 accept 전에 예약한다 */
public final class DispatchLoop {
    private final ControllerGateway controller;
    private final ExecutionSupervisor supervisor;
    private final String workerToken;

    public DispatchLoop(ControllerGateway controller, ExecutionSupervisor supervisor, String workerToken) {
        this.controller = controller;
        this.supervisor = supervisor;
        this.workerToken = workerToken;
    }

    /** 잡 하나를 시작했으면 true */
    public boolean pollOnce() throws Exception {
        if (supervisor.isBusy()) return false;

        Optional<ClaimedDispatch> claimed = controller.claimDispatch(workerToken);
        if (claimed.isEmpty()) return false;
        ClaimedDispatch claim = claimed.get();

        if (!supervisor.reserve(claim.jobId())) {
            // 프로세스 안에 쌓지 않고 큐로 되돌림
            controller.requeue(claim, "worker busy");
            return false;
        }

        Optional<JobSpec> spec;
        try {
            spec = controller.accept(claim);
        } catch (Exception e) {
            supervisor.releaseReservation(claim.jobId());
            throw e;
        }
        if (spec.isEmpty()) {
            supervisor.releaseReservation(claim.jobId());
            return false;
        }

        // 예약된 슬롯이라 여기서는 busy가 나지 않는다
        supervisor.launch(spec.get());
        return true;
    }
}
