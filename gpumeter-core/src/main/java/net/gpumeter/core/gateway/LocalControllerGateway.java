package net.gpumeter.core.gateway;

import net.gpumeter.core.dispatch.DispatchService;
import net.gpumeter.core.model.Heartbeat;
import net.gpumeter.core.model.HeartbeatVerdict;
import net.gpumeter.core.model.JobSpec;
import net.gpumeter.core.model.KillCommand;
import net.gpumeter.core.relay.LogEventRelay;
import net.gpumeter.core.service.BillingHeartbeatCoordinator;
import net.gpumeter.core.service.JobLifecycleService;
import net.gpumeter.core.service.KillSwitch;
import net.gpumeter.core.spi.ControllerGateway;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** 컨트롤러와 워커가 한 프로세스에 있을 때의 게이트웨이 */
public final class LocalControllerGateway implements ControllerGateway {
    private final DispatchService dispatch;
    private final JobLifecycleService lifecycle;
    private final BillingHeartbeatCoordinator billing;
    private final KillSwitch kills;
    private final LogEventRelay relay;
    private final Duration lease;
    private final int killPollBatch;

    public LocalControllerGateway(DispatchService dispatch,
                                  JobLifecycleService lifecycle,
                                  BillingHeartbeatCoordinator billing,
                                  KillSwitch kills,
                                  LogEventRelay relay,
                                  Duration lease,
                                  int killPollBatch) {
        this.dispatch = dispatch;
        this.lifecycle = lifecycle;
        this.billing = billing;
        this.kills = kills;
        this.relay = relay;
        this.lease = lease;
        this.killPollBatch = killPollBatch;
    }

    @Override
    public Optional<ClaimedDispatch> claimDispatch(String workerToken) throws Exception {
        return dispatch.claimNext(workerToken, lease)
                .map(m -> new ClaimedDispatch(m.id(), m.jobId(), m.attempt()));
    }

    @Override
    public Optional<JobSpec> accept(ClaimedDispatch claim) throws Exception {
        return lifecycle.accept(claim.messageId(), claim.jobId());
    }

    @Override
    public void requeue(ClaimedDispatch claim, String reason) throws Exception {
        dispatch.requeue(claim.messageId(), claim.attempt(), reason);
    }

    @Override
    public boolean markRunning(String jobId, String sandboxId) throws Exception {
        return lifecycle.markRunning(jobId, sandboxId);
    }

    @Override
    public HeartbeatVerdict heartbeat(Heartbeat heartbeat) throws Exception {
        return billing.onHeartbeat(heartbeat);
    }

    @Override
    public void reportExit(String jobId, int exitCode, boolean oomKilled, String workerReason) throws Exception {
        lifecycle.onProcessExit(jobId, exitCode, oomKilled, workerReason);
    }

    @Override
    public void reportSetupFailure(String jobId, String message) throws Exception {
        lifecycle.onSetupFailure(jobId, message);
    }

    @Override
    public List<KillCommand> pollKillCommands() throws Exception {
        return kills.pollPending(killPollBatch);
    }

    @Override
    public void acknowledgeKill(long commandId, Integer exitCode) throws Exception {
        lifecycle.onKillAcknowledged(commandId, exitCode);
    }

    @Override
    public void forwardLog(String jobId, String line) {
        relay.publishLog(jobId, line);
    }
}
