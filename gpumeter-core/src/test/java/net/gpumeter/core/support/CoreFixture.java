package net.gpumeter.core.support;

import net.gpumeter.core.dispatch.DispatchService;
import net.gpumeter.core.gateway.LocalControllerGateway;
import net.gpumeter.core.ledger.WalletLedgerService;
import net.gpumeter.core.maintenance.MaintenanceService;
import net.gpumeter.core.model.DispatchMessage;
import net.gpumeter.core.model.Heartbeat;
import net.gpumeter.core.model.HeartbeatVerdict;
import net.gpumeter.core.model.JobRecord;
import net.gpumeter.core.model.Money;
import net.gpumeter.core.model.ResourceConfig;
import net.gpumeter.core.model.SubmitJobRequest;
import net.gpumeter.core.relay.LogEventRelay;
import net.gpumeter.core.service.BillingHeartbeatCoordinator;
import net.gpumeter.core.service.BillingPolicy;
import net.gpumeter.core.service.JobLifecycleService;
import net.gpumeter.core.service.KillSwitch;
import net.gpumeter.core.service.Retrier;
import net.gpumeter.core.service.RetryPolicy;
import net.gpumeter.core.service.SubmissionPolicy;
import net.gpumeter.core.spi.Clock;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/** 인메모리 SPI 위에 컨트롤러 서비스 전체를 조립 */
public final class CoreFixture {
    public static final String SCRIPT = "train.py";

    public final Clock clock;
    public final InMemoryStore store;
    public final LockingTxRunner tx;
    public final InMemoryBlobStore blobs = new InMemoryBlobStore();
    public final LogEventRelay relay;
    public final WalletLedgerService ledger;
    public final DispatchService dispatch;
    public final KillSwitch kills;
    public final BillingHeartbeatCoordinator billing;
    public final JobLifecycleService lifecycle;
    public final MaintenanceService maintenance;
    public final LocalControllerGateway gateway;
    public final BillingPolicy policy;

    public CoreFixture(Clock clock, BillingPolicy policy, SubmissionPolicy limits) {
        this.clock = clock;
        this.policy = policy;
        this.store = new InMemoryStore(clock);
        this.tx = new LockingTxRunner(store);
        this.relay = new LogEventRelay(100, 256, Duration.ofMinutes(5), Duration.ofHours(1), clock);
        this.ledger = new WalletLedgerService(store.wallets(), store.ledger(), store.reservations(), tx, clock);
        this.dispatch = new DispatchService(store.dispatch(), tx, RetryPolicy.fixed(Duration.ZERO));
        this.kills = new KillSwitch(store.killCommands(), policy, tx, clock);
        this.billing = new BillingHeartbeatCoordinator(store.jobs(), store.killCommands(), ledger, kills, relay, policy, tx, clock);
        this.lifecycle = new JobLifecycleService(store.jobs(), store.killCommands(), ledger, dispatch, kills, blobs, relay,
                policy, limits, new Retrier(RetryPolicy.fixed(Duration.ZERO), 3), tx, clock);
        this.maintenance = new MaintenanceService(dispatch, billing, relay, clock);
        this.gateway = new LocalControllerGateway(dispatch, lifecycle, billing, kills, relay, Duration.ofMinutes(5), 50);
    }

    public CoreFixture(Clock clock, BillingPolicy policy) {
        this(clock, policy, SubmissionPolicy.defaults());
    }

    /** rate 1.00/min, T=60s (틱당 1.00), 예약 reservationTicks틱, 최소 시작 잔액 1.00 */
    public static BillingPolicy perMinute(int reservationTicks) {
        return new BillingPolicy(Money.of("1.00"), 60, reservationTicks, Money.of("1.00"),
                Duration.ofSeconds(30), 3, Duration.ofMinutes(15));
    }

    public void fund(String user, String amount) throws Exception {
        ledger.credit(user, Money.of(amount), "topup-" + UUID.randomUUID());
    }

    public static SubmitJobRequest request(String owner, int timeoutSeconds) {
        return new SubmitJobRequest(owner, "pytorch/pytorch:2.2.0-cuda12.1", SCRIPT,
                new ResourceConfig("4g", 2, timeoutSeconds),
                Map.of(SCRIPT, "print('hello')".getBytes(StandardCharsets.UTF_8)));
    }

    public String submit(String owner) throws Exception {
        return lifecycle.submit(request(owner, 3600));
    }

    /** 디스패치 선점 → accept → RUNNING */
    public void startRunning(String jobId) throws Exception {
        DispatchMessage m = dispatch.claimNext("test-worker", Duration.ofMinutes(1)).orElseThrow();
        if (!m.jobId().equals(jobId)) throw new IllegalStateException("claimed " + m.jobId() + " instead of " + jobId);
        lifecycle.accept(m.id(), jobId).orElseThrow();
        lifecycle.markRunning(jobId, "sbx-" + jobId.substring(0, 8));
    }

    public HeartbeatVerdict tick(String jobId, long seq) throws Exception {
        return billing.onHeartbeat(new Heartbeat(jobId, seq, clock.now(), policy.tickSeconds(), true));
    }

    public JobRecord job(String jobId) throws Exception {
        return lifecycle.get(jobId);
    }
}
