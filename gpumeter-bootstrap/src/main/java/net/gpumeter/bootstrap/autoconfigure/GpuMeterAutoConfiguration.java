package net.gpumeter.bootstrap.autoconfigure;

import net.gpumeter.adapter.runtime.docker.DockerCliSandboxRuntime;
import net.gpumeter.adapter.runtime.docker.ProcessCommandExecutor;
import net.gpumeter.adapter.runtime.storage.FileSystemBlobStore;
import net.gpumeter.bootstrap.props.GpuMeterProperties;
import net.gpumeter.core.dispatch.DispatchService;
import net.gpumeter.core.gateway.LocalControllerGateway;
import net.gpumeter.core.ledger.WalletLedgerService;
import net.gpumeter.core.maintenance.MaintenanceService;
import net.gpumeter.core.relay.LogEventRelay;
import net.gpumeter.core.service.*;
import net.gpumeter.core.spi.*;
import net.gpumeter.core.worker.DispatchLoop;
import net.gpumeter.core.worker.ExecutionSupervisor;
import net.gpumeter.core.worker.ReconnectPolicy;
import net.gpumeter.core.worker.WorkerSettings;
import net.gpumeter.integration.spring.GpuMeterSpringConfig;
import net.gpumeter.integration.spring.sched.DispatchPoller;
import net.gpumeter.integration.spring.sched.GpuMeterSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@EnableConfigurationProperties(GpuMeterProperties.class)
@Import(GpuMeterSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class GpuMeterAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(GpuMeterAutoConfiguration.class);

    // --- 정책 ---

    @Bean
    @ConditionalOnMissingBean
    public BillingPolicy billingPolicy(GpuMeterProperties props) {
        var b = props.getBilling();
        var h = props.getHeartbeat();
        var policy = new BillingPolicy(b.getRatePerMinute(), b.getTickSeconds(), b.getReservationTicks(),
                b.getMinimumStartBalance(), h.getGrace(), h.getKillAckTimeoutTicks(), h.getPreparingTimeout());
        log.info("billing: rate={}/min tick={}s (cost {}), reservation {} ticks",
                policy.ratePerMinute(), policy.tickSeconds(), policy.tickCost(), policy.reservationTicks());
        return policy;
    }

    @Bean
    @ConditionalOnMissingBean
    public SubmissionPolicy submissionPolicy(GpuMeterProperties props) {
        var s = props.getSubmission();
        return new SubmissionPolicy(s.getMaxActiveJobsPerUser(), s.getMaxTimeoutSeconds(), s.getMaxCpuCount(),
                s.getMaxMemoryBytes(), s.getMaxInputBytes());
    }

    // --- 공유 저장소 (컨트롤러: 입력 업로드, 워커: 마운트/로그) ---

    @Bean
    @ConditionalOnMissingBean(BlobStore.class)
    public BlobStore blobStore(GpuMeterProperties props) {
        return new FileSystemBlobStore(props.getStorage().getRoot());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public LogEventRelay logEventRelay(GpuMeterProperties props, Clock clock) {
        var r = props.getRelay();
        return new LogEventRelay(r.getReplaySize(), r.getSubscriberBufferSize(), r.getRetention(), r.getIdleTimeout(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public WalletLedgerService walletLedger(WalletRepository wallets,
                                            LedgerRepository ledger,
                                            ReservationRepository reservations,
                                            TxRunner tx,
                                            Clock clock) {
        return new WalletLedgerService(wallets, ledger, reservations, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchService dispatchService(DispatchRepository messages, TxRunner tx, GpuMeterProperties props) {
        return new DispatchService(messages, tx, RetryPolicy.fixed(props.getDispatch().getBusyBackoff()));
    }

    @Bean
    @ConditionalOnMissingBean
    public KillSwitch killSwitch(KillCommandRepository commands, BillingPolicy policy, TxRunner tx, Clock clock) {
        return new KillSwitch(commands, policy, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public BillingHeartbeatCoordinator billingCoordinator(JobRecordRepository jobs,
                                                          KillCommandRepository commands,
                                                          WalletLedgerService ledger,
                                                          KillSwitch kills,
                                                          LogEventRelay relay,
                                                          BillingPolicy policy,
                                                          TxRunner tx,
                                                          Clock clock) {
        return new BillingHeartbeatCoordinator(jobs, commands, ledger, kills, relay, policy, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobLifecycleService jobLifecycle(JobRecordRepository jobs,
                                            KillCommandRepository commands,
                                            WalletLedgerService ledger,
                                            DispatchService dispatch,
                                            KillSwitch kills,
                                            BlobStore blobs,
                                            LogEventRelay relay,
                                            BillingPolicy billing,
                                            SubmissionPolicy limits,
                                            TxRunner tx,
                                            Clock clock,
                                            GpuMeterProperties props) {
        var s = props.getSubmission();
        Retrier retrier = new Retrier(RetryPolicy.exponential(s.getUploadBackoff(), s.getUploadBackoff().multipliedBy(8)),
                s.getUploadMaxAttempts());
        return new JobLifecycleService(jobs, commands, ledger, dispatch, kills, blobs, relay, billing, limits, retrier, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(DispatchService dispatch,
                                          BillingHeartbeatCoordinator billing,
                                          LogEventRelay relay,
                                          Clock clock) {
        return new MaintenanceService(dispatch, billing, relay, clock);
    }

    @Bean
    @ConditionalOnMissingBean(ControllerGateway.class)
    public ControllerGateway controllerGateway(DispatchService dispatch,
                                               JobLifecycleService lifecycle,
                                               BillingHeartbeatCoordinator billing,
                                               KillSwitch kills,
                                               LogEventRelay relay,
                                               GpuMeterProperties props) {
        var d = props.getDispatch();
        return new LocalControllerGateway(dispatch, lifecycle, billing, kills, relay, d.getLease(), d.getKillPollBatch());
    }

    // --- 스케줄러 등록 (주기는 gpumeter.scheduler.* 키에서 읽힘) ---

    @Bean
    @ConditionalOnProperty(prefix = "gpumeter.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public GpuMeterSchedulers gpuMeterSchedulers(MaintenanceService maintenance) {
        return new GpuMeterSchedulers(maintenance);
    }

    // --- 프로세스 내 워커 ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "gpumeter.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class WorkerConfiguration {

        @Bean
        @ConditionalOnMissingBean(SandboxRuntime.class)
        public SandboxRuntime sandboxRuntime(GpuMeterProperties props) {
            var w = props.getWorker();
            return new DockerCliSandboxRuntime(new ProcessCommandExecutor(), w.getDockerBinary(), w.getToken(),
                    w.getDockerCommandTimeout());
        }

        @Bean
        @ConditionalOnMissingBean
        public WorkerSettings workerSettings(GpuMeterProperties props) {
            var w = props.getWorker();
            return new WorkerSettings(w.getToken(), w.getKillGrace(), w.getMaxUndeliveredTicks(), w.getKillPollInterval(),
                    w.getLogBufferLines(), w.getInterpreter(), w.getGpuCount(), w.getPidsLimit(), w.getForwarderCapacity(),
                    new ReconnectPolicy(w.getReconnectMaxAttempts(), w.getReconnectMinBackoff(), w.getReconnectMaxBackoff()));
        }

        @Bean(initMethod = "start", destroyMethod = "close")
        @ConditionalOnMissingBean
        public ExecutionSupervisor executionSupervisor(SandboxRuntime runtime,
                                                       BlobStore blobs,
                                                       ControllerGateway controller,
                                                       WorkerSettings settings,
                                                       Clock clock) {
            return new ExecutionSupervisor(runtime, blobs, controller, settings, clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public DispatchLoop dispatchLoop(ControllerGateway controller, ExecutionSupervisor supervisor, WorkerSettings settings) {
            return new DispatchLoop(controller, supervisor, settings.workerToken());
        }

        @Bean
        @ConditionalOnProperty(prefix = "gpumeter.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
        public DispatchPoller dispatchPoller(DispatchLoop loop) {
            return new DispatchPoller(loop);
        }
    }
}
