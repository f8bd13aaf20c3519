package net.gpumeter.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("gpumeter")
public class GpuMeterProperties {
    private Billing billing = new Billing();
    private Heartbeat heartbeat = new Heartbeat();
    private Submission submission = new Submission();
    private Dispatch dispatch = new Dispatch();
    private Worker worker = new Worker();
    private Relay relay = new Relay();
    private Scheduler scheduler = new Scheduler();
    private Storage storage = new Storage();

    public Billing getBilling() {
        return billing;
    }

    public void setBilling(Billing billing) {
        this.billing = billing;
    }

    public Heartbeat getHeartbeat() {
        return heartbeat;
    }

    public void setHeartbeat(Heartbeat heartbeat) {
        this.heartbeat = heartbeat;
    }

    public Submission getSubmission() {
        return submission;
    }

    public void setSubmission(Submission submission) {
        this.submission = submission;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Relay getRelay() {
        return relay;
    }

    public void setRelay(Relay relay) {
        this.relay = relay;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    /** 요율 / 틱 / 예약 */
    public static class Billing {
        private BigDecimal ratePerMinute = new BigDecimal("1.00");
        private int tickSeconds = 60;
        private int reservationTicks = 2;
        private BigDecimal minimumStartBalance = new BigDecimal("10.00");

        public BigDecimal getRatePerMinute() {
            return ratePerMinute;
        }

        public void setRatePerMinute(BigDecimal ratePerMinute) {
            this.ratePerMinute = ratePerMinute;
        }

        public int getTickSeconds() {
            return tickSeconds;
        }

        public void setTickSeconds(int tickSeconds) {
            this.tickSeconds = tickSeconds;
        }

        public int getReservationTicks() {
            return reservationTicks;
        }

        public void setReservationTicks(int reservationTicks) {
            this.reservationTicks = reservationTicks;
        }

        public BigDecimal getMinimumStartBalance() {
            return minimumStartBalance;
        }

        public void setMinimumStartBalance(BigDecimal minimumStartBalance) {
            this.minimumStartBalance = minimumStartBalance;
        }
    }

    /** 실패 감지: 하트비트 유예, kill ack 기한, PREPARING 체류 한도 */
    public static class Heartbeat {
        private Duration grace = Duration.ofSeconds(30);
        private int killAckTimeoutTicks = 3;
        private Duration preparingTimeout = Duration.ofMinutes(15);

        public Duration getGrace() {
            return grace;
        }

        public void setGrace(Duration grace) {
            this.grace = grace;
        }

        public int getKillAckTimeoutTicks() {
            return killAckTimeoutTicks;
        }

        public void setKillAckTimeoutTicks(int killAckTimeoutTicks) {
            this.killAckTimeoutTicks = killAckTimeoutTicks;
        }

        public Duration getPreparingTimeout() {
            return preparingTimeout;
        }

        public void setPreparingTimeout(Duration preparingTimeout) {
            this.preparingTimeout = preparingTimeout;
        }
    }

    public static class Submission {
        private int maxActiveJobsPerUser = 3;
        private int maxTimeoutSeconds = 14_400;
        private double maxCpuCount = 16;
        private long maxMemoryBytes = 64L * 1024 * 1024 * 1024;
        private long maxInputBytes = 500L * 1024 * 1024;
        private int uploadMaxAttempts = 3;
        private Duration uploadBackoff = Duration.ofMillis(500);

        public int getMaxActiveJobsPerUser() {
            return maxActiveJobsPerUser;
        }

        public void setMaxActiveJobsPerUser(int maxActiveJobsPerUser) {
            this.maxActiveJobsPerUser = maxActiveJobsPerUser;
        }

        public int getMaxTimeoutSeconds() {
            return maxTimeoutSeconds;
        }

        public void setMaxTimeoutSeconds(int maxTimeoutSeconds) {
            this.maxTimeoutSeconds = maxTimeoutSeconds;
        }

        public double getMaxCpuCount() {
            return maxCpuCount;
        }

        public void setMaxCpuCount(double maxCpuCount) {
            this.maxCpuCount = maxCpuCount;
        }

        public long getMaxMemoryBytes() {
            return maxMemoryBytes;
        }

        public void setMaxMemoryBytes(long maxMemoryBytes) {
            this.maxMemoryBytes = maxMemoryBytes;
        }

        public long getMaxInputBytes() {
            return maxInputBytes;
        }

        public void setMaxInputBytes(long maxInputBytes) {
            this.maxInputBytes = maxInputBytes;
        }

        public int getUploadMaxAttempts() {
            return uploadMaxAttempts;
        }

        public void setUploadMaxAttempts(int uploadMaxAttempts) {
            this.uploadMaxAttempts = uploadMaxAttempts;
        }

        public Duration getUploadBackoff() {
            return uploadBackoff;
        }

        public void setUploadBackoff(Duration uploadBackoff) {
            this.uploadBackoff = uploadBackoff;
        }
    }

    public static class Dispatch {
        private Duration lease = Duration.ofMinutes(5);
        private Duration busyBackoff = Duration.ofSeconds(10);
        private int killPollBatch = 50;

        public Duration getLease() {
            return lease;
        }

        public void setLease(Duration lease) {
            this.lease = lease;
        }

        public Duration getBusyBackoff() {
            return busyBackoff;
        }

        public void setBusyBackoff(Duration busyBackoff) {
            this.busyBackoff = busyBackoff;
        }

        public int getKillPollBatch() {
            return killPollBatch;
        }

        public void setKillPollBatch(int killPollBatch) {
            this.killPollBatch = killPollBatch;
        }
    }

    /** 프로세스 내 워커 (단일 실행 슬롯) */
    public static class Worker {
        private boolean enabled = true;
        private String token = "worker-1";
        private String dockerBinary = "docker";
        private Duration dockerCommandTimeout = Duration.ofMinutes(2);
        private Duration killGrace = Duration.ofSeconds(10);
        private int maxUndeliveredTicks = 3;
        private Duration killPollInterval = Duration.ofSeconds(2);
        private int logBufferLines = 10_000;
        private List<String> interpreter = new ArrayList<>(List.of("python3"));
        private int gpuCount = 1;
        private int pidsLimit = 256;
        private int forwarderCapacity = 1_000;
        private int reconnectMaxAttempts = 5;
        private Duration reconnectMinBackoff = Duration.ofMillis(200);
        private Duration reconnectMaxBackoff = Duration.ofSeconds(5);
        private long pollDelayMs = 2000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getDockerBinary() {
            return dockerBinary;
        }

        public void setDockerBinary(String dockerBinary) {
            this.dockerBinary = dockerBinary;
        }

        public Duration getDockerCommandTimeout() {
            return dockerCommandTimeout;
        }

        public void setDockerCommandTimeout(Duration dockerCommandTimeout) {
            this.dockerCommandTimeout = dockerCommandTimeout;
        }

        public Duration getKillGrace() {
            return killGrace;
        }

        public void setKillGrace(Duration killGrace) {
            this.killGrace = killGrace;
        }

        public int getMaxUndeliveredTicks() {
            return maxUndeliveredTicks;
        }

        public void setMaxUndeliveredTicks(int maxUndeliveredTicks) {
            this.maxUndeliveredTicks = maxUndeliveredTicks;
        }

        public Duration getKillPollInterval() {
            return killPollInterval;
        }

        public void setKillPollInterval(Duration killPollInterval) {
            this.killPollInterval = killPollInterval;
        }

        public int getLogBufferLines() {
            return logBufferLines;
        }

        public void setLogBufferLines(int logBufferLines) {
            this.logBufferLines = logBufferLines;
        }

        public List<String> getInterpreter() {
            return interpreter;
        }

        public void setInterpreter(List<String> interpreter) {
            this.interpreter = interpreter;
        }

        public int getGpuCount() {
            return gpuCount;
        }

        public void setGpuCount(int gpuCount) {
            this.gpuCount = gpuCount;
        }

        public int getPidsLimit() {
            return pidsLimit;
        }

        public void setPidsLimit(int pidsLimit) {
            this.pidsLimit = pidsLimit;
        }

        public int getForwarderCapacity() {
            return forwarderCapacity;
        }

        public void setForwarderCapacity(int forwarderCapacity) {
            this.forwarderCapacity = forwarderCapacity;
        }

        public int getReconnectMaxAttempts() {
            return reconnectMaxAttempts;
        }

        public void setReconnectMaxAttempts(int reconnectMaxAttempts) {
            this.reconnectMaxAttempts = reconnectMaxAttempts;
        }

        public Duration getReconnectMinBackoff() {
            return reconnectMinBackoff;
        }

        public void setReconnectMinBackoff(Duration reconnectMinBackoff) {
            this.reconnectMinBackoff = reconnectMinBackoff;
        }

        public Duration getReconnectMaxBackoff() {
            return reconnectMaxBackoff;
        }

        public void setReconnectMaxBackoff(Duration reconnectMaxBackoff) {
            this.reconnectMaxBackoff = reconnectMaxBackoff;
        }

        public long getPollDelayMs() {
            return pollDelayMs;
        }

        public void setPollDelayMs(long pollDelayMs) {
            this.pollDelayMs = pollDelayMs;
        }
    }

    public static class Relay {
        private int replaySize = 1_000;
        private int subscriberBufferSize = 256;
        private Duration retention = Duration.ofMinutes(10);
        private Duration idleTimeout = Duration.ofHours(6);

        public int getReplaySize() {
            return replaySize;
        }

        public void setReplaySize(int replaySize) {
            this.replaySize = replaySize;
        }

        public int getSubscriberBufferSize() {
            return subscriberBufferSize;
        }

        public void setSubscriberBufferSize(int subscriberBufferSize) {
            this.subscriberBufferSize = subscriberBufferSize;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long initialDelayMs = 5000;
        private long maintenanceDelayMs = 10000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }
    }

    /** 공유 파일시스템 루트 (jobs/{jobId}/...) */
    public static class Storage {
        private Path root = Path.of("./data");

        public Path getRoot() {
            return root;
        }

        public void setRoot(Path root) {
            this.root = root;
        }
    }
}
