package net.gpumeter.core.spi;

import net.gpumeter.core.model.Heartbeat;
import net.gpumeter.core.model.HeartbeatVerdict;
import net.gpumeter.core.model.JobSpec;
import net.gpumeter.core.model.KillCommand;

import java.util.List;
import java.util.Optional;

/**
 * 워커가 보는 컨트롤러.
 * 원격 구현은 전송 계층 오류를 예외로 던지고, 워커는 이를 "전달 실패"로 취급한다.
 */
public interface ControllerGateway {
    /** 디스패치 메시지 하나를 선점. 없으면 empty */
    Optional<ClaimedDispatch> claimDispatch(String workerToken) throws Exception;

    /** PENDING → PREPARING + 메시지 완료. 더 이상 PENDING이 아니면 empty */
    Optional<JobSpec> accept(ClaimedDispatch claim) throws Exception;

    /** 바쁜 워커가 메시지를 되돌림 */
    void requeue(ClaimedDispatch claim, String reason) throws Exception;

    /** false면 잡이 이미 PREPARING이 아님: 샌드박스를 내려야 함 */
    boolean markRunning(String jobId, String sandboxId) throws Exception;

    HeartbeatVerdict heartbeat(Heartbeat heartbeat) throws Exception;

    void reportExit(String jobId, int exitCode, boolean oomKilled, String workerReason) throws Exception;

    void reportSetupFailure(String jobId, String message) throws Exception;

    List<KillCommand> pollKillCommands() throws Exception;

    void acknowledgeKill(long commandId, Integer exitCode) throws Exception;

    void forwardLog(String jobId, String line) throws Exception;

    record ClaimedDispatch(long messageId, String jobId, int attempt) {}
}
