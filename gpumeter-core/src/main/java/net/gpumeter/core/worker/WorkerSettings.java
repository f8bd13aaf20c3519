package net.gpumeter.core.worker;

import java.time.Duration;
import java.util.List;

/**
 * @param workerToken          디스패치 lease 소유자 식별자
 * @param killGrace            SIGTERM 후 SIGKILL까지 대기
 * @param maxUndeliveredTicks  이 수를 넘게 하트비트가 밀리면 컨트롤러 단절로 보고 종료
 * @param killPollInterval     kill 명령 폴링 주기
 * @param logBufferLines       logs/output.log로 남길 최대 라인 수
 * @param interpreter          엔트리 스크립트 실행 명령 (예: python3)
 * @param gpuCount             샌드박스에 붙일 GPU 수
 * @param pidsLimit            fork bomb 방지
 * @param forwarderCapacity    로그 전달 큐 크기
 * @param reconnect            로그 전달 재시도 정책
 */
public record WorkerSettings(
        String workerToken,
        Duration killGrace,
        int maxUndeliveredTicks,
        Duration killPollInterval,
        int logBufferLines,
        List<String> interpreter,
        int gpuCount,
        int pidsLimit,
        int forwarderCapacity,
        ReconnectPolicy reconnect
) {
    public WorkerSettings {
        interpreter = List.copyOf(interpreter);
        if (maxUndeliveredTicks < 1) throw new IllegalArgumentException("maxUndeliveredTicks must be >= 1");
        if (logBufferLines < 1) throw new IllegalArgumentException("logBufferLines must be >= 1");
    }

    public static WorkerSettings defaults(String workerToken) {
        return new WorkerSettings(workerToken, Duration.ofSeconds(10), 3, Duration.ofSeconds(2), 10_000,
                List.of("python3"), 1, 256, 1_000, ReconnectPolicy.defaults());
    }
}
