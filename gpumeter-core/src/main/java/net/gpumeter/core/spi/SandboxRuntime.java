package net.gpumeter.core.spi;

import net.gpumeter.core.error.SandboxCreationException;

import java.time.Duration;
import java.util.Optional;
import java.util.stream.Stream;

/** 컨테이너 런타임 추상화 (워커 전용) */
public interface SandboxRuntime {
    enum Signal { TERM, KILL }

    SandboxHandle create(SandboxRequest request) throws SandboxCreationException;

    void signal(SandboxHandle handle, Signal signal) throws Exception;

    /** timeout 안에 종료되면 종료 정보, 아니면 empty */
    Optional<SandboxExit> await(SandboxHandle handle, Duration timeout) throws Exception;

    /** stdout+stderr 라인 스트림. 프로세스 종료 시 끝남 */
    Stream<String> stdout(SandboxHandle handle) throws Exception;

    void remove(SandboxHandle handle) throws Exception;

    /** 워커 재시작 시 이전 실행의 잔여 샌드박스 정리 */
    default int removeOrphans() throws Exception {
        return 0;
    }
}
