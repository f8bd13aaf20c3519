package net.gpumeter.adapter.runtime.docker;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/** 외부 명령 실행. docker CLI 호출을 테스트에서 바꿔 끼우기 위한 경계 */
public interface CommandExecutor {

    /** 완료까지 대기. timeout을 넘기면 프로세스를 죽이고 timedOut=true */
    CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;

    /** 장시간 실행(로그 follow 등). stderr는 stdout으로 합친다 */
    Process start(List<String> command) throws IOException;

    record CommandResult(int exitCode, String output, boolean timedOut) {
        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }
}
