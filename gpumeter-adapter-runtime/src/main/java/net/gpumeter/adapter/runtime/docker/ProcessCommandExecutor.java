package net.gpumeter.adapter.runtime.docker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** ProcessBuilder 기반 기본 구현 */
public final class ProcessCommandExecutor implements CommandExecutor {
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandExecutor.class);

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        Process p = start(command);
        p.getOutputStream().close();

        // 출력이 파이프 버퍼를 채워 멈추지 않도록 별도 스레드에서 소진
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Thread pump = new Thread(() -> drain(p.getInputStream(), out), "cmd-output");
        pump.setDaemon(true);
        pump.start();

        if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            p.destroyForcibly();
            p.waitFor(1, TimeUnit.SECONDS);
            pump.join(1_000);
            return new CommandResult(-1, output(out), true);
        }
        pump.join(5_000);
        return new CommandResult(p.exitValue(), output(out), false);
    }

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        return pb.start();
    }

    private static void drain(InputStream in, ByteArrayOutputStream out) {
        try (in) {
            byte[] buf = new byte[8192];
            int n;
            while ((n = in.read(buf)) >= 0) {
                synchronized (out) {
                    out.write(buf, 0, n);
                }
            }
        } catch (IOException e) {
            // 강제 종료된 프로세스의 스트림
            log.debug("command output closed early: {}", e.toString());
        }
    }

    private static String output(ByteArrayOutputStream out) {
        synchronized (out) {
            return out.toString(StandardCharsets.UTF_8).strip();
        }
    }
}
