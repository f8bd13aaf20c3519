package net.gpumeter.adapter.runtime.docker;

import net.gpumeter.core.error.SandboxCreationException;
import net.gpumeter.core.model.ResourceConfig;
import net.gpumeter.core.spi.SandboxExit;
import net.gpumeter.core.spi.SandboxHandle;
import net.gpumeter.core.spi.SandboxRequest;
import net.gpumeter.core.spi.SandboxRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * docker CLI 인자 구성 / 결과 해석 테스트 (docker 불필요, 기록용 executor)
 */
class DockerCliSandboxRuntimeTest {

    private RecordingExecutor exec;
    private DockerCliSandboxRuntime runtime;

    @BeforeEach
    void setUp() {
        exec = new RecordingExecutor();
        runtime = new DockerCliSandboxRuntime(exec, "docker", "worker-1", Duration.ofSeconds(30));
    }

    @Test
    void run_command_isolates_the_sandbox() {
        List<String> cmd = runtime.runCommand(request(1, true));

        assertThat(cmd).startsWith("docker", "run", "--detach", "--name", "job-j1");
        assertThat(String.join(" ", cmd))
                .contains("--label net.gpumeter.worker=worker-1")
                .contains("--label net.gpumeter.job-id=j1")
                .contains("--network none")
                .contains("--memory 536870912 --memory-swap 536870912")
                .contains("--cpus 1.50")
                .contains("--pids-limit 256")
                .contains("--cap-drop ALL")
                .contains("--gpus 1")
                .contains(":/workspace/input:ro")
                .contains(":/workspace/output:rw")
                .contains("--workdir /workspace")
                .contains("--env JOB_ID=j1");
        assertThat(cmd).endsWith("pytorch/pytorch:2.2.0", "python", "train.py");
    }

    @Test
    void gpu_and_network_flags_are_omitted_when_not_requested() {
        List<String> cmd = runtime.runCommand(request(0, false));

        assertThat(cmd).doesNotContain("--gpus", "--network");
    }

    @Test
    void create_returns_the_container_id() throws Exception {
        exec.reply(0, "abcdef0123456789\n");

        SandboxHandle h = runtime.create(request(1, true));

        assertThat(h.sandboxId()).isEqualTo("abcdef0123456789");
        assertThat(h.jobId()).isEqualTo("j1");
    }

    @Test
    void failed_docker_run_is_a_creation_failure() {
        exec.reply(125, "Unable to find image 'pytorch/pytorch:2.2.0' locally");

        assertThatThrownBy(() -> runtime.create(request(1, true)))
                .isInstanceOf(SandboxCreationException.class)
                .hasMessageContaining("exited with 125");
    }

    @Test
    void missing_docker_binary_is_a_creation_failure() {
        exec.failWith(new IOException("Cannot run program \"docker\""));

        assertThatThrownBy(() -> runtime.create(request(1, true)))
                .isInstanceOf(SandboxCreationException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void await_reads_exit_code_and_oom_flag() throws Exception {
        exec.reply(0, "137\n");
        exec.reply(0, "true\n");

        Optional<SandboxExit> exit = runtime.await(new SandboxHandle("c1", "j1"), Duration.ofSeconds(5));

        assertThat(exit).contains(new SandboxExit(137, true));
        assertThat(exec.calls.get(0)).containsExactly("docker", "wait", "c1");
        assertThat(exec.calls.get(1)).contains("inspect", "{{.State.OOMKilled}}", "c1");
    }

    @Test
    void await_is_empty_while_the_sandbox_is_still_running() throws Exception {
        exec.timeout();

        assertThat(runtime.await(new SandboxHandle("c1", "j1"), Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void signals_map_to_docker_kill() throws Exception {
        SandboxHandle h = new SandboxHandle("c1", "j1");
        exec.reply(0, "c1");
        exec.reply(1, "No such container: c1");

        runtime.signal(h, SandboxRuntime.Signal.TERM);
        runtime.signal(h, SandboxRuntime.Signal.KILL);

        assertThat(exec.calls.get(0)).containsExactly("docker", "kill", "--signal", "SIGTERM", "c1");
        assertThat(exec.calls.get(1)).containsExactly("docker", "kill", "--signal", "SIGKILL", "c1");
    }

    @Test
    void orphans_of_this_worker_are_removed() throws Exception {
        exec.reply(0, "aaa\nbbb\n");
        exec.reply(0, "aaa");
        exec.reply(1, "removal in progress");

        assertThat(runtime.removeOrphans()).isEqualTo(1);
        assertThat(exec.calls.get(0)).contains("label=net.gpumeter.worker=worker-1");
        assertThat(exec.calls.get(1)).containsExactly("docker", "rm", "--force", "aaa");
        assertThat(exec.calls.get(2)).containsExactly("docker", "rm", "--force", "bbb");
    }

    // ---------- helpers ----------

    private static SandboxRequest request(int gpus, boolean networkDisabled) {
        return new SandboxRequest("j1", "pytorch/pytorch:2.2.0", List.of("python", "train.py"),
                Map.of("JOB_ID", "j1"), new ResourceConfig("512m", 1.5, 600),
                Path.of("/data/jobs/j1/input"), Path.of("/data/jobs/j1/output"),
                gpus, 256, networkDisabled);
    }

    /** 호출을 기록하고 미리 지정한 결과를 순서대로 돌려준다 */
    static final class RecordingExecutor implements CommandExecutor {
        final List<List<String>> calls = new ArrayList<>();
        private final Deque<Object> replies = new ArrayDeque<>();

        void reply(int exitCode, String output) {
            replies.add(new CommandResult(exitCode, output, false));
        }

        void timeout() {
            replies.add(new CommandResult(-1, "", true));
        }

        void failWith(IOException e) {
            replies.add(e);
        }

        @Override
        public CommandResult run(List<String> command, Duration timeout) throws IOException {
            calls.add(List.copyOf(command));
            Object r = replies.poll();
            if (r == null) return new CommandResult(0, "", false);
            if (r instanceof IOException e) throw e;
            return (CommandResult) r;
        }

        @Override
        public Process start(List<String> command) throws IOException {
            throw new IOException("streaming not supported in tests");
        }
    }
}
