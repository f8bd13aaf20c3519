package net.gpumeter.adapter.runtime.docker;

import net.gpumeter.core.error.SandboxCreationException;
import net.gpumeter.core.model.ResourceConfig;
import net.gpumeter.core.spi.SandboxExit;
import net.gpumeter.core.spi.SandboxHandle;
import net.gpumeter.core.spi.SandboxRequest;
import net.gpumeter.core.spi.SandboxRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * docker CLI 기반 샌드박스 런타임.
 * 컨테이너는 network none, 메모리/CPU/pids 한도, 입력 ro / 출력 rw 마운트로 격리한다.
 * 워커 라벨로 표시해 재시작 시 잔여 컨테이너를 찾아 지운다.
 */
public final class DockerCliSandboxRuntime implements SandboxRuntime {
    private static final Logger log = LoggerFactory.getLogger(DockerCliSandboxRuntime.class);

    public static final String LABEL_WORKER = "net.gpumeter.worker";
    public static final String LABEL_JOB = "net.gpumeter.job-id";

    private final CommandExecutor exec;
    private final String docker;
    private final String workerToken;
    private final Duration commandTimeout;

    public DockerCliSandboxRuntime(CommandExecutor exec, String dockerBinary, String workerToken, Duration commandTimeout) {
        if (dockerBinary == null || dockerBinary.isBlank()) throw new IllegalArgumentException("dockerBinary is required");
        if (workerToken == null || workerToken.isBlank()) throw new IllegalArgumentException("workerToken is required");
        this.exec = exec;
        this.docker = dockerBinary;
        this.workerToken = workerToken;
        this.commandTimeout = commandTimeout;
    }

    public DockerCliSandboxRuntime(String workerToken) {
        this(new ProcessCommandExecutor(), "docker", workerToken, Duration.ofMinutes(2));
    }

    @Override
    public SandboxHandle create(SandboxRequest request) throws SandboxCreationException {
        List<String> cmd = runCommand(request);
        CommandExecutor.CommandResult r;
        try {
            r = exec.run(cmd, commandTimeout);
        } catch (IOException e) {
            throw new SandboxCreationException("docker run failed for job " + request.jobId() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxCreationException("interrupted while creating sandbox for job " + request.jobId(), e);
        }
        if (!r.succeeded()) {
            throw new SandboxCreationException("docker run for job " + request.jobId()
                    + (r.timedOut() ? " timed out" : " exited with " + r.exitCode()) + ": " + abbreviate(r.output()));
        }
        String id = lastLine(r.output());
        if (id.isEmpty()) throw new SandboxCreationException("docker run for job " + request.jobId() + " returned no container id");
        log.info("sandbox {} created for job {} (image={})", shortId(id), request.jobId(), request.image());
        return new SandboxHandle(id, request.jobId());
    }

    @Override
    public void signal(SandboxHandle handle, Signal signal) throws Exception {
        String sig = signal == Signal.KILL ? "SIGKILL" : "SIGTERM";
        CommandExecutor.CommandResult r = exec.run(List.of(docker, "kill", "--signal", sig, handle.sandboxId()), commandTimeout);
        if (!r.succeeded()) {
            // 이미 종료된 컨테이너
            log.debug("docker kill {} {} -> {}: {}", sig, shortId(handle.sandboxId()), r.exitCode(), r.output());
        }
    }

    @Override
    public Optional<SandboxExit> await(SandboxHandle handle, Duration timeout) throws Exception {
        CommandExecutor.CommandResult r = exec.run(List.of(docker, "wait", handle.sandboxId()), timeout);
        if (r.timedOut()) return Optional.empty();
        if (r.exitCode() != 0) {
            throw new IOException("docker wait " + shortId(handle.sandboxId()) + " failed: " + abbreviate(r.output()));
        }
        int exitCode = Integer.parseInt(lastLine(r.output()));
        return Optional.of(new SandboxExit(exitCode, oomKilled(handle)));
    }

    @Override
    public Stream<String> stdout(SandboxHandle handle) throws Exception {
        Process p = exec.start(List.of(docker, "logs", "--follow", handle.sandboxId()));
        p.getOutputStream().close();
        BufferedReader reader = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8));
        return reader.lines().onClose(() -> {
            p.destroy();
            try {
                reader.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    @Override
    public void remove(SandboxHandle handle) throws Exception {
        CommandExecutor.CommandResult r = exec.run(List.of(docker, "rm", "--force", handle.sandboxId()), commandTimeout);
        if (!r.succeeded()) {
            log.warn("could not remove sandbox {} of job {}: {}", shortId(handle.sandboxId()), handle.jobId(), r.output());
        }
    }

    @Override
    public int removeOrphans() throws Exception {
        CommandExecutor.CommandResult ps = exec.run(List.of(docker, "ps", "--all", "--quiet",
                "--filter", "label=" + LABEL_WORKER + "=" + workerToken), commandTimeout);
        if (!ps.succeeded()) {
            throw new IOException("docker ps failed: " + abbreviate(ps.output()));
        }
        int removed = 0;
        for (String id : ps.output().lines().map(String::strip).filter(s -> !s.isEmpty()).toList()) {
            CommandExecutor.CommandResult rm = exec.run(List.of(docker, "rm", "--force", id), commandTimeout);
            if (rm.succeeded()) removed++;
            else log.warn("could not remove orphaned sandbox {}: {}", shortId(id), rm.output());
        }
        return removed;
    }

    /** docker run 인자. 순서: 옵션 → 이미지 → 명령 */
    List<String> runCommand(SandboxRequest req) {
        ResourceConfig res = req.resources();
        long memory = res.memoryBytes();
        List<String> cmd = new ArrayList<>();
        cmd.add(docker);
        cmd.add("run");
        cmd.add("--detach");
        cmd.add("--name");
        cmd.add(containerName(req.jobId()));
        cmd.add("--label");
        cmd.add(LABEL_WORKER + "=" + workerToken);
        cmd.add("--label");
        cmd.add(LABEL_JOB + "=" + req.jobId());
        if (req.networkDisabled()) {
            cmd.add("--network");
            cmd.add("none");
        }
        cmd.add("--memory");
        cmd.add(Long.toString(memory));
        // swap 금지: memory-swap == memory
        cmd.add("--memory-swap");
        cmd.add(Long.toString(memory));
        cmd.add("--cpus");
        cmd.add(String.format(Locale.ROOT, "%.2f", res.cpuCount()));
        cmd.add("--pids-limit");
        cmd.add(Integer.toString(req.pidsLimit()));
        cmd.add("--security-opt");
        cmd.add("no-new-privileges");
        cmd.add("--cap-drop");
        cmd.add("ALL");
        if (req.gpuCount() > 0) {
            cmd.add("--gpus");
            cmd.add(Integer.toString(req.gpuCount()));
        }
        cmd.add("--volume");
        cmd.add(req.inputDir().toAbsolutePath() + ":" + SandboxRequest.INPUT_MOUNT + ":ro");
        cmd.add("--volume");
        cmd.add(req.outputDir().toAbsolutePath() + ":" + SandboxRequest.OUTPUT_MOUNT + ":rw");
        cmd.add("--workdir");
        cmd.add(SandboxRequest.WORKDIR);
        for (Map.Entry<String, String> e : req.environment().entrySet()) {
            cmd.add("--env");
            cmd.add(e.getKey() + "=" + e.getValue());
        }
        cmd.add(req.image());
        cmd.addAll(req.command());
        return cmd;
    }

    static String containerName(String jobId) {
        return "job-" + jobId;
    }

    private boolean oomKilled(SandboxHandle handle) throws Exception {
        CommandExecutor.CommandResult r = exec.run(List.of(docker, "inspect", "--format", "{{.State.OOMKilled}}",
                handle.sandboxId()), commandTimeout);
        if (!r.succeeded()) {
            log.warn("docker inspect {} failed: {}", shortId(handle.sandboxId()), r.output());
            return false;
        }
        return Boolean.parseBoolean(lastLine(r.output()));
    }

    private static String lastLine(String output) {
        if (output == null) return "";
        String[] lines = output.strip().split("\\R");
        return lines[lines.length - 1].strip();
    }

    private static String shortId(String id) {
        return id.length() > 12 ? id.substring(0, 12) : id;
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 512 ? s : s.substring(0, 512) + "...";
    }
}
