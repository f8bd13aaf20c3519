package net.gpumeter.core.spi;

import net.gpumeter.core.model.ResourceConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record SandboxRequest(
        String jobId,
        String image,
        List<String> command,
        Map<String, String> environment,
        ResourceConfig resources,
        Path inputDir,          // /workspace/input (ro)
        Path outputDir,         // /workspace/output (rw)
        int gpuCount,
        int pidsLimit,
        boolean networkDisabled
) {
    public static final String INPUT_MOUNT = "/workspace/input";
    public static final String OUTPUT_MOUNT = "/workspace/output";
    public static final String WORKDIR = "/workspace";

    public SandboxRequest {
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
    }
}
