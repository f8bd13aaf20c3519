package net.gpumeter.core.spi;

public record SandboxHandle(String sandboxId, String jobId) {}
