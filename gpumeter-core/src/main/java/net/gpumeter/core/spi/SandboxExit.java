package net.gpumeter.core.spi;

public record SandboxExit(int exitCode, boolean oomKilled) {}
