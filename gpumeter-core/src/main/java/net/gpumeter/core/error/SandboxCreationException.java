package net.gpumeter.core.error;

public class SandboxCreationException extends GpuMeterException {
    public SandboxCreationException(String message) {
        super(message);
    }

    public SandboxCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
