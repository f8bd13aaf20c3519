package net.gpumeter.core.error;

/** 도메인 예외 루트 (unchecked) */
public class GpuMeterException extends RuntimeException {
    public GpuMeterException(String message) {
        super(message);
    }

    public GpuMeterException(String message, Throwable cause) {
        super(message, cause);
    }
}
