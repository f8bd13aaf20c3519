package net.gpumeter.core.error;

public class NotOwnerException extends GpuMeterException {
    public NotOwnerException(String jobId, String requesterId) {
        super("user " + requesterId + " does not own job " + jobId);
    }
}
