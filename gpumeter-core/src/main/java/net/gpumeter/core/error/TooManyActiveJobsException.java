package net.gpumeter.core.error;

public class TooManyActiveJobsException extends GpuMeterException {
    public TooManyActiveJobsException(String ownerId, int active, int limit) {
        super("user " + ownerId + " already has " + active + " active jobs (limit " + limit + ")");
    }
}
