package net.gpumeter.core.error;

public class WorkerBusyException extends GpuMeterException {
    public WorkerBusyException(String runningJobId, String rejectedJobId) {
        super("worker slot occupied by " + runningJobId + ", cannot launch " + rejectedJobId);
    }
}
