package net.gpumeter.core.error;

import net.gpumeter.core.model.JobStatus;

public class AlreadyTerminalException extends GpuMeterException {
    private final JobStatus status;

    public AlreadyTerminalException(String jobId, JobStatus status) {
        super("job " + jobId + " is already " + status.code());
        this.status = status;
    }

    public JobStatus getStatus() {
        return status;
    }
}
