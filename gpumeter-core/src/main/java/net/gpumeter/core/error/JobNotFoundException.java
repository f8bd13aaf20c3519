package net.gpumeter.core.error;

public class JobNotFoundException extends GpuMeterException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
