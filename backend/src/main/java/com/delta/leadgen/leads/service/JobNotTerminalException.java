package com.delta.leadgen.leads.service;

import com.delta.leadgen.leads.model.JobStatus;

public class JobNotTerminalException extends RuntimeException {
    private final String jobId;
    private final JobStatus status;

    public JobNotTerminalException(String jobId, JobStatus status) {
        super("Job is not completed yet. Current status: " + status.wireValue());
        this.jobId = jobId;
        this.status = status;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getStatus() {
        return status;
    }
}
