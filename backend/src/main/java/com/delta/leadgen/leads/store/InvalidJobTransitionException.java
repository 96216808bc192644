package com.delta.leadgen.leads.store;

import com.delta.leadgen.leads.model.JobStatus;

/**
 * A transition was requested from a state that does not allow it. Indicates a bug in whatever drives the job.
 */
public class InvalidJobTransitionException extends IllegalStateException {
    private final String jobId;
    private final JobStatus from;
    private final JobStatus to;

    public InvalidJobTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + " cannot move from " + from + " to " + to);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
