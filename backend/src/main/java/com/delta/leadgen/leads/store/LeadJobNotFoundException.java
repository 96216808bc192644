package com.delta.leadgen.leads.store;

public class LeadJobNotFoundException extends RuntimeException {
    private final String jobId;

    public LeadJobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
