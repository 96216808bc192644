package com.delta.leadgen.leads.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LeadJobAccepted(
    boolean success,
    String message,
    @JsonProperty("job_id") String jobId,
    @JsonProperty("status_endpoint") String statusEndpoint
) {
}
