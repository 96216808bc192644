package com.delta.leadgen.leads.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LeadJobView(
    @JsonProperty("job_id") String jobId,
    JobStatus status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    LeadBatch result,
    String error,
    @JsonProperty("enhancement_error") String enhancementError
) {
}
