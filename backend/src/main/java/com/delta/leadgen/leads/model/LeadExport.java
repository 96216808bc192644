package com.delta.leadgen.leads.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LeadExport(
    @JsonProperty("job_id") String jobId,
    int count,
    List<CompanyLead> companies
) {
}
