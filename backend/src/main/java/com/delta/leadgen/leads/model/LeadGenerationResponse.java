package com.delta.leadgen.leads.model;

public record LeadGenerationResponse(
    boolean success,
    String message,
    LeadBatch data,
    LeadGenerationMetadata metadata
) {
}
