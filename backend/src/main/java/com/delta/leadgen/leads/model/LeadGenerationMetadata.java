package com.delta.leadgen.leads.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record LeadGenerationMetadata(
    String industry,
    String country,
    @JsonProperty("requested_count") int requestedCount,
    @JsonProperty("actual_count") int actualCount,
    @JsonProperty("web_scraping_enabled") boolean webScrapingEnabled,
    @JsonProperty("enhancement_error") @JsonInclude(JsonInclude.Include.NON_NULL) String enhancementError,
    @JsonProperty("generated_at") Instant generatedAt
) {
}
