package com.delta.leadgen.leads.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record HealthResponse(
    String status,
    Instant timestamp,
    String version,
    @JsonProperty("gemini_api_configured") boolean geminiApiConfigured
) {
}
