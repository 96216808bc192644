package com.delta.leadgen.leads.model;

/**
 * Validated parameters of one generation task. Built by {@code LeadRequestValidator}; immutable.
 */
public record LeadRequest(
    String industry,
    int count,
    String country,
    boolean enableWebScraping
) {
}
