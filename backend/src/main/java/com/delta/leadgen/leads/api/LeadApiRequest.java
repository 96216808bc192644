package com.delta.leadgen.leads.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LeadApiRequest(
    String industry,
    Integer number,
    String country,
    @JsonProperty("enable_web_scraping") Boolean enableWebScraping
) {
}
