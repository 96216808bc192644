package com.delta.leadgen.leads.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Payload produced by the generation service: {@code {"companies": [...]}}.
 */
public record LeadBatch(@JsonProperty("companies") List<CompanyLead> companies) {

    public LeadBatch {
        companies = companies == null ? List.of() : List.copyOf(companies);
    }

    @JsonIgnore
    public int size() {
        return companies.size();
    }
}
