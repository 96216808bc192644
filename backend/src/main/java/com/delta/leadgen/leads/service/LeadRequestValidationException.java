package com.delta.leadgen.leads.service;

import java.util.List;

public class LeadRequestValidationException extends RuntimeException {
    private final List<String> violations;

    public LeadRequestValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
