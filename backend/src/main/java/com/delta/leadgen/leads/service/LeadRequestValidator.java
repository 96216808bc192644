package com.delta.leadgen.leads.service;

import com.delta.leadgen.leads.model.LeadRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class LeadRequestValidator {
    public static final int MIN_COUNT = 1;
    public static final int MAX_COUNT = 50;
    public static final int MIN_TEXT_LENGTH = 2;
    public static final int MAX_TEXT_LENGTH = 100;

    /**
     * Trims text fields and checks bounds. Returns the normalised request or throws with every violation found.
     */
    public LeadRequest validate(LeadRequest request) {
        if (request == null) {
            throw new LeadRequestValidationException(List.of("request body is required"));
        }
        List<String> violations = new ArrayList<>();
        String industry = checkText("industry", request.industry(), violations);
        String country = checkText("country", request.country(), violations);
        if (request.count() < MIN_COUNT) {
            violations.add("number must be at least " + MIN_COUNT);
        } else if (request.count() > MAX_COUNT) {
            violations.add("number cannot exceed " + MAX_COUNT);
        }
        if (!violations.isEmpty()) {
            throw new LeadRequestValidationException(violations);
        }
        return new LeadRequest(industry, request.count(), country, request.enableWebScraping());
    }

    private String checkText(String field, String value, List<String> violations) {
        String trimmed = value == null ? "" : value.strip();
        if (trimmed.isEmpty()) {
            violations.add(field + " cannot be empty");
        } else if (trimmed.length() < MIN_TEXT_LENGTH || trimmed.length() > MAX_TEXT_LENGTH) {
            violations.add(field + " must be between " + MIN_TEXT_LENGTH + " and " + MAX_TEXT_LENGTH + " characters");
        }
        return trimmed;
    }
}
