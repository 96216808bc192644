package com.delta.leadgen.leads.service;

import com.delta.leadgen.leads.model.LeadBatch;

/**
 * Result of one generate-then-enhance run. {@code enhancementError} is set when enhancement was requested but
 * failed and the generated batch was kept as-is.
 */
public record GenerationOutcome(LeadBatch batch, String enhancementError) {
}
