package com.delta.leadgen.leads.generation;

import com.delta.leadgen.leads.model.LeadBatch;
import com.delta.leadgen.leads.model.LeadRequest;

import java.io.IOException;

/**
 * The external text-generation call. Implementations make exactly one attempt; retrying is the caller's job.
 */
public interface LeadGenerator {

    LeadBatch generate(LeadRequest request) throws IOException, InterruptedException;

    boolean isConfigured();
}
