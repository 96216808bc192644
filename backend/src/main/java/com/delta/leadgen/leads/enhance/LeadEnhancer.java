package com.delta.leadgen.leads.enhance;

import com.delta.leadgen.leads.model.LeadBatch;

/**
 * Augments generated company records with data gathered elsewhere. Must return a batch with the same companies
 * in the same order.
 */
public interface LeadEnhancer {

    LeadBatch enhance(LeadBatch batch) throws InterruptedException;
}
