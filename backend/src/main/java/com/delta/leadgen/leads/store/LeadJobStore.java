package com.delta.leadgen.leads.store;

import com.delta.leadgen.leads.model.LeadBatch;
import com.delta.leadgen.leads.model.LeadJob;
import com.delta.leadgen.leads.model.LeadRequest;

import java.util.List;
import java.util.Optional;

/**
 * Sole owner of job state. Every mutation is a single atomic transition; callers only ever see whole
 * {@link LeadJob} snapshots.
 */
public interface LeadJobStore {

    /** Inserts a QUEUED job and returns its fresh identifier. */
    String create(LeadRequest request);

    Optional<LeadJob> get(String id);

    /** QUEUED to PROCESSING; sets {@code startedAt}. */
    LeadJob transitionToProcessing(String id);

    /** PROCESSING to COMPLETED; sets {@code completedAt} and the result. */
    LeadJob complete(String id, LeadBatch result, String enhancementError);

    /** PROCESSING to FAILED; sets {@code completedAt} and the error. */
    LeadJob fail(String id, String error);

    /** Newest first, at most {@code limit} entries. */
    List<LeadJob> listRecent(int limit);
}
