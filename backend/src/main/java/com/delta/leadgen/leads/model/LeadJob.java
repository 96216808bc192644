package com.delta.leadgen.leads.model;

import java.time.Instant;

/**
 * Immutable snapshot of a lead generation job. The store swaps whole snapshots, so a reader never sees a
 * status without the fields that belong to it.
 */
public record LeadJob(
    String id,
    JobStatus status,
    LeadRequest request,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    LeadBatch result,
    String error,
    String enhancementError
) {
    public static LeadJob queued(String id, LeadRequest request, Instant createdAt) {
        return new LeadJob(id, JobStatus.QUEUED, request, createdAt, null, null, null, null, null);
    }

    public LeadJob processing(Instant startedAt) {
        return new LeadJob(id, JobStatus.PROCESSING, request, createdAt, startedAt, null, null, null, null);
    }

    public LeadJob completed(Instant completedAt, LeadBatch result, String enhancementError) {
        return new LeadJob(id, JobStatus.COMPLETED, request, createdAt, startedAt, completedAt, result, null, enhancementError);
    }

    public LeadJob failed(Instant completedAt, String error) {
        return new LeadJob(id, JobStatus.FAILED, request, createdAt, startedAt, completedAt, null, error, null);
    }
}
