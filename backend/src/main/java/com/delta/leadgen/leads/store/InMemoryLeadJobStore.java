package com.delta.leadgen.leads.store;

import com.delta.leadgen.leads.model.JobStatus;
import com.delta.leadgen.leads.model.LeadBatch;
import com.delta.leadgen.leads.model.LeadJob;
import com.delta.leadgen.leads.model.LeadRequest;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local job store. Each record is an immutable snapshot replaced through
 * {@link ConcurrentHashMap#compute}, which serialises writers per key; readers get the last published snapshot.
 * Jobs are never evicted.
 */
@Repository
public class InMemoryLeadJobStore implements LeadJobStore {
    private static final String ID_PREFIX = "job_";

    private final ConcurrentHashMap<String, LeadJob> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLeadJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryLeadJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String create(LeadRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        while (true) {
            String id = ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
            LeadJob job = LeadJob.queued(id, request, clock.instant());
            if (jobs.putIfAbsent(id, job) == null) {
                return id;
            }
        }
    }

    @Override
    public Optional<LeadJob> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public LeadJob transitionToProcessing(String id) {
        return transition(id, JobStatus.QUEUED, JobStatus.PROCESSING, job -> job.processing(laterOf(job.createdAt())));
    }

    @Override
    public LeadJob complete(String id, LeadBatch result, String enhancementError) {
        if (result == null) {
            throw new IllegalArgumentException("result is required to complete job " + id);
        }
        return transition(
            id,
            JobStatus.PROCESSING,
            JobStatus.COMPLETED,
            job -> job.completed(laterOf(job.startedAt()), result, enhancementError)
        );
    }

    @Override
    public LeadJob fail(String id, String error) {
        String safeError = (error == null || error.isBlank()) ? "unknown error" : error;
        return transition(
            id,
            JobStatus.PROCESSING,
            JobStatus.FAILED,
            job -> job.failed(laterOf(job.startedAt()), safeError)
        );
    }

    @Override
    public List<LeadJob> listRecent(int limit) {
        int safeLimit = Math.max(1, limit);
        return jobs.values().stream()
            .sorted(Comparator.comparing(LeadJob::createdAt).reversed())
            .limit(safeLimit)
            .toList();
    }

    private LeadJob transition(String id, JobStatus expected, JobStatus target, UnaryOperator<LeadJob> change) {
        if (id == null || !jobs.containsKey(id)) {
            throw new LeadJobNotFoundException(id);
        }
        return jobs.compute(id, (key, current) -> {
            if (current == null) {
                throw new LeadJobNotFoundException(key);
            }
            if (current.status() != expected) {
                throw new InvalidJobTransitionException(key, current.status(), target);
            }
            return change.apply(current);
        });
    }

    // Timestamps never run backwards relative to the previous transition, even if the wall clock does.
    private Instant laterOf(Instant previous) {
        Instant now = clock.instant();
        return previous != null && now.isBefore(previous) ? previous : now;
    }
}
