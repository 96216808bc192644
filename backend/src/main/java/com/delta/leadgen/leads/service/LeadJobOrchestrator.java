package com.delta.leadgen.leads.service;

import com.delta.leadgen.leads.enhance.LeadEnhancer;
import com.delta.leadgen.leads.generation.GeneratorNotConfiguredException;
import com.delta.leadgen.leads.generation.LeadGenerator;
import com.delta.leadgen.leads.model.JobStatus;
import com.delta.leadgen.leads.model.LeadBatch;
import com.delta.leadgen.leads.model.LeadExport;
import com.delta.leadgen.leads.model.LeadJob;
import com.delta.leadgen.leads.model.LeadJobView;
import com.delta.leadgen.leads.model.LeadRequest;
import com.delta.leadgen.leads.retry.LeadGenerationException;
import com.delta.leadgen.leads.retry.ResilientCaller;
import com.delta.leadgen.leads.store.InvalidJobTransitionException;
import com.delta.leadgen.leads.store.LeadJobNotFoundException;
import com.delta.leadgen.leads.store.LeadJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for lead generation. The synchronous path runs on the caller's thread; the asynchronous path records
 * a job and drives it QUEUED, PROCESSING, then COMPLETED or FAILED on the job executor. Only this class moves
 * jobs between states.
 */
@Service
public class LeadJobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(LeadJobOrchestrator.class);
    static final String GENERATE_OPERATION = "Lead generation";
    static final String CANCELLED_MESSAGE = "Job cancelled";

    private final LeadJobStore store;
    private final LeadGenerator generator;
    private final LeadEnhancer enhancer;
    private final ResilientCaller caller;
    private final LeadRequestValidator validator;
    private final LeadResultProjector projector;
    private final ExecutorService jobExecutor;
    private final Map<String, LeadJobHandle> activeHandles = new ConcurrentHashMap<>();

    public LeadJobOrchestrator(
        LeadJobStore store,
        LeadGenerator generator,
        LeadEnhancer enhancer,
        ResilientCaller caller,
        LeadRequestValidator validator,
        LeadResultProjector projector,
        @Qualifier("leadJobExecutor") ExecutorService jobExecutor
    ) {
        this.store = store;
        this.generator = generator;
        this.enhancer = enhancer;
        this.caller = caller;
        this.validator = validator;
        this.projector = projector;
        this.jobExecutor = jobExecutor;
    }

    public GenerationOutcome runSync(LeadRequest rawRequest) {
        LeadRequest request = validator.validate(rawRequest);
        ensureConfigured();
        try {
            return execute(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw LeadGenerationException.cancelled(GENERATE_OPERATION, 0, null, e);
        }
    }

    public LeadJobHandle submit(LeadRequest rawRequest) {
        LeadRequest request = validator.validate(rawRequest);
        ensureConfigured();
        String jobId = store.create(request);
        LeadJobHandle handle = new LeadJobHandle(jobId);
        activeHandles.put(jobId, handle);
        log.info(
            "Queued lead job {} industry={} count={} country={} scraping={}",
            jobId,
            request.industry(),
            request.count(),
            request.country(),
            request.enableWebScraping()
        );
        try {
            handle.attach(jobExecutor.submit(() -> runJob(handle)));
        } catch (RejectedExecutionException e) {
            log.error("Lead job {} could not be scheduled", jobId, e);
            activeHandles.remove(jobId);
            store.transitionToProcessing(jobId);
            store.fail(jobId, "Job could not be scheduled: " + describe(e));
        }
        return handle;
    }

    public LeadJobView getStatus(String jobId) {
        return toView(findJob(jobId));
    }

    public List<LeadJobView> listJobs(int limit) {
        return store.listRecent(limit).stream().map(this::toView).toList();
    }

    public LeadExport export(String jobId) {
        return projector.toExport(findJob(jobId));
    }

    public String exportCsv(String jobId) {
        return projector.toCsv(findJob(jobId));
    }

    /**
     * @return true if a cancellation request was registered, false if the job had already finished or was
     * already being cancelled
     */
    public boolean cancel(String jobId) {
        LeadJob job = findJob(jobId);
        LeadJobHandle handle = activeHandles.get(jobId);
        if (handle == null || job.status().isTerminal()) {
            return false;
        }
        boolean requested = handle.cancel();
        if (requested) {
            log.info("Cancellation requested for lead job {} (status={})", jobId, job.status().wireValue());
        }
        return requested;
    }

    private void runJob(LeadJobHandle handle) {
        String jobId = handle.jobId();
        handle.markStarted();
        try {
            LeadJob job = store.transitionToProcessing(jobId);
            if (handle.isCancelRequested()) {
                store.fail(jobId, CANCELLED_MESSAGE);
                log.info("Lead job {} cancelled before work started", jobId);
                return;
            }
            log.info("Lead job {} started", jobId);
            GenerationOutcome outcome = execute(job.request());
            if (handle.isCancelRequested()) {
                store.fail(jobId, CANCELLED_MESSAGE);
                log.info("Lead job {} cancelled before its result was stored", jobId);
                return;
            }
            store.complete(jobId, outcome.batch(), outcome.enhancementError());
            log.info("Lead job {} completed with {} companies", jobId, outcome.batch().size());
        } catch (InvalidJobTransitionException e) {
            log.error("Lead job {} hit an invalid state transition", jobId, e);
            throw e;
        } catch (LeadGenerationException e) {
            String error = e.isCancelled() ? CANCELLED_MESSAGE : e.getMessage();
            log.warn("Lead job {} failed: {}", jobId, error);
            store.fail(jobId, error);
        } catch (InterruptedException e) {
            log.info("Lead job {} interrupted", jobId);
            store.fail(jobId, CANCELLED_MESSAGE);
        } catch (RuntimeException e) {
            log.error("Lead job {} failed unexpectedly", jobId, e);
            failIfProcessing(jobId, "Unexpected error: " + describe(e));
        } catch (Error e) {
            log.error("Lead job {} hit a fatal error", jobId, e);
            failIfProcessing(jobId, "Unexpected error: " + describe(e));
            throw e;
        } finally {
            activeHandles.remove(jobId);
        }
    }

    private GenerationOutcome execute(LeadRequest request) throws InterruptedException {
        LeadBatch batch = caller.call(GENERATE_OPERATION, () -> generator.generate(request));
        if (!request.enableWebScraping()) {
            return new GenerationOutcome(batch, null);
        }
        try {
            return new GenerationOutcome(enhancer.enhance(batch), null);
        } catch (InterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            String note = "Web scraping enhancement failed: " + describe(e);
            log.warn("{}; returning generated data unchanged", note);
            return new GenerationOutcome(batch, note);
        }
    }

    private void failIfProcessing(String jobId, String error) {
        LeadJob current = store.get(jobId).orElse(null);
        if (current != null && current.status() == JobStatus.PROCESSING) {
            store.fail(jobId, error);
        }
    }

    private void ensureConfigured() {
        if (!generator.isConfigured()) {
            throw new GeneratorNotConfiguredException("Generation API key is not configured (set GEMINI_API_KEY)");
        }
    }

    private LeadJob findJob(String jobId) {
        return store.get(jobId).orElseThrow(() -> new LeadJobNotFoundException(jobId));
    }

    private LeadJobView toView(LeadJob job) {
        return switch (job.status()) {
            case QUEUED -> new LeadJobView(job.id(), job.status(), job.createdAt(), null, null, null, null, null);
            case PROCESSING -> new LeadJobView(job.id(), job.status(), job.createdAt(), job.startedAt(), null, null, null, null);
            case COMPLETED -> new LeadJobView(
                job.id(),
                job.status(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.result(),
                null,
                job.enhancementError()
            );
            case FAILED -> new LeadJobView(
                job.id(),
                job.status(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                null,
                job.error(),
                null
            );
        };
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return (message == null || message.isBlank()) ? t.getClass().getSimpleName() : message;
    }
}
