package com.delta.leadgen.leads.service;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Returned by {@link LeadJobOrchestrator#submit}. Cancelling a job that has not started yet lets the worker fail
 * it on pickup; cancelling a running job interrupts its worker thread, which ends any backoff sleep or blocking
 * HTTP call.
 */
public final class LeadJobHandle {
    private final String jobId;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile boolean started;
    private volatile Future<?> future;

    LeadJobHandle(String jobId) {
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * @return false when cancellation had already been requested
     */
    public boolean cancel() {
        if (!cancelRequested.compareAndSet(false, true)) {
            return false;
        }
        interruptIfRunning();
        return true;
    }

    void attach(Future<?> future) {
        this.future = future;
        if (cancelRequested.get()) {
            interruptIfRunning();
        }
    }

    void markStarted() {
        started = true;
    }

    // A task that has not started must not be cancelled through its Future, or the job would never leave QUEUED.
    private void interruptIfRunning() {
        Future<?> current = future;
        if (started && current != null) {
            current.cancel(true);
        }
    }
}
