package com.delta.leadgen.leads.store;

import com.delta.leadgen.leads.model.CompanyLead;
import com.delta.leadgen.leads.model.JobStatus;
import com.delta.leadgen.leads.model.LeadBatch;
import com.delta.leadgen.leads.model.LeadJob;
import com.delta.leadgen.leads.model.LeadRequest;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryLeadJobStoreTest {

    private static final LeadRequest REQUEST = new LeadRequest("robotics", 3, "Germany", false);
    private static final LeadBatch BATCH = new LeadBatch(List.of(
        CompanyLead.named("Kuka", "https://kuka.com"),
        CompanyLead.named("Festo", "https://festo.com"),
        CompanyLead.named("Neura Robotics", "https://neura-robotics.com")
    ));

    @Test
    void createdJobIsQueuedWithPrefixedId() {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore();

        String id = store.create(REQUEST);

        assertThat(id).startsWith("job_").hasSize(36);
        LeadJob job = store.get(id).orElseThrow();
        assertThat(job.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.request()).isEqualTo(REQUEST);
        assertThat(job.createdAt()).isNotNull();
        assertThat(job.startedAt()).isNull();
        assertThat(job.result()).isNull();
    }

    @Test
    void happyPathSetsTimestampsInOrder() {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore(new TickingClock());
        String id = store.create(REQUEST);

        LeadJob processing = store.transitionToProcessing(id);
        LeadJob completed = store.complete(id, BATCH, null);

        assertThat(processing.status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(processing.startedAt()).isAfter(processing.createdAt());
        assertThat(completed.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(completed.completedAt()).isAfter(completed.startedAt());
        assertThat(completed.result().size()).isEqualTo(3);
        assertThat(completed.error()).isNull();
    }

    @Test
    void failRecordsErrorAndDefaultsBlankMessage() {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore();
        String first = store.create(REQUEST);
        String second = store.create(REQUEST);
        store.transitionToProcessing(first);
        store.transitionToProcessing(second);

        assertThat(store.fail(first, "Lead generation failed permanently: bad key").error())
            .isEqualTo("Lead generation failed permanently: bad key");
        LeadJob blank = store.fail(second, " ");
        assertThat(blank.status()).isEqualTo(JobStatus.FAILED);
        assertThat(blank.error()).isEqualTo("unknown error");
        assertThat(blank.result()).isNull();
        assertThat(blank.completedAt()).isNotNull();
    }

    @Test
    void completingQueuedJobIsRejected() {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore();
        String id = store.create(REQUEST);

        assertThatThrownBy(() -> store.complete(id, BATCH, null))
            .isInstanceOf(InvalidJobTransitionException.class)
            .hasMessageContaining(id);
        assertThat(store.get(id).orElseThrow().status()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void terminalJobsAreImmutable() {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore();
        String id = store.create(REQUEST);
        store.transitionToProcessing(id);
        LeadJob completed = store.complete(id, BATCH, "note");

        assertThatThrownBy(() -> store.fail(id, "late failure")).isInstanceOf(InvalidJobTransitionException.class);
        assertThatThrownBy(() -> store.complete(id, BATCH, null)).isInstanceOf(InvalidJobTransitionException.class);
        assertThatThrownBy(() -> store.transitionToProcessing(id)).isInstanceOf(InvalidJobTransitionException.class);
        assertThat(store.get(id)).contains(completed);
    }

    @Test
    void completeRequiresResult() {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore();
        String id = store.create(REQUEST);
        store.transitionToProcessing(id);

        assertThatThrownBy(() -> store.complete(id, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(store.get(id).orElseThrow().status()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void unknownJobIsNotFound() {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore();

        assertThat(store.get("job_missing")).isEmpty();
        assertThat(store.get(null)).isEmpty();
        assertThatThrownBy(() -> store.transitionToProcessing("job_missing"))
            .isInstanceOf(LeadJobNotFoundException.class);
        assertThatThrownBy(() -> store.fail("job_missing", "x"))
            .isInstanceOf(LeadJobNotFoundException.class);
    }

    @Test
    void listRecentReturnsNewestFirst() {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore(new TickingClock());
        String oldest = store.create(REQUEST);
        String middle = store.create(REQUEST);
        String newest = store.create(REQUEST);

        assertThat(store.listRecent(10)).extracting(LeadJob::id).containsExactly(newest, middle, oldest);
        assertThat(store.listRecent(2)).extracting(LeadJob::id).containsExactly(newest, middle);
    }

    @Test
    void concurrentCreatesYieldDistinctIds() throws Exception {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore();
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        Set<String> ids = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(store.create(REQUEST));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(ids).hasSize(threads * perThread);
        assertThat(store.listRecent(threads * perThread)).hasSize(threads * perThread);
    }

    @Test
    void readersNeverSeePartialSnapshots() throws Exception {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            ids.add(store.create(REQUEST));
        }
        AtomicBoolean writing = new AtomicBoolean(true);
        List<String> violations = new ArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Future<?> writer = pool.submit(() -> {
                for (int i = 0; i < ids.size(); i++) {
                    String id = ids.get(i);
                    store.transitionToProcessing(id);
                    if (i % 2 == 0) {
                        store.complete(id, BATCH, null);
                    } else {
                        store.fail(id, "boom");
                    }
                }
                writing.set(false);
            });
            List<Future<?>> readers = new ArrayList<>();
            for (int r = 0; r < 2; r++) {
                readers.add(pool.submit(() -> {
                    while (writing.get()) {
                        for (String id : ids) {
                            LeadJob job = store.get(id).orElseThrow();
                            String problem = inconsistency(job);
                            if (problem != null) {
                                synchronized (violations) {
                                    violations.add(problem);
                                }
                            }
                        }
                    }
                }));
            }
            writer.get(10, TimeUnit.SECONDS);
            for (Future<?> reader : readers) {
                reader.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(violations).isEmpty();
    }

    @Test
    void observedStatusNeverMovesBackwards() throws Exception {
        InMemoryLeadJobStore store = new InMemoryLeadJobStore();
        String id = store.create(REQUEST);
        List<JobStatus> observed = new ArrayList<>();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> writer = pool.submit(() -> {
                store.transitionToProcessing(id);
                store.complete(id, BATCH, null);
            });
            while (!writer.isDone()) {
                observed.add(store.get(id).orElseThrow().status());
            }
            writer.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        observed.add(store.get(id).orElseThrow().status());

        for (int i = 1; i < observed.size(); i++) {
            assertThat(observed.get(i).ordinal()).isGreaterThanOrEqualTo(observed.get(i - 1).ordinal());
        }
        assertThat(observed.get(observed.size() - 1)).isEqualTo(JobStatus.COMPLETED);
    }

    private static String inconsistency(LeadJob job) {
        switch (job.status()) {
            case PROCESSING:
                return job.startedAt() == null ? job.id() + " processing without startedAt" : null;
            case COMPLETED:
                return job.result() == null || job.completedAt() == null ? job.id() + " completed without result" : null;
            case FAILED:
                return job.error() == null || job.result() != null ? job.id() + " failed with inconsistent fields" : null;
            default:
                return null;
        }
    }

    static final class TickingClock extends Clock {
        private Instant current = Instant.parse("2024-05-01T10:00:00Z");

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public synchronized Instant instant() {
            current = current.plus(Duration.ofSeconds(1));
            return current;
        }
    }
}
