package com.sarkari.jobfeed.scrape.ingest;

import com.sarkari.jobfeed.scrape.model.NormalizedJobRecord;
import com.sarkari.jobfeed.scrape.model.ReconcileOutcome;
import com.sarkari.jobfeed.scrape.model.ReconcileResult;
import com.sarkari.jobfeed.scrape.model.StoredJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionReconcilerTest {
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final IngestionReconciler reconciler = new IngestionReconciler(store);
    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void newRecordIsCreated() {
        ReconcileResult result = reconciler.reconcile(1L, record("aaaa000000000001", LocalDate.of(2024, 8, 18), 1324));

        assertThat(result.outcome()).isEqualTo(ReconcileOutcome.CREATED);
        assertThat(result.jobId()).isNotNull();
        assertThat(store.all()).hasSize(1);
    }

    @Test
    void identicalContentIsSkipped() {
        NormalizedJobRecord record = record("aaaa000000000001", LocalDate.of(2024, 8, 18), 1324);
        ReconcileResult first = reconciler.reconcile(1L, record);

        ReconcileResult second = reconciler.reconcile(1L, record);

        assertThat(second.outcome()).isEqualTo(ReconcileOutcome.SKIPPED);
        assertThat(second.jobId()).isEqualTo(first.jobId());
        assertThat(store.all()).hasSize(1);
    }

    @Test
    void sameHashFromAnotherSourceIsANewJob() {
        NormalizedJobRecord record = record("aaaa000000000001", LocalDate.of(2024, 8, 18), 1324);
        reconciler.reconcile(1L, record);

        ReconcileResult other = reconciler.reconcile(2L, record);

        assertThat(other.outcome()).isEqualTo(ReconcileOutcome.CREATED);
        assertThat(store.all()).hasSize(2);
    }

    @Test
    void changedNoticeUpdatesStoredJobAndBumpsVersion() {
        ReconcileResult created = reconciler.reconcile(1L, record("aaaa000000000001", LocalDate.of(2024, 8, 18), 1324));

        ReconcileResult updated = reconciler.reconcile(1L, record("bbbb000000000002", LocalDate.of(2024, 8, 25), 1324));

        assertThat(updated.outcome()).isEqualTo(ReconcileOutcome.UPDATED);
        assertThat(updated.jobId()).isEqualTo(created.jobId());
        assertThat(updated.changedFields()).containsExactly("last_date");
        StoredJob stored = store.get(created.jobId());
        assertThat(stored.version()).isEqualTo(2);
        assertThat(stored.record().lastDate()).isEqualTo(LocalDate.of(2024, 8, 25));
        assertThat(stored.contentHash()).isEqualTo("bbbb000000000002");
        assertThat(store.all()).hasSize(1);
    }

    @Test
    void missingIncomingValuesDoNotEraseStoredOnes() {
        NormalizedJobRecord stored = record("aaaa000000000001", LocalDate.of(2024, 8, 18), 1324);
        NormalizedJobRecord incoming = record("bbbb000000000002", null, null);

        Map<String, Object> changes = IngestionReconciler.changedFields(stored, incoming);

        assertThat(changes).isEmpty();
    }

    @Test
    void numericScaleDifferencesAreNotChanges() {
        NormalizedJobRecord stored = withFee(record("aaaa000000000001", null, null), new BigDecimal("500"));
        NormalizedJobRecord incoming = withFee(record("bbbb000000000002", null, null), new BigDecimal("500.00"));

        assertThat(IngestionReconciler.changedFields(stored, incoming)).isEmpty();
    }

    @Test
    void losingAnInsertRaceResolvesToSkip() {
        NormalizedJobRecord record = record("aaaa000000000001", LocalDate.of(2024, 8, 18), 1324);
        store.simulateConcurrentInsert(record);

        ReconcileResult result = reconciler.reconcile(1L, record);

        assertThat(result.outcome()).isEqualTo(ReconcileOutcome.SKIPPED);
        assertThat(result.jobId()).isEqualTo(store.all().get(0).id());
        assertThat(store.all()).hasSize(1);
    }

    @Test
    void concurrentDuplicatesCreateExactlyOnce() throws Exception {
        executor = Executors.newFixedThreadPool(8);
        NormalizedJobRecord record = record("cccc000000000003", LocalDate.of(2024, 9, 1), 50);
        List<Callable<ReconcileResult>> tasks = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            tasks.add(() -> reconciler.reconcile(4L, record));
        }

        int created = 0;
        for (Future<ReconcileResult> future : executor.invokeAll(tasks)) {
            if (future.get().outcome() == ReconcileOutcome.CREATED) {
                created++;
            }
        }

        assertThat(created).isEqualTo(1);
        assertThat(store.all()).hasSize(1);
    }

    @Test
    void postingsSharingOnlyThePageUrlAreKeptApartAcrossRuns() {
        List<NormalizedJobRecord> batch = List.of(
            record("cccc000000000001", LocalDate.of(2024, 8, 18), 120),
            record("cccc000000000002", LocalDate.of(2024, 9, 2), 45)
        );

        List<ReconcileOutcome> first = reconcileRun(batch, false);
        List<ReconcileOutcome> second = reconcileRun(batch, false);

        assertThat(first).containsExactly(ReconcileOutcome.CREATED, ReconcileOutcome.CREATED);
        assertThat(second).containsExactly(ReconcileOutcome.SKIPPED, ReconcileOutcome.SKIPPED);
        assertThat(store.all()).hasSize(2);
    }

    @Test
    void aStoredPostingIsMatchedAtMostOncePerRun() {
        List<NormalizedJobRecord> batch = List.of(
            record("dddd000000000001", LocalDate.of(2024, 8, 18), 120),
            record("dddd000000000002", LocalDate.of(2024, 9, 2), 45)
        );

        List<ReconcileOutcome> first = reconcileRun(batch, true);
        List<ReconcileOutcome> second = reconcileRun(batch, true);

        assertThat(first).containsExactly(ReconcileOutcome.CREATED, ReconcileOutcome.CREATED);
        assertThat(second).containsExactly(ReconcileOutcome.SKIPPED, ReconcileOutcome.SKIPPED);
        assertThat(store.all()).hasSize(2);
        assertThat(store.all()).allSatisfy(job -> assertThat(job.version()).isEqualTo(1));
    }

    @Test
    void changedPostingWithItsOwnLinkIsUpdatedOnceInARun() {
        reconcileRun(List.of(record("eeee000000000001", LocalDate.of(2024, 8, 18), 120)), true);
        ReconcileBatch run = new ReconcileBatch();

        ReconcileResult changed = reconciler.reconcile(
            1L, record("eeee000000000002", LocalDate.of(2024, 8, 31), 120), true, run
        );
        ReconcileResult sibling = reconciler.reconcile(
            1L, record("eeee000000000003", LocalDate.of(2024, 9, 15), 120), true, run
        );

        assertThat(changed.outcome()).isEqualTo(ReconcileOutcome.UPDATED);
        assertThat(changed.changedFields()).containsExactly("last_date");
        assertThat(sibling.outcome()).isEqualTo(ReconcileOutcome.CREATED);
        assertThat(run.size()).isEqualTo(2);
    }

    private List<ReconcileOutcome> reconcileRun(List<NormalizedJobRecord> records, boolean matchByLink) {
        ReconcileBatch run = new ReconcileBatch();
        List<ReconcileOutcome> outcomes = new ArrayList<>();
        for (NormalizedJobRecord record : records) {
            outcomes.add(reconciler.reconcile(1L, record, matchByLink, run).outcome());
        }
        return outcomes;
    }

    private NormalizedJobRecord record(String hash, LocalDate lastDate, Integer posts) {
        return new NormalizedJobRecord(
            "Combined Graduate Level Examination 2024",
            null,
            "Staff Selection Commission",
            posts,
            null,
            null,
            lastDate,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            "https://ssc.gov.in/notices/101",
            hash,
            45
        );
    }

    private NormalizedJobRecord withFee(NormalizedJobRecord r, BigDecimal fee) {
        return new NormalizedJobRecord(
            r.title(), r.description(), r.department(), r.totalPosts(), r.qualification(), r.notificationDate(),
            r.lastDate(), r.examDate(), fee, r.salaryMin(), r.salaryMax(), r.ageMin(), r.ageMax(), r.location(),
            r.state(), r.applicationLink(), r.notificationPdf(), r.sourceUrl(), r.contentHash(), r.qualityScore()
        );
    }
}
