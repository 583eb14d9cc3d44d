package com.europeanalysis.stats.service;

import com.europeanalysis.stats.RepositoryConflictException;
import com.europeanalysis.stats.SourceException;
import com.europeanalysis.stats.StatsCrawlerException;
import com.europeanalysis.stats.config.StatsCrawlerProperties;
import com.europeanalysis.stats.model.DataSource;
import com.europeanalysis.stats.model.DatasetDescriptor;
import com.europeanalysis.stats.model.IngestionRun;
import com.europeanalysis.stats.model.NormalizationResult;
import com.europeanalysis.stats.model.RawPage;
import com.europeanalysis.stats.model.RawSnapshot;
import com.europeanalysis.stats.model.RunState;
import com.europeanalysis.stats.model.UpsertResult;
import com.europeanalysis.stats.storage.DataSourceRepository;
import com.europeanalysis.stats.storage.FactRepository;
import com.europeanalysis.stats.storage.IngestionRunRepository;
import com.europeanalysis.stats.storage.RawSnapshotRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * Drives one dataset through fetch, archive, normalize and persist, page by page.
 *
 * Each page commits on its own: a run that dies on page 3 of 5 leaves pages
 * 0-1 persisted and is resumed by starting a new run at page 2. Re-running
 * pages that already committed is harmless because facts are upserted by
 * natural key.
 *
 * Runs of the same dataset are serialized by {@link DatasetLocks}; runs of
 * different datasets proceed in parallel on the ingestion executor.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionOrchestrator {

    private static final String API_SOURCE = "api";
    private static final String FILE_SOURCE = "file";

    private final DatasetRegistry registry;
    private final SourceClient sourceClient;
    private final FactNormalizer normalizer;
    private final FactRepository factRepository;
    private final RawSnapshotRepository snapshotRepository;
    private final DataSourceRepository dataSourceRepository;
    private final IngestionRunRepository runRepository;
    private final DatasetLocks datasetLocks;
    private final ThreadPoolTaskExecutor ingestionExecutor;
    private final ObjectMapper objectMapper;
    private final StatsCrawlerProperties properties;

    private final Map<String, IngestionRun> activeRuns = new ConcurrentHashMap<>();

    // ── Entry points ─────────────────────────────────────────────────────────

    /**
     * Run synchronously on the calling thread.
     *
     * @throws com.europeanalysis.stats.UnknownDatasetException before anything starts
     */
    public IngestionRun run(String datasetId, Map<String, String> overrides, int startPage) {
        IngestionRun run = prepare(datasetId, startPage);
        execute(run, registry.lookup(datasetId), overrides);
        return run;
    }

    /**
     * Create a PENDING run and register it as active, without starting it.
     * Lets callers hand out the run id before the work begins.
     */
    public IngestionRun prepare(String datasetId, int startPage) {
        registry.lookup(datasetId);
        if (startPage < 0) {
            throw new IllegalArgumentException("start_page must be >= 0, got " + startPage);
        }
        IngestionRun run = IngestionRun.pending(datasetId, startPage);
        activeRuns.put(run.getRunId(), run);
        return run;
    }

    /** Execute a prepared run on the ingestion executor. */
    public CompletableFuture<IngestionRun> submit(IngestionRun run, Map<String, String> overrides) {
        DatasetDescriptor descriptor = registry.lookup(run.getDatasetId());
        return CompletableFuture.supplyAsync(() -> {
            execute(run, descriptor, overrides);
            return run;
        }, ingestionExecutor);
    }

    /** Start a full run of every registered dataset. */
    public List<CompletableFuture<IngestionRun>> runAll() {
        List<CompletableFuture<IngestionRun>> futures = new ArrayList<>();
        for (DatasetDescriptor descriptor : registry.all()) {
            futures.add(submit(prepare(descriptor.getId(), 0), Map.of()));
        }
        log.info("Submitted {} ingestion runs", futures.size());
        return futures;
    }

    /**
     * Ask an active run to stop. It finishes the page it is working on and
     * ends CANCELLED before fetching the next one.
     *
     * @return false if no active run has that id
     */
    public boolean cancel(String runId) {
        IngestionRun run = activeRuns.get(runId);
        if (run == null) {
            return false;
        }
        run.requestCancel();
        log.info("Cancellation requested for run {} ({})", runId, run.getDatasetId());
        return true;
    }

    public Collection<IngestionRun> activeRuns() {
        return List.copyOf(activeRuns.values());
    }

    /**
     * Delete every fact of one source, holding the locks of the datasets that
     * feed it so no run writes concurrently. Raw snapshots are kept.
     */
    public int purgeSource(long sourceId) {
        DataSource source = dataSourceRepository.findById(sourceId)
                .orElseThrow(() -> new NoSuchElementException("Unknown data source: " + sourceId));

        List<Lock> held = new ArrayList<>();
        try {
            for (DatasetDescriptor descriptor : registry.all()) {
                if (descriptor.getSourceName().equals(source.getName())) {
                    Lock lock = datasetLocks.lockFor(descriptor.getId());
                    if (!tryLock(lock)) {
                        throw new StatsCrawlerException("Timed out waiting for running ingestion of "
                                + descriptor.getId() + " before deleting source " + source.getName());
                    }
                    held.add(lock);
                }
            }
            return factRepository.deleteBySource(sourceId);
        } finally {
            held.forEach(Lock::unlock);
        }
    }

    // ── Run execution ────────────────────────────────────────────────────────

    private void execute(IngestionRun run, DatasetDescriptor descriptor, Map<String, String> overrides) {
        activeRuns.put(run.getRunId(), run);
        Lock lock = datasetLocks.lockFor(descriptor.getId());
        try {
            if (!tryLock(lock)) {
                log.error("Run {} for {}: another run held the dataset lock for longer than {}",
                        run.getRunId(), descriptor.getId(), lockTimeout());
                run.fail("Timed out after " + lockTimeout() + " waiting for another run of " + descriptor.getId());
                return;
            }
            try {
                ingest(run, descriptor, overrides == null ? Map.of() : overrides);
            } finally {
                lock.unlock();
            }
        } catch (RuntimeException e) {
            log.error("Run {} for {} failed unexpectedly: {}", run.getRunId(), descriptor.getId(), e.getMessage(), e);
            if (!run.getState().isTerminal()) {
                run.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        } finally {
            activeRuns.remove(run.getRunId());
            saveRun(run);
        }
    }

    private void ingest(IngestionRun run, DatasetDescriptor descriptor, Map<String, String> overrides) {
        String datasetId = descriptor.getId();
        log.info("Run {}: starting {} at page {}", run.getRunId(), datasetId, run.getStartPage());

        try {
            DataSource source = dataSourceRepository.getOrCreate(
                    descriptor.getSourceName(), descriptor.isFileBacked() ? FILE_SOURCE : API_SOURCE,
                    sourceClient.datasetUrl(descriptor));
            PageSequence pages = sourceClient.fetch(descriptor, overrides);
            Iterator<RawPage> iterator = pages.from(run.getStartPage());
            run.transitionTo(RunState.FETCHING);

            while (true) {
                if (run.isCancelRequested()) {
                    run.transitionTo(RunState.CANCELLED);
                    log.info("Run {}: {} cancelled after {} pages (last persisted page {})",
                            run.getRunId(), datasetId, run.getPagesPersisted(), run.getLastPersistedPage());
                    return;
                }
                if (!iterator.hasNext()) {
                    break;
                }
                if (run.getState() != RunState.FETCHING) {
                    run.transitionTo(RunState.FETCHING);
                }

                RawPage page = iterator.next();
                snapshotRepository.archive(toSnapshot(page));
                if (page.isEmpty()) {
                    log.info("Run {}: {} page {} is empty, end of data", run.getRunId(), datasetId, page.getPageIndex());
                    break;
                }

                run.transitionTo(RunState.NORMALIZING);
                NormalizationResult normalized = normalizer.normalizeBatch(page.getRecords(), descriptor);

                run.transitionTo(RunState.PERSISTING);
                UpsertResult written = factRepository.upsertFacts(normalized.facts(), source.getId());
                run.pagePersisted(page.getPageIndex(), page.getRecords().size(), written.total(), normalized.dropped());

                log.info("Run {}: {} page {}/{} persisted: {} fetched, {} inserted, {} updated, {} dropped",
                        run.getRunId(), datasetId, page.getPageIndex() + 1, pages.pageCount(),
                        page.getRecords().size(), written.inserted(), written.updated(), normalized.dropped());
            }

            run.transitionTo(RunState.COMPLETED);
            dataSourceRepository.markUpdated(source.getId(), run.getCompletedAt());
            log.info("Run {}: {} completed: {} pages, {} records written, {} dropped",
                    run.getRunId(), datasetId, run.getPagesPersisted(), run.getRecordsWritten(), run.getRecordsDropped());

        } catch (SourceException e) {
            log.error("Run {}: {} failed fetching (status {}, {}); last persisted page {}: {}",
                    run.getRunId(), datasetId, e.getStatus(), e.getUri(), run.getLastPersistedPage(), e.getMessage());
            run.fail(failureMessage(run, e));

        } catch (RepositoryConflictException e) {
            log.error("Run {}: {} failed persisting; last persisted page {}: {}",
                    run.getRunId(), datasetId, run.getLastPersistedPage(), e.getMessage(), e);
            run.fail(failureMessage(run, e));
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RawSnapshot toSnapshot(RawPage page) {
        String params;
        try {
            params = objectMapper.writeValueAsString(page.getQueryParams());
        } catch (JsonProcessingException e) {
            throw new StatsCrawlerException("Could not serialize query parameters of " + page.getRequestUri(), e);
        }
        return RawSnapshot.builder()
                .datasetId(page.getDatasetId())
                .pageIndex(page.getPageIndex())
                .requestUri(page.getRequestUri())
                .queryParams(params)
                .retrievedAt(page.getRetrievedAt())
                .payload(page.getPayload())
                .contentHash(page.getContentHash())
                .build();
    }

    private boolean tryLock(Lock lock) {
        try {
            return lock.tryLock(lockTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Duration lockTimeout() {
        return properties.getIngestion().getLockTimeout();
    }

    private void saveRun(IngestionRun run) {
        try {
            runRepository.save(run);
        } catch (Exception e) {
            log.warn("Failed to record ingestion run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    private static String failureMessage(IngestionRun run, RuntimeException e) {
        return e.getMessage() + " (last persisted page " + run.getLastPersistedPage() + ")";
    }
}
