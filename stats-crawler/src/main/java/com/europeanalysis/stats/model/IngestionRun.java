package com.europeanalysis.stats.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks one ingestion run for observability and safe retries.
 * Stored in the ingestion_runs table once the run reaches a terminal state.
 *
 * Mutated by the worker executing the run and read concurrently by the query
 * API, so every mutator is synchronized.
 */
@Getter
@Builder
public class IngestionRun {

    private final String runId;
    private final String datasetId;
    private final int startPage;

    private volatile RunState state;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile int pagesPersisted;
    /** -1 until the first page commits. */
    private volatile int lastPersistedPage;
    private volatile int recordsFetched;
    private volatile int recordsWritten;
    private volatile int recordsDropped;
    private volatile String errorMessage;    // null unless FAILED

    @JsonIgnore
    @Getter(AccessLevel.NONE)
    @Builder.Default
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public static IngestionRun pending(String datasetId, int startPage) {
        return IngestionRun.builder()
                .runId(UUID.randomUUID().toString())
                .datasetId(datasetId)
                .startPage(startPage)
                .state(RunState.PENDING)
                .lastPersistedPage(-1)
                .build();
    }

    public synchronized void transitionTo(RunState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Run " + runId + ": illegal transition " + state + " -> " + next);
        }
        if (state == RunState.PENDING) {
            startedAt = Instant.now();
        }
        state = next;
        if (next.isTerminal()) {
            completedAt = Instant.now();
        }
    }

    public synchronized void pagePersisted(int pageIndex, int fetched, int written, int dropped) {
        pagesPersisted++;
        lastPersistedPage = pageIndex;
        recordsFetched += fetched;
        recordsWritten += written;
        recordsDropped += dropped;
    }

    public synchronized void fail(String message) {
        errorMessage = message;
        transitionTo(RunState.FAILED);
    }

    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }
}
