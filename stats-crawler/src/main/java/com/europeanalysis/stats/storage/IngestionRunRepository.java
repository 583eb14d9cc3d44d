package com.europeanalysis.stats.storage;

import com.europeanalysis.stats.model.IngestionRun;
import com.europeanalysis.stats.model.RunState;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class IngestionRunRepository {

    private static final String COLUMNS = """
            run_id, dataset_id, state, start_page, started_at, completed_at, pages_persisted,
            last_persisted_page, records_fetched, records_written, records_dropped, error_message
            """;

    private static final RowMapper<IngestionRun> ROW_MAPPER = (rs, n) -> IngestionRun.builder()
            .runId(rs.getString("run_id"))
            .datasetId(rs.getString("dataset_id"))
            .state(RunState.valueOf(rs.getString("state")))
            .startPage(rs.getInt("start_page"))
            .startedAt(JdbcSupport.instant(rs, "started_at"))
            .completedAt(JdbcSupport.instant(rs, "completed_at"))
            .pagesPersisted(rs.getInt("pages_persisted"))
            .lastPersistedPage(rs.getInt("last_persisted_page"))
            .recordsFetched(rs.getInt("records_fetched"))
            .recordsWritten(rs.getInt("records_written"))
            .recordsDropped(rs.getInt("records_dropped"))
            .errorMessage(rs.getString("error_message"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public void save(IngestionRun run) {
        jdbcTemplate.update("INSERT INTO ingestion_runs (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                run.getRunId(),
                run.getDatasetId(),
                run.getState().name(),
                run.getStartPage(),
                JdbcSupport.timestamp(run.getStartedAt()),
                JdbcSupport.timestamp(run.getCompletedAt()),
                run.getPagesPersisted(),
                run.getLastPersistedPage(),
                run.getRecordsFetched(),
                run.getRecordsWritten(),
                run.getRecordsDropped(),
                run.getErrorMessage());
    }

    public List<IngestionRun> findRecent(int limit) {
        return jdbcTemplate.query("SELECT " + COLUMNS
                + " FROM ingestion_runs ORDER BY completed_at DESC LIMIT ?", ROW_MAPPER, limit);
    }

    public List<IngestionRun> findByDataset(String datasetId, int limit) {
        return jdbcTemplate.query("SELECT " + COLUMNS
                + " FROM ingestion_runs WHERE dataset_id = ? ORDER BY completed_at DESC LIMIT ?",
                ROW_MAPPER, datasetId, limit);
    }
}
