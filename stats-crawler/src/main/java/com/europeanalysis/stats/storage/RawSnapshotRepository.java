package com.europeanalysis.stats.storage;

import com.europeanalysis.stats.model.RawSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Append-only archive of every fetched page, kept independently of the facts
 * derived from it.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class RawSnapshotRepository {

    private static final RowMapper<RawSnapshot> ROW_MAPPER = (rs, n) -> RawSnapshot.builder()
            .id(rs.getLong("id"))
            .datasetId(rs.getString("dataset_id"))
            .pageIndex(rs.getInt("page_index"))
            .requestUri(rs.getString("request_uri"))
            .queryParams(rs.getString("query_params"))
            .retrievedAt(JdbcSupport.instant(rs, "retrieved_at"))
            .contentHash(rs.getString("content_hash"))
            .payload(rs.getBytes("payload"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    /**
     * @return false if an identical snapshot (same dataset, retrieval time and hash) was already stored
     */
    public boolean archive(RawSnapshot snapshot) {
        int rows = jdbcTemplate.update("""
                INSERT INTO raw_snapshots
                (dataset_id, page_index, request_uri, query_params, retrieved_at, content_hash, payload)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT DO NOTHING
                """,
                snapshot.getDatasetId(),
                snapshot.getPageIndex(),
                snapshot.getRequestUri(),
                snapshot.getQueryParams(),
                JdbcSupport.timestamp(snapshot.getRetrievedAt()),
                snapshot.getContentHash(),
                snapshot.getPayload());
        if (rows == 0) {
            log.debug("Snapshot {} page {} ({}) already archived",
                    snapshot.getDatasetId(), snapshot.getPageIndex(), snapshot.getContentHash());
        }
        return rows > 0;
    }

    public List<RawSnapshot> findByDataset(String datasetId) {
        return jdbcTemplate.query("""
                SELECT id, dataset_id, page_index, request_uri, query_params, retrieved_at, content_hash, payload
                FROM raw_snapshots WHERE dataset_id = ?
                ORDER BY retrieved_at, page_index
                """, ROW_MAPPER, datasetId);
    }

    public long countByDataset(String datasetId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM raw_snapshots WHERE dataset_id = ?", Long.class, datasetId);
        return count == null ? 0 : count;
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM raw_snapshots", Long.class);
        return count == null ? 0 : count;
    }
}
