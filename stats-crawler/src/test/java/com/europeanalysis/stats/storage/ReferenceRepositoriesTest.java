package com.europeanalysis.stats.storage;

import com.europeanalysis.stats.model.DataSource;
import com.europeanalysis.stats.model.IngestionRun;
import com.europeanalysis.stats.model.RawSnapshot;
import com.europeanalysis.stats.model.Region;
import com.europeanalysis.stats.model.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceRepositoriesTest {

    private TestDatabase db;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
    }

    @Test
    void firstRegionWriterWins() {
        Region first = db.regions().getOrCreate("DE1", "Baden-Württemberg", "nuts1", "DE");
        Region second = db.regions().getOrCreate("DE1", "Something else", "nuts2", null);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getName()).isEqualTo("Baden-Württemberg");
        assertThat(second.getParentCode()).isEqualTo("DE");
        assertThat(db.count("regions")).isEqualTo(1);
    }

    @Test
    void regionSearchMatchesCodeOrName() {
        db.regions().getOrCreate("DE", "Germany", "country", null);
        db.regions().getOrCreate("DE1", "Baden-Württemberg", "nuts1", "DE");
        db.regions().getOrCreate("FR", "France", "country", null);

        assertThat(db.regions().search("de")).extracting(Region::getCode).containsExactly("DE", "DE1");
        assertThat(db.regions().search("fran")).extracting(Region::getCode).containsExactly("FR");
        assertThat(db.regions().findAll()).hasSize(3);
    }

    @Test
    void lastUpdatedOnlyMovesForward() {
        DataSource source = db.dataSources().getOrCreate("eurostat:demo_pjan", "api", "http://upstream.test");
        Instant later = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Instant earlier = later.minusSeconds(60);

        assertThat(source.getLastUpdated()).isNull();
        assertThat(db.dataSources().markUpdated(source.getId(), later)).isTrue();
        assertThat(db.dataSources().markUpdated(source.getId(), earlier)).isFalse();
        assertThat(db.dataSources().findById(source.getId()).orElseThrow().getLastUpdated()).isEqualTo(later);
        assertThat(db.dataSources().getOrCreate("eurostat:demo_pjan", "api", null).getId()).isEqualTo(source.getId());
    }

    @Test
    void identicalSnapshotIsArchivedOnce() {
        RawSnapshot snapshot = RawSnapshot.builder()
                .datasetId("demo_pjan")
                .pageIndex(0)
                .requestUri("http://upstream.test/data/demo_pjan?time=2023")
                .queryParams("{\"time\":[\"2023\"]}")
                .retrievedAt(Instant.now().truncatedTo(ChronoUnit.MILLIS))
                .payload("{\"value\":{}}".getBytes(StandardCharsets.UTF_8))
                .contentHash("0f".repeat(32))
                .build();

        assertThat(db.snapshots().archive(snapshot)).isTrue();
        assertThat(db.snapshots().archive(snapshot)).isFalse();
        assertThat(db.snapshots().findByDataset("demo_pjan"))
                .singleElement()
                .satisfies(s -> assertThat(s.getPayload()).isEqualTo("{\"value\":{}}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void snapshotKeepsBytesThatAreNotUtf8() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes("geo;name\nCH04;".getBytes(StandardCharsets.ISO_8859_1));
        out.writeBytes("Zürich".getBytes(StandardCharsets.ISO_8859_1));
        out.write(0);
        out.write(0xFF);
        byte[] payload = out.toByteArray();
        String hash = HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(payload));

        db.snapshots().archive(RawSnapshot.builder()
                .datasetId("pop_ch")
                .pageIndex(0)
                .requestUri("file:/data/pop_ch.csv")
                .queryParams("{}")
                .retrievedAt(Instant.now().truncatedTo(ChronoUnit.MILLIS))
                .payload(payload)
                .contentHash(hash)
                .build());

        RawSnapshot stored = db.snapshots().findByDataset("pop_ch").get(0);
        assertThat(stored.getPayload()).isEqualTo(payload);
        assertThat(HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(stored.getPayload())))
                .isEqualTo(stored.getContentHash());
    }

    @Test
    void terminalRunsAreRecorded() {
        IngestionRun run = IngestionRun.pending("demo_pjan", 2);
        run.transitionTo(RunState.FETCHING);
        run.fail("HTTP 503 from upstream (last persisted page -1)");

        db.runs().save(run);

        assertThat(db.runs().findByDataset("demo_pjan", 10)).singleElement().satisfies(stored -> {
            assertThat(stored.getRunId()).isEqualTo(run.getRunId());
            assertThat(stored.getState()).isEqualTo(RunState.FAILED);
            assertThat(stored.getStartPage()).isEqualTo(2);
            assertThat(stored.getLastPersistedPage()).isEqualTo(-1);
            assertThat(stored.getErrorMessage()).contains("503");
        });
        assertThat(db.runs().findRecent(10)).hasSize(1);
    }
}
