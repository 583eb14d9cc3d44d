package com.europeanalysis.stats.config;

import com.europeanalysis.stats.UnknownDatasetException;
import com.europeanalysis.stats.model.DataSource;
import com.europeanalysis.stats.model.DatasetDescriptor;
import com.europeanalysis.stats.model.DemographicFact;
import com.europeanalysis.stats.model.FactStatistics;
import com.europeanalysis.stats.model.IndustrialFact;
import com.europeanalysis.stats.model.IngestionRun;
import com.europeanalysis.stats.model.Region;
import com.europeanalysis.stats.service.DatasetRegistry;
import com.europeanalysis.stats.service.FactQueryService;
import com.europeanalysis.stats.service.IngestionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class StatsController {

    private static final String START_PAGE = "start_page";

    private final IngestionOrchestrator orchestrator;
    private final FactQueryService queryService;
    private final DatasetRegistry registry;

    // ── Ingestion triggers ────────────────────────────────────────────────────

    @GetMapping("/datasets")
    public List<DatasetDescriptor> datasets() {
        return registry.all();
    }

    /**
     * Start a run in the background.
     *
     * POST /api/ingestion/demo_pjan?start_page=2&amp;geo=DE,FR
     *
     * Every request parameter other than start_page overrides the dataset's
     * default query parameter of the same name.
     */
    @PostMapping("/ingestion/{datasetId}")
    public ResponseEntity<Map<String, Object>> trigger(@PathVariable String datasetId,
                                                       @RequestParam Map<String, String> params) {
        Map<String, String> overrides = new LinkedHashMap<>(params);
        String startPage = overrides.remove(START_PAGE);
        int start;
        try {
            start = startPage == null ? 0 : Integer.parseInt(startPage);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("start_page must be an integer, got " + startPage);
        }

        IngestionRun run = orchestrator.prepare(datasetId, start);
        orchestrator.submit(run, overrides);
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "run_id", run.getRunId(),
                "dataset_id", datasetId,
                "start_page", start));
    }

    @PostMapping("/ingestion/run-all")
    public ResponseEntity<Map<String, Object>> triggerAll() {
        int submitted = orchestrator.runAll().size();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "runs", submitted));
    }

    @PostMapping("/ingestion/runs/{runId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String runId) {
        if (!orchestrator.cancel(runId)) {
            return ResponseEntity.status(404).body(Map.of("error", "No active run " + runId));
        }
        return ResponseEntity.accepted().body(Map.of("status", "cancel_requested", "run_id", runId));
    }

    @GetMapping("/ingestion/runs/active")
    public List<IngestionRun> activeRuns() {
        return List.copyOf(orchestrator.activeRuns());
    }

    @GetMapping("/ingestion/runs")
    public Map<String, Object> runHistory(@RequestParam(name = "dataset_id", required = false) String datasetId,
                                          @RequestParam(required = false) Integer limit) {
        List<IngestionRun> data = queryService.runHistory(datasetId, limit == null ? 50 : limit);
        return Map.of("count", data.size(), "data", data);
    }

    @GetMapping("/ingestion/status")
    public Map<String, Object> status() {
        return Map.of(
                "service", "europe-analysis-stats-crawler",
                "version", "1.0.0",
                "datasets", registry.all().size(),
                "active_runs", orchestrator.activeRuns().size(),
                "data_source", "Eurostat dissemination API"
        );
    }

    // ── Query API ─────────────────────────────────────────────────────────────

    /**
     * GET /api/data/demographics?region_code=DE&amp;year=2023&amp;sex=F&amp;limit=100
     */
    @GetMapping("/data/demographics")
    public Map<String, Object> demographics(@RequestParam(name = "region_code", required = false) String regionCode,
                                            @RequestParam(required = false) Integer year,
                                            @RequestParam(required = false) String sex,
                                            @RequestParam(name = "source_id", required = false) Long sourceId,
                                            @RequestParam(required = false) Integer limit) {
        List<DemographicFact> data = queryService.demographics(regionCode, year, sex, sourceId, limit);
        return Map.of("count", data.size(), "data", data);
    }

    /**
     * GET /api/data/industrial?region_code=DE&amp;year=2024&amp;month=3&amp;nace_code=C
     */
    @GetMapping("/data/industrial")
    public Map<String, Object> industrial(@RequestParam(name = "region_code", required = false) String regionCode,
                                          @RequestParam(required = false) Integer year,
                                          @RequestParam(required = false) Integer month,
                                          @RequestParam(name = "nace_code", required = false) String naceCode,
                                          @RequestParam(name = "source_id", required = false) Long sourceId,
                                          @RequestParam(required = false) Integer limit) {
        List<IndustrialFact> data = queryService.industrial(regionCode, year, month, naceCode, sourceId, limit);
        return Map.of("count", data.size(), "data", data);
    }

    @GetMapping("/data/demographics/stats")
    public FactStatistics demographicStats(@RequestParam(name = "region_code", required = false) String regionCode,
                                           @RequestParam(required = false) Integer year) {
        return queryService.demographicStatistics(regionCode, year);
    }

    @GetMapping("/data/industrial/stats")
    public FactStatistics industrialStats(@RequestParam(name = "region_code", required = false) String regionCode,
                                          @RequestParam(required = false) Integer year) {
        return queryService.industrialStatistics(regionCode, year);
    }

    @GetMapping("/data/stats")
    public Map<String, Object> overview() {
        return queryService.overview();
    }

    @GetMapping("/data/sources")
    public Map<String, Object> sources() {
        List<DataSource> data = queryService.sources();
        return Map.of("count", data.size(), "data", data);
    }

    @GetMapping("/data/regions")
    public Map<String, Object> regions(@RequestParam(required = false) String query) {
        List<Region> data = queryService.regions(query);
        return Map.of("count", data.size(), "data", data);
    }

    @DeleteMapping("/data/sources/{sourceId}/facts")
    public Map<String, Object> purgeSource(@PathVariable long sourceId) {
        int deleted = orchestrator.purgeSource(sourceId);
        return Map.of("source_id", sourceId, "deleted", deleted);
    }

    // ── Error mapping ─────────────────────────────────────────────────────────

    @ExceptionHandler({UnknownDatasetException.class, NoSuchElementException.class})
    public ResponseEntity<Map<String, String>> notFound(RuntimeException e) {
        return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, String>> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> internalError(Exception e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
