package com.di.tablenova.api;

import com.di.tablenova.agent.analyzer.CategoryAnalyzer;
import com.di.tablenova.agent.analyzer.CostEstimate;
import com.di.tablenova.agent.analyzer.CostTracker;
import com.di.tablenova.agent.analyzer.TableAnalysis;
import com.di.tablenova.agent.batch.BatchJobResult;
import com.di.tablenova.agent.batch.BatchJobService;
import com.di.tablenova.agent.job.JobStatus;
import com.di.tablenova.ai.provider.CompletionResult;
import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.TableDescriptor;
import com.di.tablenova.api.dto.BatchAnalysisRequest;
import com.di.tablenova.api.dto.CategoryCatalogResponse;
import com.di.tablenova.api.dto.CustomPromptRequest;
import com.di.tablenova.api.dto.CustomPromptResponse;
import com.di.tablenova.api.dto.ErrorReportResponse;
import com.di.tablenova.api.dto.JobAcceptedResponse;
import com.di.tablenova.api.dto.TableAnalysisRequest;
import com.di.tablenova.api.dto.TableAnalysisResponse;
import com.di.tablenova.config.AnalysisProperties;
import com.di.tablenova.resilience.FaultToleranceService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for table analysis.
 *
 * <pre>
 * POST /analysis/table                  → analyse one table synchronously
 * POST /analysis/custom-prompt          → free-form prompt, raw provider answer
 * POST /analysis/batch                  → start a background batch job (202); unknown fallback → 400
 * GET  /analysis/batch/{jobId}/status   → job status
 * GET  /analysis/batch/{jobId}/results  → job results (400 until completed)
 * GET  /analysis/estimate-cost          → cost estimate, no provider call
 * GET  /analysis/categories             → category catalogue
 * GET  /analysis/errors                 → error summary and recommendations
 * </pre>
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/analysis")
public class TableAnalysisController {

    private final CategoryAnalyzer analyzer;
    private final BatchJobService batchJobService;
    private final FaultToleranceService faultTolerance;
    private final AnalysisProperties properties;

    public TableAnalysisController(CategoryAnalyzer analyzer,
                                   BatchJobService batchJobService,
                                   FaultToleranceService faultTolerance,
                                   AnalysisProperties properties) {
        this.analyzer = analyzer;
        this.batchJobService = batchJobService;
        this.faultTolerance = faultTolerance;
        this.properties = properties;
    }

    @PostMapping(path = "/table", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TableAnalysisResponse> analyzeTable(@Valid @RequestBody TableAnalysisRequest request) {
        log.info("[ANALYSIS-CTRL] POST /table table={} ({})", request.getTableName(), request.getTableId());
        long start = System.currentTimeMillis();
        TableDescriptor table = request.toDescriptor();
        CostTracker requestCost = new CostTracker();
        TableAnalysis analysis = analyzer.analyzeTable(table, request.categoriesOrAll(), List.of(),
                properties.getWorkflow().getFallbackStrategy(), requestCost);
        return ResponseEntity.ok(TableAnalysisResponse.builder()
                .tableId(table.getTableId())
                .tableName(table.getTableName())
                .analysisResults(analysis.findingsByCategory())
                .fallbackCategories(analysis.getFallbackCategories())
                .costSummary(requestCost.summary())
                .analysisDurationSeconds((System.currentTimeMillis() - start) / 1000.0)
                .timestamp(Instant.now())
                .build());
    }

    @PostMapping(path = "/custom-prompt", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CustomPromptResponse> customPrompt(@Valid @RequestBody CustomPromptRequest request) {
        log.info("[ANALYSIS-CTRL] POST /custom-prompt model={} promptChars={}", request.getModel(),
                request.getCustomPrompt().length());
        CompletionResult result = analyzer.completeCustomPrompt(request.getCustomPrompt(), request.getModel(),
                request.getTemperature(), request.getMaxTokens());
        return ResponseEntity.ok(CustomPromptResponse.builder()
                .response(result.getText())
                .usage(result.getUsage())
                .model(result.getModel())
                .cost(result.getCost())
                .timestamp(Instant.now())
                .build());
    }

    /**
     * An unknown {@code fallbackStrategy} is rejected with 400 before the job is created; it is
     * not silently replaced by {@code simplified}.
     */
    @PostMapping(path = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JobAcceptedResponse> startBatch(@Valid @RequestBody BatchAnalysisRequest request) {
        List<TableDescriptor> tables = request.getTables().stream()
                .map(TableAnalysisRequest::toDescriptor)
                .collect(Collectors.toList());
        List<AnalysisCategory> categories = request.getCategories() == null || request.getCategories().isEmpty()
                ? AnalysisCategory.all() : request.getCategories();
        int batchSize = request.getBatchSize() != null ? request.getBatchSize() : properties.getBatch().getSize();
        int maxConcurrency = request.getMaxConcurrency() != null
                ? request.getMaxConcurrency() : properties.getBatch().getMaxConcurrency();
        String fallback = request.getFallbackStrategy() != null
                ? request.getFallbackStrategy() : properties.getWorkflow().getFallbackStrategy();
        faultTolerance.requireStrategy(fallback);

        log.info("[ANALYSIS-CTRL] POST /batch tables={} batchSize={} maxConcurrency={}", tables.size(), batchSize, maxConcurrency);
        JobStatus status = batchJobService.start(tables, categories, batchSize, maxConcurrency, fallback);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobAcceptedResponse.builder()
                .jobId(status.getJobId())
                .status("started")
                .build());
    }

    @GetMapping(path = "/batch/{jobId}/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JobStatus> batchStatus(@PathVariable String jobId) {
        return ResponseEntity.ok(batchJobService.status(jobId));
    }

    @GetMapping(path = "/batch/{jobId}/results", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchJobResult> batchResults(@PathVariable String jobId) {
        return ResponseEntity.ok(batchJobService.results(jobId));
    }

    @GetMapping(path = "/estimate-cost", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CostEstimate> estimateCost(
            @RequestParam @Min(value = 1, message = "tableCount must be at least 1") int tableCount,
            @RequestParam(required = false) List<AnalysisCategory> categories) {
        return ResponseEntity.ok(analyzer.estimateBatchCost(tableCount, categories));
    }

    @GetMapping(path = "/categories", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CategoryCatalogResponse> categories() {
        Map<String, CategoryCatalogResponse.CategoryInfo> catalog = new LinkedHashMap<>();
        for (AnalysisCategory category : AnalysisCategory.values()) {
            catalog.put(category.getValue(), new CategoryCatalogResponse.CategoryInfo(category.getValue(), category.getDescription()));
        }
        return ResponseEntity.ok(new CategoryCatalogResponse(catalog, catalog.size()));
    }

    @GetMapping(path = "/errors", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ErrorReportResponse> errors() {
        return ResponseEntity.ok(new ErrorReportResponse(faultTolerance.errorSummary(),
                new ArrayList<>(faultTolerance.errorRecommendations())));
    }
}
