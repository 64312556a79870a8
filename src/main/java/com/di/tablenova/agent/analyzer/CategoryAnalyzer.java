package com.di.tablenova.agent.analyzer;

import com.di.tablenova.ai.config.AiProperties;
import com.di.tablenova.ai.provider.CompletionProvider;
import com.di.tablenova.ai.provider.CompletionRequest;
import com.di.tablenova.ai.provider.CompletionResult;
import com.di.tablenova.ai.provider.PromptMessage;
import com.di.tablenova.analysis.FindingParser;
import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.Finding;
import com.di.tablenova.analysis.model.TableDescriptor;
import com.di.tablenova.resilience.AnalysisOutcome;
import com.di.tablenova.resilience.ErrorContext;
import com.di.tablenova.resilience.FaultToleranceService;
import com.di.tablenova.resilience.PartialResponseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Analyses one table along one category at a time through the completion provider.
 *
 * <p>Every call waits for the global {@link RequestRateLimiter}, is priced into the process-wide
 * {@link CostTracker} (and an optional per-job one), and is parsed by {@link FindingParser}.
 * {@link #analyzeTable} wraps each category in the fault-tolerance layer.
 */
@Slf4j
@Service
public class CategoryAnalyzer {

    public static final String OPERATION_NAME = "category-analysis";

    static final String CUSTOM_PROMPT_SYSTEM = "You are an expert consultant for optimising tables, fields and "
            + "relationships in spreadsheet-style databases.";

    private final CompletionProvider provider;
    private final CategoryPromptBuilder promptBuilder;
    private final FindingParser parser;
    private final RequestRateLimiter rateLimiter;
    private final FaultToleranceService faultTolerance;
    private final AiProperties.ChatConfig chat;
    private final CostTracker processCost = new CostTracker();

    public CategoryAnalyzer(CompletionProvider provider,
                            CategoryPromptBuilder promptBuilder,
                            FindingParser parser,
                            RequestRateLimiter rateLimiter,
                            FaultToleranceService faultTolerance,
                            AiProperties aiProperties) {
        this.provider = provider;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.rateLimiter = rateLimiter;
        this.faultTolerance = faultTolerance;
        this.chat = aiProperties.getChat();
    }

    public List<Finding> analyze(TableDescriptor table, AnalysisCategory category) {
        return analyze(table, category, List.of(), null);
    }

    /**
     * Single provider call for one category. Malformed or missing JSON yields an empty list;
     * a truncated response that yields nothing raises {@link PartialResponseException}.
     *
     * @param jobCost optional per-job tracker, may be null
     */
    public List<Finding> analyze(TableDescriptor table, AnalysisCategory category,
                                 List<TableDescriptor> relatedTables, CostTracker jobCost) {
        rateLimiter.acquire();
        CompletionRequest request = CompletionRequest.builder()
                .message(PromptMessage.system(promptBuilder.systemPrompt()))
                .message(PromptMessage.user(promptBuilder.userPrompt(table, category, relatedTables)))
                .model(chat.getModel())
                .temperature(chat.getTemperature())
                .maxTokens(chat.getMaxOutputTokens())
                .build();

        long start = System.currentTimeMillis();
        CompletionResult result = provider.complete(request);
        processCost.record(result.getCost());
        if (jobCost != null) {
            jobCost.record(result.getCost());
        }

        List<Finding> findings = parser.parse(result.getText(), table.getTableId(), table.getTableName(), category);
        if (findings.isEmpty() && result.isTruncated()) {
            throw new PartialResponseException("Truncated provider response could not be parsed for table "
                    + table.getTableId(), result.getText());
        }
        log.info("[ANALYZER] table={} category={} findings={} cost={} took={}ms", table.getTableName(),
                category, findings.size(), result.getCost(), System.currentTimeMillis() - start);
        return findings;
    }

    /**
     * Runs every distinct category for the table, each guarded by retry, circuit breaker and the
     * named fallback, so the result always holds one outcome per requested category.
     */
    public TableAnalysis analyzeTable(TableDescriptor table,
                                      List<AnalysisCategory> categories,
                                      List<TableDescriptor> relatedTables,
                                      String fallbackStrategy,
                                      CostTracker jobCost) {
        long start = System.currentTimeMillis();
        Map<AnalysisCategory, AnalysisOutcome> outcomes = new EnumMap<>(AnalysisCategory.class);
        for (AnalysisCategory category : AnalysisCategory.distinct(categories)) {
            ErrorContext context = ErrorContext.forCategory(OPERATION_NAME, table.getTableId(), table.getTableName(),
                    category, faultTolerance.getMaxAttempts());
            outcomes.put(category, faultTolerance.executeWithFallback(
                    () -> analyze(table, category, relatedTables, jobCost), context, fallbackStrategy));
        }
        return TableAnalysis.builder()
                .tableId(table.getTableId())
                .tableName(table.getTableName())
                .outcomes(outcomes)
                .durationMs(System.currentTimeMillis() - start)
                .build();
    }

    /**
     * One free-form provider call, rate limited and priced like the category calls but without
     * parsing or fault tolerance. Null settings use the configured chat defaults.
     */
    public CompletionResult completeCustomPrompt(String prompt, String model, Double temperature, Integer maxTokens) {
        rateLimiter.acquire();
        CompletionResult result = provider.complete(CompletionRequest.builder()
                .message(PromptMessage.system(CUSTOM_PROMPT_SYSTEM))
                .message(PromptMessage.user(prompt))
                .model(model != null && !model.isBlank() ? model : chat.getModel())
                .temperature(temperature != null ? temperature : chat.getTemperature())
                .maxTokens(maxTokens != null ? maxTokens : chat.getMaxOutputTokens())
                .build());
        processCost.record(result.getCost());
        log.info("[ANALYZER] custom prompt model={} tokens={} cost={}", result.getModel(),
                result.getUsage() != null ? result.getUsage().getTotalTokens() : 0, result.getCost());
        return result;
    }

    public CostSummary costSummary() {
        return processCost.summary();
    }

    public CostEstimate estimateBatchCost(int tableCount, List<AnalysisCategory> categories) {
        return CostEstimate.of(tableCount, categories == null || categories.isEmpty() ? AnalysisCategory.all() : categories);
    }
}
