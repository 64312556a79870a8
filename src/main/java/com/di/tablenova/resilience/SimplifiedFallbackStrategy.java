package com.di.tablenova.resilience;

import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.Finding;
import com.di.tablenova.analysis.model.Priority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Last-resort fallback: a single low-confidence placeholder finding asking for manual review.
 * Never throws.
 */
@Slf4j
@Component
@Order(1)
public class SimplifiedFallbackStrategy implements FallbackStrategy {

    public static final String NAME = "simplified";
    static final double PLACEHOLDER_CONFIDENCE = 0.3;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AnalysisOutcome apply(ErrorContext context, Throwable lastError) {
        AnalysisCategory category = context.getCategory() != null ? context.getCategory() : AnalysisCategory.STRUCTURE;
        String tableName = context.getTableName() != null ? context.getTableName() : "unknown table";
        log.info("[FAULT] Simplified fallback for table={} category={}", tableName, category);

        Finding placeholder = Finding.builder()
                .tableId(context.getTableId())
                .tableName(context.getTableName())
                .category(category)
                .priority(Priority.MEDIUM)
                .issueType("analysis_fallback")
                .description("Automated " + category.getValue() + " analysis of table " + tableName
                        + " could not be completed and needs a manual review")
                .recommendation("Schedule a manual review of the table structure and apply the improvements it identifies")
                .impact("Unknown until the manual review is completed")
                .effort("medium")
                .estimatedImprovement("To be determined")
                .implementationSteps(List.of(
                        "Schedule manual review",
                        "Assess table structure",
                        "Implement improvements"))
                .confidenceScore(PLACEHOLDER_CONFIDENCE)
                .build();

        return AnalysisOutcome.builder()
                .finding(placeholder)
                .fallbackUsed(true)
                .fallbackType(NAME)
                .metadataEntry("error_info", errorInfo(context, lastError))
                .build();
    }

    static Map<String, Object> errorInfo(ErrorContext context, Throwable lastError) {
        ErrorCategory category = ErrorCategory.categorize(lastError);
        boolean finalAttempt = context.getAttemptNumber() >= context.getMaxAttempts();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("original_error", lastError != null ? String.valueOf(lastError.getMessage()) : "unknown");
        info.put("error_category", category.getValue());
        info.put("severity", ErrorSeverity.of(category, finalAttempt).getValue());
        return info;
    }
}
