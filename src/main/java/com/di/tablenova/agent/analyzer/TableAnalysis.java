package com.di.tablenova.agent.analyzer;

import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.Finding;
import com.di.tablenova.resilience.AnalysisOutcome;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Per-category outcomes of analysing one table. */
@Value
@Builder
public class TableAnalysis {
    String tableId;
    String tableName;
    Map<AnalysisCategory, AnalysisOutcome> outcomes;
    long durationMs;

    @JsonIgnore
    public Map<AnalysisCategory, List<Finding>> findingsByCategory() {
        Map<AnalysisCategory, List<Finding>> byCategory = new EnumMap<>(AnalysisCategory.class);
        outcomes.forEach((category, outcome) -> byCategory.put(category, outcome.getFindings()));
        return byCategory;
    }

    public int getTotalFindings() {
        return outcomes.values().stream().mapToInt(o -> o.getFindings().size()).sum();
    }

    public List<AnalysisCategory> getFallbackCategories() {
        return outcomes.entrySet().stream()
                .filter(e -> e.getValue().isFallbackUsed())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
