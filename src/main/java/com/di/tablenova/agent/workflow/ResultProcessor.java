package com.di.tablenova.agent.workflow;

import com.di.tablenova.agent.analyzer.TableAnalysis;
import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.Finding;
import com.di.tablenova.analysis.model.Priority;
import com.di.tablenova.analysis.model.TableDescriptor;
import com.di.tablenova.quality.BatchValidationSummary;
import com.di.tablenova.quality.QualityGate;
import com.di.tablenova.quality.ValidatedFinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The process phase: runs the quality gate over every finding, drops accepted findings below the
 * confidence threshold into {@code qualityFiltered}, buckets the rest by priority and builds the
 * per-table summaries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultProcessor {

    static final int TOP_RECOMMENDATIONS = 5;
    static final double TOP_RECOMMENDATION_CONFIDENCE = 0.8;

    private final QualityGate qualityGate;

    public ProcessedResults process(Map<String, TableAnalysis> analyses,
                                    Map<String, TableDescriptor> tablesById,
                                    double confidenceThreshold) {
        Map<String, Map<AnalysisCategory, List<Finding>>> findings = new LinkedHashMap<>();
        analyses.forEach((tableId, analysis) -> findings.put(tableId, analysis.findingsByCategory()));
        BatchValidationSummary validation = qualityGate.validateBatch(findings);

        List<ValidatedFinding> high = new ArrayList<>();
        List<ValidatedFinding> medium = new ArrayList<>();
        List<ValidatedFinding> low = new ArrayList<>();
        List<ValidatedFinding> filtered = new ArrayList<>();
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        for (AnalysisCategory category : AnalysisCategory.values()) {
            byCategory.put(category.getValue(), 0);
        }
        Map<String, TableSummary> summaries = new LinkedHashMap<>();

        for (Map.Entry<String, TableAnalysis> entry : analyses.entrySet()) {
            String tableId = entry.getKey();
            TableAnalysis analysis = entry.getValue();
            Map<AnalysisCategory, List<ValidatedFinding>> accepted =
                    validation.getAcceptedFindings().getOrDefault(tableId, Map.of());

            int total = 0;
            int highCount = 0;
            int mediumCount = 0;
            int lowCount = 0;
            List<TableSummary.TopRecommendation> top = new ArrayList<>();

            for (Map.Entry<AnalysisCategory, List<ValidatedFinding>> categoryEntry : accepted.entrySet()) {
                byCategory.merge(categoryEntry.getKey().getValue(), categoryEntry.getValue().size(), Integer::sum);
                for (ValidatedFinding validated : categoryEntry.getValue()) {
                    Finding finding = validated.getFinding();
                    total++;
                    if (finding.getConfidenceScore() < confidenceThreshold) {
                        filtered.add(validated);
                        continue;
                    }
                    if (finding.getPriority() == Priority.HIGH) {
                        high.add(validated);
                        highCount++;
                    } else if (finding.getPriority() == Priority.MEDIUM) {
                        medium.add(validated);
                        mediumCount++;
                    } else {
                        low.add(validated);
                        lowCount++;
                    }
                    if (finding.getConfidenceScore() >= TOP_RECOMMENDATION_CONFIDENCE && finding.getPriority() != Priority.LOW) {
                        top.add(new TableSummary.TopRecommendation(categoryEntry.getKey(),
                                finding.getRecommendation(), finding.getConfidenceScore()));
                    }
                }
            }

            TableDescriptor table = tablesById.get(tableId);
            summaries.put(tableId, TableSummary.builder()
                    .tableId(tableId)
                    .tableName(analysis.getTableName())
                    .containerId(table != null ? table.getContainerId() : null)
                    .totalIssues(total)
                    .highPriority(highCount)
                    .mediumPriority(mediumCount)
                    .lowPriority(lowCount)
                    .categoriesAnalyzed(new ArrayList<>(analysis.getOutcomes().keySet()))
                    .topRecommendations(top.stream()
                            .sorted(Comparator.comparingDouble(TableSummary.TopRecommendation::getConfidence).reversed())
                            .limit(TOP_RECOMMENDATIONS)
                            .collect(Collectors.toList()))
                    .build());
        }

        log.info("[WORKFLOW] Processed {} tables: high={}, medium={}, low={}, filtered={}, rejected={}",
                analyses.size(), high.size(), medium.size(), low.size(), filtered.size(),
                validation.getStatistics().getInvalidAnalyses());

        return ProcessedResults.builder()
                .highPriorityIssues(high)
                .mediumPriorityIssues(medium)
                .lowPriorityIssues(low)
                .qualityFiltered(filtered)
                .summaryByCategory(byCategory)
                .tableSummaries(summaries)
                .validation(validation)
                .build();
    }
}
