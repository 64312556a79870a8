package com.di.tablenova.agent.workflow;

import com.di.tablenova.quality.BatchValidationSummary;
import com.di.tablenova.quality.ValidatedFinding;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Accepted findings bucketed by priority. Accepted findings under the confidence threshold go to
 * {@code qualityFiltered} instead; rejected findings appear only in the validation summary.
 */
@Value
@Builder
public class ProcessedResults {
    List<ValidatedFinding> highPriorityIssues;
    List<ValidatedFinding> mediumPriorityIssues;
    List<ValidatedFinding> lowPriorityIssues;
    List<ValidatedFinding> qualityFiltered;
    /** Accepted finding count per category wire value; every category is present. */
    Map<String, Integer> summaryByCategory;
    Map<String, TableSummary> tableSummaries;
    BatchValidationSummary validation;
}
