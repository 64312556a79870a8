package com.di.tablenova.quality;

import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.Effort;
import com.di.tablenova.analysis.model.Finding;
import com.di.tablenova.analysis.model.Priority;
import com.di.tablenova.metrics.AnalysisMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores individual findings with six heuristic checks and aggregates batch statistics.
 *
 * <p>A finding whose worst check is {@code invalid} is rejected; {@code warning} keeps it with a
 * flag. The overall score is a weighted mean: confidence 0.30, content 0.25, actionability 0.20,
 * specificity 0.15, consistency 0.10, category alignment 0.10.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QualityGate {

    static final double MIN_CONFIDENCE = 0.5;
    static final int MIN_DESCRIPTION_LENGTH = 20;
    static final int MIN_RECOMMENDATION_LENGTH = 30;
    static final int PREVIEW_LENGTH = 100;

    private static final Map<String, Double> WEIGHTS = Map.of(
            QualityCheck.CONFIDENCE, 0.30,
            QualityCheck.CONTENT, 0.25,
            QualityCheck.ACTIONABILITY, 0.20,
            QualityCheck.SPECIFICITY, 0.15,
            QualityCheck.CONSISTENCY, 0.10,
            QualityCheck.CATEGORY_ALIGNMENT, 0.10);
    private static final double DEFAULT_WEIGHT = 0.10;

    private static final List<String> HEDGING_WORDS =
            List.of("maybe", "possibly", "might", "could be", "perhaps", "potentially");
    private static final List<String> ACTION_WORDS =
            List.of("create", "add", "remove", "update", "modify", "implement", "configure", "set up", "change");
    private static final List<String> CONCRETE_ELEMENTS =
            List.of("field", "table", "view", "formula", "relationship", "validation", "automation");
    private static final List<String> GENERIC_PHRASES =
            List.of("improve performance", "better organization", "optimize structure", "enhance quality");

    private static final Pattern METRIC = Pattern.compile("\\d+%|\\d+x|reduce|increase|improve");
    private static final Pattern QUANTIFIED = Pattern.compile("\\d+%|\\d+x|by \\d+|reduce.*\\d+|increase.*\\d+");
    private static final Pattern TABLE_REFERENCE = Pattern.compile("table|field|column|record");

    /** Terms the description should use to be specific about its category. */
    private static final Map<AnalysisCategory, List<String>> SPECIFICITY_TERMS = new EnumMap<>(AnalysisCategory.class);
    /** Terms description + recommendation must use for the category alignment check. */
    private static final Map<AnalysisCategory, List<String>> ALIGNMENT_TERMS = new EnumMap<>(AnalysisCategory.class);
    /** Categories whose content is penalised by the consistency check when off-topic. */
    private static final Map<AnalysisCategory, List<String>> CONSISTENCY_TERMS = new EnumMap<>(AnalysisCategory.class);

    static {
        SPECIFICITY_TERMS.put(AnalysisCategory.STRUCTURE, List.of("field", "organization", "layout", "grouping"));
        SPECIFICITY_TERMS.put(AnalysisCategory.NORMALIZATION, List.of("normalize", "relationship", "redundancy", "dependency"));
        SPECIFICITY_TERMS.put(AnalysisCategory.FIELD_TYPES, List.of("type", "format", "validation", "constraint"));
        SPECIFICITY_TERMS.put(AnalysisCategory.RELATIONSHIPS, List.of("link", "lookup", "rollup", "reference"));
        SPECIFICITY_TERMS.put(AnalysisCategory.PERFORMANCE, List.of("speed", "load", "query", "index"));
        SPECIFICITY_TERMS.put(AnalysisCategory.DATA_QUALITY, List.of("validation", "consistency", "accuracy", "completeness"));
        SPECIFICITY_TERMS.put(AnalysisCategory.NAMING_CONVENTIONS, List.of("name", "naming", "convention", "standard"));
        SPECIFICITY_TERMS.put(AnalysisCategory.INDEXING, List.of("index", "query", "search", "sort"));

        ALIGNMENT_TERMS.put(AnalysisCategory.STRUCTURE,
                List.of("field", "organization", "layout", "grouping", "structure", "design", "schema"));
        ALIGNMENT_TERMS.put(AnalysisCategory.NORMALIZATION,
                List.of("normalize", "redundancy", "dependency", "relationship", "split", "separate", "duplicate"));
        ALIGNMENT_TERMS.put(AnalysisCategory.FIELD_TYPES,
                List.of("field type", "validation", "format", "constraint", "data type", "single line", "long text", "number", "date"));
        ALIGNMENT_TERMS.put(AnalysisCategory.RELATIONSHIPS,
                List.of("relationship", "link", "lookup", "rollup", "reference", "connection", "foreign key"));
        ALIGNMENT_TERMS.put(AnalysisCategory.PERFORMANCE,
                List.of("performance", "speed", "optimization", "efficiency", "load time", "query", "index", "slow"));
        ALIGNMENT_TERMS.put(AnalysisCategory.DATA_QUALITY,
                List.of("quality", "validation", "consistency", "accuracy", "completeness", "integrity", "clean", "standardize"));
        ALIGNMENT_TERMS.put(AnalysisCategory.NAMING_CONVENTIONS,
                List.of("name", "naming", "convention", "consistent", "standard", "prefix", "label"));
        ALIGNMENT_TERMS.put(AnalysisCategory.INDEXING,
                List.of("index", "search", "lookup", "query", "primary field", "sort", "filter"));

        CONSISTENCY_TERMS.put(AnalysisCategory.PERFORMANCE, List.of("performance", "speed", "optimization", "efficiency"));
        CONSISTENCY_TERMS.put(AnalysisCategory.DATA_QUALITY, List.of("quality", "validation", "consistency", "accuracy"));
        CONSISTENCY_TERMS.put(AnalysisCategory.RELATIONSHIPS, List.of("relationship", "link", "reference", "connection"));
    }

    private final AnalysisMetrics metrics;

    // ------------------------------------------------------------------ //
    // Single finding                                                      //
    // ------------------------------------------------------------------ //

    public List<QualityCheck> validate(Finding finding) {
        List<QualityCheck> checks = new ArrayList<>(6);
        checks.add(checkConfidence(finding));
        checks.add(checkContent(finding));
        checks.add(checkActionability(finding));
        checks.add(checkSpecificity(finding));
        checks.add(checkConsistency(finding));
        checks.add(checkCategoryAlignment(finding));
        return checks;
    }

    public ValidatedFinding evaluate(Finding finding) {
        List<QualityCheck> checks = validate(finding);
        QualityCheck worst = worst(checks);
        return ValidatedFinding.builder()
                .finding(finding)
                .qualityScore(overallScore(checks))
                .verdict(worst.getVerdict())
                .qualityWarning(worst.getVerdict() == ValidationVerdict.WARNING ? worst.getMessage() : null)
                .checks(checks)
                .build();
    }

    public static double overallScore(List<QualityCheck> checks) {
        if (checks.isEmpty()) {
            return 0.0;
        }
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (QualityCheck check : checks) {
            double weight = WEIGHTS.getOrDefault(check.getCheckName(), DEFAULT_WEIGHT);
            weighted += check.getScore() * weight;
            totalWeight += weight;
        }
        return totalWeight > 0 ? weighted / totalWeight : 0.0;
    }

    static QualityCheck worst(List<QualityCheck> checks) {
        return checks.stream()
                .max(Comparator.comparingInt((QualityCheck c) -> c.getVerdict().ordinal())
                        .thenComparing(QualityCheck::getScore, Comparator.reverseOrder()))
                .orElseThrow(() -> new IllegalArgumentException("No quality checks"));
    }

    // ------------------------------------------------------------------ //
    // Batch                                                               //
    // ------------------------------------------------------------------ //

    /**
     * @param results table id, then category, then the findings produced for it
     */
    public BatchValidationSummary validateBatch(Map<String, Map<AnalysisCategory, List<Finding>>> results) {
        int total = 0;
        int valid = 0;
        int warning = 0;
        int invalid = 0;
        List<Double> allScores = new ArrayList<>();
        Map<AnalysisCategory, List<Double>> categoryScores = new EnumMap<>(AnalysisCategory.class);
        Map<String, Double> tableScores = new LinkedHashMap<>();
        List<BatchValidationSummary.QualityIssue> issues = new ArrayList<>();
        Map<String, Map<AnalysisCategory, List<ValidatedFinding>>> accepted = new LinkedHashMap<>();

        for (Map.Entry<String, Map<AnalysisCategory, List<Finding>>> tableEntry : results.entrySet()) {
            String tableId = tableEntry.getKey();
            double tableCheckSum = 0.0;
            int tableCheckCount = 0;
            Map<AnalysisCategory, List<ValidatedFinding>> tableAccepted = new EnumMap<>(AnalysisCategory.class);

            for (Map.Entry<AnalysisCategory, List<Finding>> categoryEntry : tableEntry.getValue().entrySet()) {
                AnalysisCategory category = categoryEntry.getKey();
                for (Finding finding : categoryEntry.getValue()) {
                    total++;
                    ValidatedFinding validated = evaluate(finding);
                    for (QualityCheck check : validated.getChecks()) {
                        tableCheckSum += check.getScore();
                        tableCheckCount++;
                    }
                    allScores.add(validated.getQualityScore());
                    categoryScores.computeIfAbsent(category, c -> new ArrayList<>()).add(validated.getQualityScore());
                    metrics.recordQualityVerdict(validated.getVerdict().getValue());

                    switch (validated.getVerdict()) {
                        case VALID:
                            valid++;
                            tableAccepted.computeIfAbsent(category, c -> new ArrayList<>()).add(validated);
                            break;
                        case WARNING:
                            warning++;
                            tableAccepted.computeIfAbsent(category, c -> new ArrayList<>()).add(validated);
                            break;
                        default:
                            invalid++;
                            issues.add(BatchValidationSummary.QualityIssue.builder()
                                    .tableId(tableId)
                                    .category(category)
                                    .issue(worst(validated.getChecks()).getMessage())
                                    .analysisPreview(preview(finding.descriptionOrEmpty()))
                                    .build());
                    }
                }
            }
            if (tableCheckCount > 0) {
                tableScores.put(tableId, tableCheckSum / tableCheckCount);
            }
            accepted.put(tableId, tableAccepted);
        }

        Map<String, Double> categoryMeans = new LinkedHashMap<>();
        categoryScores.forEach((category, scores) -> categoryMeans.put(category.getValue(), mean(scores)));

        BatchValidationSummary.Statistics statistics = BatchValidationSummary.Statistics.builder()
                .totalAnalyses(total)
                .validAnalyses(valid)
                .warningAnalyses(warning)
                .invalidAnalyses(invalid)
                .build();
        double overall = mean(allScores);

        log.info("[QUALITY] Validated {} findings: valid={}, warning={}, invalid={}, overall={}",
                total, valid, warning, invalid, String.format(Locale.ROOT, "%.3f", overall));

        return BatchValidationSummary.builder()
                .overallQualityScore(overall)
                .tableScores(tableScores)
                .categoryScores(categoryMeans)
                .statistics(statistics)
                .qualityIssues(issues)
                .recommendations(recommendations(overall, statistics, categoryMeans))
                .acceptedFindings(accepted)
                .build();
    }

    private static List<String> recommendations(double overall,
                                                BatchValidationSummary.Statistics stats,
                                                Map<String, Double> categoryScores) {
        List<String> out = new ArrayList<>();
        if (stats.getTotalAnalyses() > 0 && overall < 0.6) {
            out.add("Overall analysis quality is below the acceptable threshold. Consider refining prompts.");
        }
        if (stats.getInvalidAnalyses() > stats.getTotalAnalyses() * 0.1) {
            out.add("High number of invalid analyses. Review prompt engineering and model parameters.");
        }
        if (stats.getWarningAnalyses() > stats.getTotalAnalyses() * 0.3) {
            out.add("Many analyses have quality warnings. Consider post-processing improvements.");
        }
        categoryScores.forEach((category, score) -> {
            if (score < 0.5) {
                out.add("Poor quality in " + category + " analysis. Review category-specific prompts.");
            }
        });
        return out;
    }

    // ------------------------------------------------------------------ //
    // Checks                                                              //
    // ------------------------------------------------------------------ //

    private QualityCheck checkConfidence(Finding finding) {
        double confidence = finding.getConfidenceScore();
        if (confidence >= 0.8) {
            return check(QualityCheck.CONFIDENCE, ValidationVerdict.VALID, 1.0, "High confidence score", List.of());
        }
        if (confidence >= MIN_CONFIDENCE) {
            return check(QualityCheck.CONFIDENCE, ValidationVerdict.WARNING, 0.7,
                    "Moderate confidence score: " + confidence,
                    List.of("Request a more specific analysis", "Validate with a domain expert"));
        }
        return check(QualityCheck.CONFIDENCE, ValidationVerdict.INVALID, 0.3,
                "Low confidence score: " + confidence,
                List.of("Re-run the analysis with a different prompt", "Provide more context"));
    }

    private QualityCheck checkContent(Finding finding) {
        String description = finding.descriptionOrEmpty();
        String recommendation = finding.recommendationOrEmpty();
        List<String> issues = new ArrayList<>();
        double score = 1.0;

        if (description.strip().length() < MIN_DESCRIPTION_LENGTH) {
            issues.add("Description too short or empty");
            score -= 0.3;
        }
        if (recommendation.strip().length() < MIN_RECOMMENDATION_LENGTH) {
            issues.add("Recommendation too short or empty");
            score -= 0.3;
        }
        String descLower = lower(description);
        String recLower = lower(recommendation);
        long hedging = HEDGING_WORDS.stream().filter(w -> descLower.contains(w) || recLower.contains(w)).count();
        if (hedging > 2) {
            issues.add("Too much vague language");
            score -= 0.2;
        }
        if (!METRIC.matcher(recLower).find()) {
            issues.add("No quantified benefit");
            score -= 0.1;
        }
        return scored(QualityCheck.CONTENT, score, "Good content quality", "Content quality issues: ",
                "Poor content quality: ", issues,
                List.of("Add more specific details", "Include quantified benefits", "Reduce vague language"));
    }

    private QualityCheck checkActionability(Finding finding) {
        String recLower = lower(finding.recommendationOrEmpty());
        List<String> issues = new ArrayList<>();
        double score = 1.0;

        if (finding.getImplementationSteps() == null || finding.getImplementationSteps().isEmpty()) {
            issues.add("Missing implementation steps");
            score -= 0.4;
        }
        if (ACTION_WORDS.stream().noneMatch(recLower::contains)) {
            issues.add("Recommendation lacks clear action words");
            score -= 0.3;
        }
        if (!Effort.isKnown(finding.getEffort())) {
            issues.add("Invalid effort estimation");
            score -= 0.2;
        }
        if (CONCRETE_ELEMENTS.stream().noneMatch(recLower::contains)) {
            issues.add("No concrete element named");
            score -= 0.1;
        }
        return scored(QualityCheck.ACTIONABILITY, score, "Highly actionable recommendation", "Actionability issues: ",
                "Poor actionability: ", issues,
                List.of("Add specific implementation steps", "Include clear action items", "Name the fields or views involved"));
    }

    private QualityCheck checkSpecificity(Finding finding) {
        String descLower = lower(finding.descriptionOrEmpty());
        String recLower = lower(finding.recommendationOrEmpty());
        String improvement = finding.getEstimatedImprovement() == null ? "" : finding.getEstimatedImprovement();
        List<String> issues = new ArrayList<>();
        double score = 1.0;

        if (!TABLE_REFERENCE.matcher(descLower).find()) {
            issues.add("Lacks specific table/field references");
            score -= 0.3;
        }
        long generic = GENERIC_PHRASES.stream().filter(recLower::contains).count();
        if (generic > 1) {
            issues.add("Too many generic phrases");
            score -= 0.2;
        }
        if (!improvement.isBlank() && !QUANTIFIED.matcher(lower(improvement)).find()) {
            issues.add("Estimated improvement is not quantified");
            score -= 0.2;
        }
        List<String> terms = SPECIFICITY_TERMS.getOrDefault(finding.getCategory(), List.of());
        if (terms.stream().noneMatch(descLower::contains)) {
            issues.add("Missing category-specific terminology");
            score -= 0.2;
        }
        return scored(QualityCheck.SPECIFICITY, score, "Highly specific analysis", "Specificity issues: ",
                "Poor specificity: ", issues,
                List.of("Add specific table and field names", "Include quantified benefits", "Use category-specific terminology"));
    }

    private QualityCheck checkConsistency(Finding finding) {
        List<String> issues = new ArrayList<>();
        double score = 1.0;
        boolean highPriority = finding.getPriority() == Priority.HIGH;
        String impactLower = lower(finding.getImpact());

        if (highPriority && Effort.is(finding.getEffort(), Effort.HIGH)
                && !impactLower.contains("critical") && !impactLower.contains("significant")) {
            issues.add("High priority/effort needs stronger impact justification");
            score -= 0.2;
        }
        if (highPriority && finding.getConfidenceScore() < 0.7) {
            issues.add("High priority recommendation should have higher confidence");
            score -= 0.2;
        }
        int steps = finding.getImplementationSteps() == null ? 0 : finding.getImplementationSteps().size();
        if (Effort.is(finding.getEffort(), Effort.LOW) && steps > 3) {
            issues.add("Low effort claim inconsistent with many implementation steps");
            score -= 0.2;
        } else if (Effort.is(finding.getEffort(), Effort.HIGH) && steps < 2) {
            issues.add("High effort claim inconsistent with few implementation steps");
            score -= 0.2;
        }
        List<String> required = CONSISTENCY_TERMS.get(finding.getCategory());
        if (required != null) {
            String content = lower(finding.descriptionOrEmpty() + " " + finding.recommendationOrEmpty());
            if (required.stream().noneMatch(content::contains)) {
                issues.add("Content does not align with " + finding.getCategory().getValue() + " category");
                score -= 0.3;
            }
        }
        return scored(QualityCheck.CONSISTENCY, score, "Internally consistent analysis", "Consistency issues: ",
                "Poor consistency: ", issues,
                List.of("Align priority with confidence", "Match effort with implementation complexity"));
    }

    private QualityCheck checkCategoryAlignment(Finding finding) {
        AnalysisCategory category = finding.getCategory();
        List<String> terms = category != null ? ALIGNMENT_TERMS.get(category) : null;
        if (terms == null) {
            return check(QualityCheck.CATEGORY_ALIGNMENT, ValidationVerdict.WARNING, 0.7,
                    "No alignment vocabulary for category " + category, List.of("Manually review category alignment"));
        }
        String content = lower(finding.descriptionOrEmpty() + " " + finding.recommendationOrEmpty());
        if (terms.stream().anyMatch(content::contains)) {
            return check(QualityCheck.CATEGORY_ALIGNMENT, ValidationVerdict.VALID, 1.0,
                    "Well-aligned with " + category.getValue() + " category", List.of());
        }
        return check(QualityCheck.CATEGORY_ALIGNMENT, ValidationVerdict.WARNING, 0.5,
                "Weak alignment with " + category.getValue() + " category",
                List.of("Focus on " + category.getDescription().toLowerCase(Locale.ROOT)));
    }

    // ------------------------------------------------------------------ //

    private static QualityCheck scored(String name, double rawScore, String validMessage, String warningPrefix,
                                       String invalidPrefix, List<String> issues, List<String> suggestions) {
        // Rounded so that e.g. 1.0 - 0.3 - 0.2 lands on 0.5 rather than just below it.
        double score = Math.max(0.0, Math.round(rawScore * 10_000) / 10_000.0);
        ValidationVerdict verdict = ValidationVerdict.forScore(score);
        switch (verdict) {
            case VALID:
                return check(name, verdict, score, validMessage, List.of());
            case WARNING:
                return check(name, verdict, score, warningPrefix + String.join(", ", issues), suggestions);
            default:
                return check(name, verdict, score, invalidPrefix + String.join(", ", issues), suggestions);
        }
    }

    private static QualityCheck check(String name, ValidationVerdict verdict, double score, String message,
                                      List<String> suggestions) {
        return QualityCheck.builder()
                .checkName(name)
                .verdict(verdict)
                .score(score)
                .message(message)
                .suggestions(suggestions)
                .build();
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    private static String preview(String description) {
        return description.length() <= PREVIEW_LENGTH ? description : description.substring(0, PREVIEW_LENGTH);
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
