package com.di.tablenova.quality;

import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.Finding;
import com.di.tablenova.analysis.model.Priority;
import com.di.tablenova.metrics.AnalysisMetrics;
import com.di.tablenova.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QualityGate Tests")
class QualityGateTest {

    private QualityGate gate;

    @BeforeEach
    void setUp() {
        gate = new QualityGate(new AnalysisMetrics(new SimpleMeterRegistry()));
    }

    // ============================================================
    // Single finding
    // ============================================================

    @Test
    @DisplayName("Should run all six checks")
    void testValidate_SixChecks() {
        List<QualityCheck> checks = gate.validate(TestFixtures.strongFinding("tbl1", AnalysisCategory.STRUCTURE, Priority.HIGH, 0.92));

        assertEquals(6, checks.size());
        assertEquals(QualityCheck.CONFIDENCE, checks.get(0).getCheckName());
        assertEquals(QualityCheck.CATEGORY_ALIGNMENT, checks.get(5).getCheckName());
    }

    @Test
    @DisplayName("Should score a specific, actionable, confident finding as valid")
    void testEvaluate_StrongFinding() {
        ValidatedFinding result = gate.evaluate(TestFixtures.strongFinding("tbl1", AnalysisCategory.DATA_QUALITY, Priority.HIGH, 0.92));

        assertEquals(ValidationVerdict.VALID, result.getVerdict());
        assertTrue(result.getQualityScore() >= 0.8, "score " + result.getQualityScore());
        assertTrue(result.isAccepted());
        assertNull(result.getQualityWarning());
    }

    @Test
    @DisplayName("Should reject a vague low-confidence finding")
    void testEvaluate_WeakFinding() {
        ValidatedFinding result = gate.evaluate(TestFixtures.weakFinding("tbl1", AnalysisCategory.DATA_QUALITY));

        assertEquals(ValidationVerdict.INVALID, result.getVerdict());
        assertTrue(result.getQualityScore() < 0.5, "score " + result.getQualityScore());
        assertFalse(result.isAccepted());
    }

    @Test
    @DisplayName("Should keep a moderately confident finding with a warning")
    void testEvaluate_ModerateConfidence() {
        ValidatedFinding result = gate.evaluate(TestFixtures.strongFinding("tbl1", AnalysisCategory.DATA_QUALITY, Priority.MEDIUM, 0.6));

        assertEquals(ValidationVerdict.WARNING, result.getVerdict());
        assertTrue(result.isAccepted());
        assertTrue(result.getQualityWarning().startsWith("Moderate confidence score"));
    }

    @Test
    @DisplayName("Should penalise unknown effort and missing steps in the actionability check")
    void testActionability_Penalties() {
        Finding finding = TestFixtures.strongFinding("tbl1", AnalysisCategory.DATA_QUALITY, Priority.MEDIUM, 0.9)
                .toBuilder()
                .effort("unknown")
                .clearImplementationSteps()
                .build();

        QualityCheck actionability = check(gate.validate(finding), QualityCheck.ACTIONABILITY);

        assertEquals(0.4, actionability.getScore(), 1e-9);
        assertEquals(ValidationVerdict.INVALID, actionability.getVerdict());
        assertTrue(actionability.getMessage().contains("Missing implementation steps"));
        assertTrue(actionability.getMessage().contains("Invalid effort estimation"));
    }

    @Test
    @DisplayName("Should deduct consistency for high priority with moderate confidence")
    void testConsistency_HighPriorityLowConfidence() {
        Finding finding = TestFixtures.strongFinding("tbl1", AnalysisCategory.DATA_QUALITY, Priority.HIGH, 0.6);

        QualityCheck consistency = check(gate.validate(finding), QualityCheck.CONSISTENCY);

        assertEquals(0.8, consistency.getScore(), 1e-9);
        assertEquals(ValidationVerdict.VALID, consistency.getVerdict());
    }

    @Test
    @DisplayName("Should warn when the content uses none of the category's vocabulary")
    void testCategoryAlignment_Weak() {
        Finding finding = TestFixtures.strongFinding("tbl1", AnalysisCategory.PERFORMANCE, Priority.MEDIUM, 0.9);

        QualityCheck alignment = check(gate.validate(finding), QualityCheck.CATEGORY_ALIGNMENT);

        assertEquals(ValidationVerdict.WARNING, alignment.getVerdict());
        assertEquals(0.5, alignment.getScore(), 1e-9);
    }

    @Test
    @DisplayName("Should weight checks into a single score")
    void testOverallScore() {
        List<QualityCheck> checks = List.of(
                QualityCheck.builder().checkName(QualityCheck.CONFIDENCE).score(1.0).verdict(ValidationVerdict.VALID).build(),
                QualityCheck.builder().checkName(QualityCheck.CONTENT).score(0.0).verdict(ValidationVerdict.INVALID).build());

        assertEquals(0.30 / 0.55, QualityGate.overallScore(checks), 1e-9);
        assertEquals(0.0, QualityGate.overallScore(List.of()));
    }

    // ============================================================
    // Batch
    // ============================================================

    @Test
    @DisplayName("Should count every finding as valid, warning or invalid")
    void testValidateBatch_Counts() {
        Map<AnalysisCategory, List<Finding>> customers = new EnumMap<>(AnalysisCategory.class);
        customers.put(AnalysisCategory.DATA_QUALITY, List.of(
                TestFixtures.strongFinding("tbl1", AnalysisCategory.DATA_QUALITY, Priority.HIGH, 0.92),
                TestFixtures.weakFinding("tbl1", AnalysisCategory.DATA_QUALITY)));
        Map<AnalysisCategory, List<Finding>> orders = new EnumMap<>(AnalysisCategory.class);
        orders.put(AnalysisCategory.STRUCTURE, List.of(
                TestFixtures.strongFinding("tbl2", AnalysisCategory.STRUCTURE, Priority.LOW, 0.6)));
        Map<String, Map<AnalysisCategory, List<Finding>>> results = new LinkedHashMap<>();
        results.put("tbl1", customers);
        results.put("tbl2", orders);

        BatchValidationSummary summary = gate.validateBatch(results);

        BatchValidationSummary.Statistics stats = summary.getStatistics();
        assertEquals(3, stats.getTotalAnalyses());
        assertEquals(1, stats.getValidAnalyses());
        assertEquals(1, stats.getWarningAnalyses());
        assertEquals(1, stats.getInvalidAnalyses());
        assertEquals(stats.getTotalAnalyses(),
                stats.getValidAnalyses() + stats.getWarningAnalyses() + stats.getInvalidAnalyses());

        assertEquals(1, summary.getQualityIssues().size());
        assertEquals("tbl1", summary.getQualityIssues().get(0).getTableId());
        assertEquals(1, summary.getAcceptedFindings().get("tbl1").get(AnalysisCategory.DATA_QUALITY).size());
        assertEquals(1, summary.getAcceptedFindings().get("tbl2").get(AnalysisCategory.STRUCTURE).size());
        assertEquals(2, summary.getTableScores().size());
        assertTrue(summary.getCategoryScores().containsKey("data_quality"));
        assertTrue(summary.getRecommendations().stream().anyMatch(r -> r.startsWith("High number of invalid")));
    }

    @Test
    @DisplayName("Should return empty statistics for an empty batch")
    void testValidateBatch_Empty() {
        BatchValidationSummary summary = gate.validateBatch(Map.of());

        assertEquals(0, summary.getStatistics().getTotalAnalyses());
        assertEquals(0.0, summary.getOverallQualityScore());
        assertTrue(summary.getRecommendations().isEmpty());
    }

    private static QualityCheck check(List<QualityCheck> checks, String name) {
        return checks.stream().filter(c -> c.getCheckName().equals(name)).findFirst().orElseThrow();
    }
}
