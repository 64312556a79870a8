package com.di.tablenova.analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The closed set of analysis dimensions a table can be examined along.
 * <p>Wire value is the lower-case name (e.g. {@code field_types}), both as a JSON value and,
 * through {@link #toString()}, as a JSON map key. Each category carries the
 * description served by the category catalogue and the heuristic per-call cost used by estimates.
 */
public enum AnalysisCategory {

    STRUCTURE("structure", "Analyze table structure, field organization, and design patterns", 0.02),
    NORMALIZATION("normalization", "Identify normalization opportunities and data redundancy issues", 0.025),
    FIELD_TYPES("field_types", "Optimize field types, configurations, and validation rules", 0.015),
    RELATIONSHIPS("relationships", "Analyze table relationships and linking opportunities", 0.03),
    PERFORMANCE("performance", "Identify performance bottlenecks and optimization opportunities", 0.02),
    DATA_QUALITY("data_quality", "Assess data quality, consistency, and validation needs", 0.02),
    NAMING_CONVENTIONS("naming_conventions", "Review naming conventions and standardization", 0.01),
    INDEXING("indexing", "Analyze indexing and query optimization opportunities", 0.015);

    private final String value;
    private final String description;
    private final double estimatedCallCost;

    AnalysisCategory(String value, String description, double estimatedCallCost) {
        this.value = value;
        this.description = description;
        this.estimatedCallCost = estimatedCallCost;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /** Heuristic USD cost of one provider call for this category. */
    public double getEstimatedCallCost() {
        return estimatedCallCost;
    }

    public static List<AnalysisCategory> all() {
        return List.of(values());
    }

    /** Drops repeats, keeping the first occurrence of each category in request order. */
    public static List<AnalysisCategory> distinct(List<AnalysisCategory> categories) {
        return categories.stream().distinct().collect(Collectors.toList());
    }

    /**
     * Resolves a wire value or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no category
     */
    @JsonCreator
    public static AnalysisCategory fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Analysis category must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown analysis category: " + raw
                        + " (expected one of " + Arrays.stream(values()).map(AnalysisCategory::getValue).toList() + ")"));
    }

    @Override
    public String toString() {
        return value;
    }
}
