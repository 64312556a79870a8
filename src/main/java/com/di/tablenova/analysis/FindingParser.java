package com.di.tablenova.analysis;

import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.Finding;
import com.di.tablenova.analysis.model.Priority;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Turns provider text into {@link Finding}s.
 * <p>The JSON array is taken from the first {@code [} to the last {@code ]} of the text, so
 * prose or code fences around it are ignored. Missing or malformed JSON yields an empty list;
 * individual entries that are not objects are skipped.
 * <p>Defaults: priority {@code medium}, effort {@code medium}, confidence {@code 0.7}.
 */
@Slf4j
@Component
public class FindingParser {

    static final double DEFAULT_CONFIDENCE = 0.7;
    static final String DEFAULT_EFFORT = "medium";

    private final ObjectMapper objectMapper;

    public FindingParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Finding> parse(String responseText, String tableId, String tableName, AnalysisCategory category) {
        Optional<String> array = extractArray(responseText);
        if (array.isEmpty()) {
            log.warn("[PARSER] No JSON array in response for table={} category={}", tableId, category);
            return Collections.emptyList();
        }
        try {
            return toFindings(objectMapper.readTree(array.get()), tableId, tableName, category);
        } catch (JsonProcessingException e) {
            log.warn("[PARSER] Malformed JSON for table={} category={}: {}", tableId, category, e.getOriginalMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Recovers findings from a truncated response: the complete array if present, otherwise the
     * prefix up to the last complete object closed with {@code ]}.
     *
     * @return empty if nothing parseable could be recovered
     */
    public Optional<List<Finding>> salvage(String partialText, String tableId, String tableName, AnalysisCategory category) {
        if (partialText == null) {
            return Optional.empty();
        }
        List<String> candidates = new ArrayList<>();
        extractArray(partialText).ifPresent(candidates::add);
        int start = partialText.indexOf('[');
        int lastObjectEnd = partialText.lastIndexOf('}');
        if (start >= 0 && lastObjectEnd > start) {
            candidates.add(partialText.substring(start, lastObjectEnd + 1) + "]");
        }
        for (String candidate : candidates) {
            try {
                List<Finding> findings = toFindings(objectMapper.readTree(candidate), tableId, tableName, category);
                if (!findings.isEmpty()) {
                    return Optional.of(findings);
                }
            } catch (JsonProcessingException e) {
                log.debug("[PARSER] Salvage candidate rejected for table={}: {}", tableId, e.getOriginalMessage());
            }
        }
        return Optional.empty();
    }

    static Optional<String> extractArray(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, end + 1));
    }

    private List<Finding> toFindings(JsonNode root, String tableId, String tableName, AnalysisCategory category) {
        if (root == null || !root.isArray()) {
            return Collections.emptyList();
        }
        List<Finding> findings = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                continue;
            }
            List<String> steps = new ArrayList<>();
            JsonNode stepsNode = node.path("implementation_steps");
            if (stepsNode.isArray()) {
                stepsNode.forEach(s -> {
                    if (!s.isNull()) {
                        steps.add(s.asText());
                    }
                });
            }
            findings.add(Finding.builder()
                    .tableId(tableId)
                    .tableName(tableName)
                    .category(category)
                    .priority(Priority.fromValue(text(node, "priority", null)))
                    .issueType(text(node, "issue_type", ""))
                    .description(text(node, "description", ""))
                    .recommendation(text(node, "recommendation", ""))
                    .impact(text(node, "impact", ""))
                    .effort(text(node, "effort", DEFAULT_EFFORT))
                    .estimatedImprovement(text(node, "estimated_improvement", ""))
                    .implementationSteps(steps)
                    .confidenceScore(confidence(node.get("confidence_score")))
                    .build());
        }
        return findings;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return value.asText();
    }

    private static double confidence(JsonNode value) {
        if (value == null || value.isNull()) {
            return DEFAULT_CONFIDENCE;
        }
        double raw;
        if (value.isNumber()) {
            raw = value.asDouble();
        } else {
            try {
                raw = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return DEFAULT_CONFIDENCE;
            }
        }
        if (Double.isNaN(raw)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, raw));
    }
}
