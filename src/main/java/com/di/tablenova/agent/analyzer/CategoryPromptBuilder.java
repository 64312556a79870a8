package com.di.tablenova.agent.analyzer;

import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.TableDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the system and user messages for one (table, category) analysis.
 * <p>The system message is loaded from {@code classpath:prompts/table-analysis-system.st};
 * the user message combines the table schema with a category-specific focus list and the
 * JSON response contract the parser expects.
 */
@Slf4j
@Component
public class CategoryPromptBuilder {

    private static final Map<AnalysisCategory, String> ROLES = new EnumMap<>(AnalysisCategory.class);
    private static final Map<AnalysisCategory, List<String>> FOCUS = new EnumMap<>(AnalysisCategory.class);

    static {
        ROLES.put(AnalysisCategory.STRUCTURE, "an expert database analyst reviewing table structure and design");
        ROLES.put(AnalysisCategory.NORMALIZATION, "a database normalization expert");
        ROLES.put(AnalysisCategory.FIELD_TYPES, "a field type and data validation specialist");
        ROLES.put(AnalysisCategory.RELATIONSHIPS, "a relational data modelling expert");
        ROLES.put(AnalysisCategory.PERFORMANCE, "a performance optimization specialist");
        ROLES.put(AnalysisCategory.DATA_QUALITY, "a data quality specialist");
        ROLES.put(AnalysisCategory.NAMING_CONVENTIONS, "a data governance specialist focused on naming standards");
        ROLES.put(AnalysisCategory.INDEXING, "a query and indexing specialist");

        FOCUS.put(AnalysisCategory.STRUCTURE, List.of(
                "Field organization and grouping", "Primary field effectiveness", "Field dependencies and redundancy",
                "Table size and complexity", "View organization"));
        FOCUS.put(AnalysisCategory.NORMALIZATION, List.of(
                "Repeating groups and multi-valued fields", "Partial and transitive dependencies",
                "Duplicated data that belongs in its own table", "Candidate lookup tables"));
        FOCUS.put(AnalysisCategory.FIELD_TYPES, List.of(
                "Fields stored with an unsuitable type", "Missing validation or format constraints",
                "Select fields with inconsistent options", "Date, number and currency configuration"));
        FOCUS.put(AnalysisCategory.RELATIONSHIPS, List.of(
                "Missing links to related tables", "Text fields that should be links",
                "Lookup and rollup usage", "Circular or redundant relationships"));
        FOCUS.put(AnalysisCategory.PERFORMANCE, List.of(
                "Expensive formulas, lookups and rollups", "Field count and load time",
                "View filters and sorts that slow queries", "Record volume and archiving"));
        FOCUS.put(AnalysisCategory.DATA_QUALITY, List.of(
                "Required fields and completeness", "Consistency of formats and values",
                "Duplicate detection", "Validation and cleansing rules"));
        FOCUS.put(AnalysisCategory.NAMING_CONVENTIONS, List.of(
                "Consistency of field and table names", "Abbreviations and unclear names",
                "Prefix and casing standards", "Descriptive view names"));
        FOCUS.put(AnalysisCategory.INDEXING, List.of(
                "Primary field choice for search and lookup", "Fields used in filters and sorts",
                "Search-friendly field types", "Query patterns suggested by views"));
    }

    private static final String USER_TEMPLATE = """
            You are %s. Analyze the following table and provide improvement recommendations \
            for the "%s" category (%s).

            TABLE INFORMATION:
            - Container ID: %s
            - Table Name: %s
            - Table ID: %s
            - Record Count: %s

            FIELDS:
            %s

            RELATIONSHIPS:
            %s

            VIEWS:
            %s
            %s
            ANALYSIS FOCUS:
            %s

            Respond ONLY with a JSON array of findings. Each finding must have:
            [
              {
                "issue_type": "string",
                "priority": "high|medium|low",
                "description": "string",
                "recommendation": "string",
                "impact": "string",
                "effort": "low|medium|high",
                "estimated_improvement": "string",
                "implementation_steps": ["step1", "step2"],
                "confidence_score": 0.0
              }
            ]
            Return an empty array if the table has no issues in this category.
            """;

    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    @Autowired
    public CategoryPromptBuilder(ObjectMapper objectMapper,
                                 @Value("classpath:prompts/table-analysis-system.st") Resource systemPromptResource) {
        this(objectMapper, read(systemPromptResource));
    }

    public CategoryPromptBuilder(ObjectMapper objectMapper, String systemPrompt) {
        this.objectMapper = objectMapper;
        this.systemPrompt = systemPrompt;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    /**
     * @param relatedTables other tables of the same container; only used for {@code relationships}
     */
    public String userPrompt(TableDescriptor table, AnalysisCategory category, List<TableDescriptor> relatedTables) {
        String related = "";
        if (category == AnalysisCategory.RELATIONSHIPS && relatedTables != null && !relatedTables.isEmpty()) {
            related = "\nRELATED TABLES IN THE SAME CONTAINER:\n" + toJson(relatedTables.stream()
                    .filter(t -> !t.getTableId().equals(table.getTableId()))
                    .map(t -> Map.of(
                            "table_id", t.getTableId(),
                            "table_name", t.getTableName(),
                            "fields", t.getFields().stream().map(f -> String.valueOf(f.getName())).collect(Collectors.toList())))
                    .collect(Collectors.toList())) + "\n";
        }
        String focus = FOCUS.get(category).stream()
                .map(item -> "- " + item)
                .collect(Collectors.joining("\n"));
        return String.format(USER_TEMPLATE,
                ROLES.get(category),
                category.getValue(),
                category.getDescription(),
                table.getContainerId(),
                table.getTableName(),
                table.getTableId(),
                table.getRecordCount() != null ? table.getRecordCount() : "Unknown",
                toJson(table.getFields()),
                toJson(table.getRelationships()),
                toJson(table.getViews()),
                related,
                focus);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[PROMPT] Could not serialise prompt section: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    private static String read(Resource resource) {
        try {
            return resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read system prompt " + resource.getDescription(), e);
        }
    }
}
