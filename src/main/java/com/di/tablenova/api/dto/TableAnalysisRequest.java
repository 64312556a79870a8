package com.di.tablenova.api.dto;

import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.FieldDescriptor;
import com.di.tablenova.analysis.model.RelationshipDescriptor;
import com.di.tablenova.analysis.model.TableDescriptor;
import com.di.tablenova.analysis.model.ViewDescriptor;
import com.di.tablenova.platform.RelationshipExtractor;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Inbound body describing one table. Relationships are derived from link, lookup and rollup
 * fields when the caller sends none.
 */
@Data
@Builder
@Jacksonized
public class TableAnalysisRequest {

    @NotBlank(message = "containerId must not be blank")
    private String containerId;

    @NotBlank(message = "tableId must not be blank")
    private String tableId;

    @NotBlank(message = "tableName must not be blank")
    private String tableName;

    @NotNull(message = "fields must be provided")
    private List<FieldDescriptor> fields;

    /** Null or empty means every category. */
    private List<AnalysisCategory> categories;

    @Min(value = 0, message = "recordCount must not be negative")
    private Long recordCount;

    private List<RelationshipDescriptor> relationships;

    private List<ViewDescriptor> views;

    public TableDescriptor toDescriptor() {
        return TableDescriptor.builder()
                .containerId(containerId)
                .tableId(tableId)
                .tableName(tableName)
                .fields(fields)
                .recordCount(recordCount)
                .relationships(relationships != null && !relationships.isEmpty()
                        ? relationships : RelationshipExtractor.extract(fields))
                .views(views != null ? views : List.of())
                .build();
    }

    public List<AnalysisCategory> categoriesOrAll() {
        return categories == null || categories.isEmpty() ? AnalysisCategory.all() : AnalysisCategory.distinct(categories);
    }
}
