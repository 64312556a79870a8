package com.di.tablenova.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Immutable description of one table as handed to the analyzer.
 * <p>{@code containerId} is the platform base/workspace the table lives in; relationships,
 * views and record count are optional and only enrich the prompt.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableDescriptor {

    @NotBlank(message = "containerId must not be blank")
    String containerId;

    @NotBlank(message = "tableId must not be blank")
    String tableId;

    @NotBlank(message = "tableName must not be blank")
    String tableName;

    @Singular
    List<FieldDescriptor> fields;

    Long recordCount;

    @Singular
    List<RelationshipDescriptor> relationships;

    @Singular
    List<ViewDescriptor> views;
}
