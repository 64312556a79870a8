package com.di.tablenova.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/** A single column of a table: id, name, platform type and type options. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldDescriptor {
    String id;
    String name;
    String type;
    @Singular("option")
    Map<String, Object> options;
    String description;
}
