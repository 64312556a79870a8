package com.di.tablenova.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A cross-table reference derived from a link, lookup or rollup field.
 * Only the attributes relevant to {@link #kind} are populated.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RelationshipDescriptor {

    public enum Kind { LINK, LOOKUP, ROLLUP }

    String fieldName;
    String fieldId;
    Kind kind;
    String linkedTableId;
    /** Link field the lookup/rollup travels through. */
    String linkFieldId;
    String fieldIdInLinkedTable;
    String formula;
    Boolean reversed;
}
