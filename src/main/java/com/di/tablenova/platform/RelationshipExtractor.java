package com.di.tablenova.platform;

import com.di.tablenova.analysis.model.FieldDescriptor;
import com.di.tablenova.analysis.model.RelationshipDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derives cross-table relationships from field definitions: {@code multipleRecordLinks} fields
 * are links, {@code lookup} and {@code rollup} fields travel through a link field.
 */
public final class RelationshipExtractor {

    static final String LINK_TYPE = "multipleRecordLinks";
    static final String LOOKUP_TYPE = "lookup";
    static final String ROLLUP_TYPE = "rollup";

    private RelationshipExtractor() {
    }

    public static List<RelationshipDescriptor> extract(List<FieldDescriptor> fields) {
        List<RelationshipDescriptor> relationships = new ArrayList<>();
        if (fields == null) {
            return relationships;
        }
        for (FieldDescriptor field : fields) {
            String type = field.getType() == null ? "" : field.getType();
            Map<String, Object> options = field.getOptions() == null ? Map.of() : field.getOptions();
            switch (type) {
                case LINK_TYPE:
                    relationships.add(RelationshipDescriptor.builder()
                            .fieldName(field.getName())
                            .fieldId(field.getId())
                            .kind(RelationshipDescriptor.Kind.LINK)
                            .linkedTableId(asString(options.get("linkedTableId")))
                            .reversed(Boolean.TRUE.equals(options.get("isReversed")))
                            .build());
                    break;
                case LOOKUP_TYPE:
                    relationships.add(RelationshipDescriptor.builder()
                            .fieldName(field.getName())
                            .fieldId(field.getId())
                            .kind(RelationshipDescriptor.Kind.LOOKUP)
                            .linkFieldId(asString(options.get("recordLinkFieldId")))
                            .fieldIdInLinkedTable(asString(options.get("fieldIdInLinkedTable")))
                            .build());
                    break;
                case ROLLUP_TYPE:
                    relationships.add(RelationshipDescriptor.builder()
                            .fieldName(field.getName())
                            .fieldId(field.getId())
                            .kind(RelationshipDescriptor.Kind.ROLLUP)
                            .linkFieldId(asString(options.get("recordLinkFieldId")))
                            .fieldIdInLinkedTable(asString(options.get("fieldIdInLinkedTable")))
                            .formula(asString(options.get("formula")))
                            .build());
                    break;
                default:
                    break;
            }
        }
        return relationships;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
