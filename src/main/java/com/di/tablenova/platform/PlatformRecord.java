package com.di.tablenova.platform;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/** One platform record. {@code id} is null for records that do not exist yet. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlatformRecord {
    String id;
    @Singular("field")
    Map<String, Object> fields;

    public boolean isNew() {
        return id == null;
    }
}
