package com.di.tablenova.agent.job;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobKind {
    BATCH_ANALYSIS,
    WORKFLOW;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
