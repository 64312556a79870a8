package com.di.tablenova.agent.job;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Job lifecycle: {@code pending -> running -> completed | failed}, with {@code cancelled}
 * reachable from pending or running. Terminal states never change.
 */
public enum JobState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobState next) {
        return allowedNext().contains(next);
    }

    private Set<JobState> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING, CANCELLED);
            case RUNNING:
                return EnumSet.of(COMPLETED, FAILED, CANCELLED);
            default:
                return EnumSet.noneOf(JobState.class);
        }
    }
}
