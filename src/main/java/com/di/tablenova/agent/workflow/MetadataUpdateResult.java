package com.di.tablenova.agent.workflow;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** Outcome of writing table summaries back to the metadata table. */
@Data
public class MetadataUpdateResult {

    private int updatedRecords;
    private int createdRecords;
    private int failedUpdates;
    private boolean skipped;
    private List<String> errors = new ArrayList<>();

    public static MetadataUpdateResult skippedResult() {
        MetadataUpdateResult result = new MetadataUpdateResult();
        result.setSkipped(true);
        return result;
    }

    void addError(String error) {
        errors.add(error);
    }
}
