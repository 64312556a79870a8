package com.di.tablenova.quality;

import com.di.tablenova.analysis.model.Finding;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** A finding together with its weighted score, worst verdict and the checks behind it. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidatedFinding {
    Finding finding;
    double qualityScore;
    ValidationVerdict verdict;
    /** Message of the worst check when the verdict is a warning. */
    String qualityWarning;
    List<QualityCheck> checks;

    public boolean isAccepted() {
        return verdict != ValidationVerdict.INVALID;
    }
}
