package com.di.tablenova.quality;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class QualityCheck {

    public static final String CONFIDENCE = "confidence_score";
    public static final String CONTENT = "content_quality";
    public static final String ACTIONABILITY = "actionability";
    public static final String SPECIFICITY = "specificity";
    public static final String CONSISTENCY = "consistency";
    public static final String CATEGORY_ALIGNMENT = "category_alignment";

    String checkName;
    ValidationVerdict verdict;
    double score;
    String message;
    @Singular
    List<String> suggestions;
}
