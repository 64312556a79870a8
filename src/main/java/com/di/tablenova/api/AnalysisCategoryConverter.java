package com.di.tablenova.api;

import com.di.tablenova.analysis.model.AnalysisCategory;
import org.springframework.core.convert.converter.Converter;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/** Lets query parameters use the wire values, e.g. {@code ?categories=field_types}. */
@Component
public class AnalysisCategoryConverter implements Converter<String, AnalysisCategory> {

    @Override
    public AnalysisCategory convert(@NonNull String source) {
        return AnalysisCategory.fromValue(source);
    }
}
