package com.di.tablenova.resilience;

import com.di.tablenova.analysis.FindingParser;
import com.di.tablenova.analysis.model.Finding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Salvages findings from a truncated provider response stored under
 * {@link ErrorContext#PARTIAL_RESPONSE}; delegates to {@link SimplifiedFallbackStrategy} when
 * nothing can be recovered.
 */
@Slf4j
@Component
@Order(3)
@RequiredArgsConstructor
public class PartialFallbackStrategy implements FallbackStrategy {

    public static final String NAME = "partial";

    private final FindingParser findingParser;
    private final SimplifiedFallbackStrategy simplified;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AnalysisOutcome apply(ErrorContext context, Throwable lastError) {
        Object partial = context.getAdditionalInfo().get(ErrorContext.PARTIAL_RESPONSE);
        if (partial instanceof String) {
            String text = (String) partial;
            Optional<List<Finding>> salvaged = findingParser.salvage(text, context.getTableId(), context.getTableName(), context.getCategory());
            if (salvaged.isPresent()) {
                log.info("[FAULT] Salvaged {} findings from partial response for table={} category={}",
                        salvaged.get().size(), context.getTableId(), context.getCategory());
                Map<String, Object> partialInfo = new LinkedHashMap<>();
                partialInfo.put("salvaged_findings", salvaged.get().size());
                partialInfo.put("response_length", text.length());
                partialInfo.put("reason", lastError != null ? String.valueOf(lastError.getMessage()) : "unknown");
                return AnalysisOutcome.builder()
                        .findings(salvaged.get())
                        .fallbackUsed(true)
                        .fallbackType(NAME)
                        .metadataEntry("partial_info", partialInfo)
                        .build();
            }
        }
        log.info("[FAULT] Nothing to salvage for table={} category={}, using simplified",
                context.getTableId(), context.getCategory());
        return simplified.apply(context, lastError);
    }
}
