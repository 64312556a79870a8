package com.di.tablenova.resilience;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serves the last successful findings for the same table and category; delegates to
 * {@link SimplifiedFallbackStrategy} on a cache miss.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class CachedFallbackStrategy implements FallbackStrategy {

    public static final String NAME = "cached";

    private final AnalysisResultCache resultCache;
    private final SimplifiedFallbackStrategy simplified;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AnalysisOutcome apply(ErrorContext context, Throwable lastError) {
        return resultCache.get(context.getTableId(), context.getCategory())
                .map(findings -> {
                    log.info("[FAULT] Serving {} cached findings for table={} category={}",
                            findings.size(), context.getTableId(), context.getCategory());
                    Map<String, Object> cacheInfo = new LinkedHashMap<>();
                    cacheInfo.put("cache_key", AnalysisResultCache.key(context.getTableId(), context.getCategory()));
                    cacheInfo.put("cached_findings", findings.size());
                    cacheInfo.put("reason", lastError != null ? String.valueOf(lastError.getMessage()) : "unknown");
                    return AnalysisOutcome.builder()
                            .findings(findings)
                            .fallbackUsed(true)
                            .fallbackType(NAME)
                            .metadataEntry("cache_info", cacheInfo)
                            .build();
                })
                .orElseGet(() -> {
                    log.info("[FAULT] No cached findings for table={} category={}, using simplified",
                            context.getTableId(), context.getCategory());
                    return simplified.apply(context, lastError);
                });
    }
}
