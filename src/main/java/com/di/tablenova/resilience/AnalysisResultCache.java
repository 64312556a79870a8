package com.di.tablenova.resilience;

import com.di.tablenova.analysis.model.AnalysisCategory;
import com.di.tablenova.analysis.model.Finding;
import com.di.tablenova.config.AnalysisProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Last successful findings per (table, category), backing the {@code cached} fallback.
 * Bounded size and TTL via Caffeine.
 */
@Slf4j
@Component
public class AnalysisResultCache {

    private final Cache<String, List<Finding>> cache;

    @Autowired
    public AnalysisResultCache(AnalysisProperties properties) {
        this(properties.getResultCache().getMaximumSize(), properties.getResultCache().getExpireAfterWrite());
    }

    public AnalysisResultCache(long maximumSize, Duration expireAfterWrite) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireAfterWrite)
                .build();
        log.info("[CACHE] Analysis result cache enabled: maxSize={}, ttl={}", maximumSize, expireAfterWrite);
    }

    public static String key(String tableId, AnalysisCategory category) {
        return tableId + "_" + (category != null ? category.getValue() : "none");
    }

    public void put(String tableId, AnalysisCategory category, List<Finding> findings) {
        if (tableId == null || findings == null || findings.isEmpty()) {
            return;
        }
        cache.put(key(tableId, category), List.copyOf(findings));
    }

    public Optional<List<Finding>> get(String tableId, AnalysisCategory category) {
        if (tableId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(key(tableId, category)));
    }

    public long size() {
        return cache.estimatedSize();
    }
}
