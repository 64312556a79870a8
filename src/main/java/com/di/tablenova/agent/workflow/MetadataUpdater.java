package com.di.tablenova.agent.workflow;

import com.di.tablenova.platform.PlatformException;
import com.di.tablenova.platform.PlatformProperties;
import com.di.tablenova.platform.PlatformRecord;
import com.di.tablenova.platform.TabularDataPlatform;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The update phase: upserts one metadata record per analysed table, matched on its
 * {@code table_id} field. Writes go out in chunks of {@code tablenova.platform.write-chunk-size};
 * failures are collected in the result and never abort the workflow.
 */
@Slf4j
@Component
public class MetadataUpdater {

    static final String STATUS_COMPLETED = "completed";

    private final TabularDataPlatform platform;
    private final ObjectMapper objectMapper;
    private final int chunkSize;
    private final Clock clock;

    @Autowired
    public MetadataUpdater(TabularDataPlatform platform, ObjectMapper objectMapper, PlatformProperties properties) {
        this(platform, objectMapper, properties.getWriteChunkSize(), Clock.systemUTC());
    }

    public MetadataUpdater(TabularDataPlatform platform, ObjectMapper objectMapper, int chunkSize, Clock clock) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("write chunk size must be at least 1");
        }
        this.platform = platform;
        this.objectMapper = objectMapper;
        this.chunkSize = chunkSize;
        this.clock = clock;
    }

    public MetadataUpdateResult update(Map<String, TableSummary> summaries, WorkflowConfig config) {
        MetadataUpdateResult result = new MetadataUpdateResult();
        String metadataTable = config.getMetadataTableId();
        Map<String, List<PlatformRecord>> updatesByContainer = new LinkedHashMap<>();
        Map<String, List<PlatformRecord>> createsByContainer = new LinkedHashMap<>();

        for (TableSummary summary : summaries.values()) {
            String container = config.getMetadataContainerId() != null
                    ? config.getMetadataContainerId() : summary.getContainerId();
            if (container == null) {
                result.addError("No metadata container for " + summary.getTableId());
                result.setFailedUpdates(result.getFailedUpdates() + 1);
                continue;
            }
            String now = clock.instant().toString();
            String improvements;
            try {
                improvements = objectMapper.writeValueAsString(improvements(summary, now));
            } catch (JsonProcessingException e) {
                log.error("[WORKFLOW] Could not serialise improvements for {}: {}", summary.getTableId(), e.getMessage());
                result.addError("Serialisation failed for " + summary.getTableId() + ": " + e.getMessage());
                result.setFailedUpdates(result.getFailedUpdates() + 1);
                continue;
            }

            List<PlatformRecord> existing;
            try {
                existing = platform.listRecords(container, metadataTable, tableIdFilter(summary.getTableId()));
            } catch (PlatformException e) {
                log.warn("[WORKFLOW] Failed to query metadata for table {}: {}", summary.getTableId(), e.getMessage());
                result.addError("Query failed for " + summary.getTableId() + ": " + e.getMessage());
                result.setFailedUpdates(result.getFailedUpdates() + 1);
                continue;
            }

            PlatformRecord.PlatformRecordBuilder record = PlatformRecord.builder()
                    .field("improvements", improvements)
                    .field("last_analysis", now)
                    .field("analysis_status", STATUS_COMPLETED);
            if (existing.isEmpty()) {
                record.field("table_id", summary.getTableId());
                createsByContainer.computeIfAbsent(container, c -> new ArrayList<>()).add(record.build());
            } else {
                record.id(existing.get(0).getId());
                updatesByContainer.computeIfAbsent(container, c -> new ArrayList<>()).add(record.build());
            }
        }

        updatesByContainer.forEach((container, records) -> {
            for (List<PlatformRecord> chunk : chunks(records)) {
                try {
                    platform.updateRecords(container, metadataTable, chunk);
                    result.setUpdatedRecords(result.getUpdatedRecords() + chunk.size());
                } catch (PlatformException e) {
                    log.error("[WORKFLOW] Failed to update {} metadata records: {}", chunk.size(), e.getMessage());
                    result.setFailedUpdates(result.getFailedUpdates() + chunk.size());
                    result.addError("Update failed: " + e.getMessage());
                }
            }
        });
        createsByContainer.forEach((container, records) -> {
            for (List<PlatformRecord> chunk : chunks(records)) {
                try {
                    platform.createRecords(container, metadataTable, chunk);
                    result.setCreatedRecords(result.getCreatedRecords() + chunk.size());
                } catch (PlatformException e) {
                    log.error("[WORKFLOW] Failed to create {} metadata records: {}", chunk.size(), e.getMessage());
                    result.setFailedUpdates(result.getFailedUpdates() + chunk.size());
                    result.addError("Create failed: " + e.getMessage());
                }
            }
        });

        log.info("[WORKFLOW] Metadata written: updated={}, created={}, failed={}",
                result.getUpdatedRecords(), result.getCreatedRecords(), result.getFailedUpdates());
        return result;
    }

    static String tableIdFilter(String tableId) {
        return "{table_id} = '" + tableId.replace("'", "\\'") + "'";
    }

    private Map<String, Object> improvements(TableSummary summary, String timestamp) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("analysis_timestamp", timestamp);
        data.put("total_issues", summary.getTotalIssues());
        data.put("high_priority_count", summary.getHighPriority());
        data.put("medium_priority_count", summary.getMediumPriority());
        data.put("low_priority_count", summary.getLowPriority());
        data.put("categories_analyzed", summary.getCategoriesAnalyzed());
        data.put("top_recommendations", summary.getTopRecommendations());
        data.put("analysis_status", STATUS_COMPLETED);
        return data;
    }

    private List<List<PlatformRecord>> chunks(List<PlatformRecord> records) {
        List<List<PlatformRecord>> chunks = new ArrayList<>();
        for (int from = 0; from < records.size(); from += chunkSize) {
            chunks.add(records.subList(from, Math.min(from + chunkSize, records.size())));
        }
        return chunks;
    }
}
