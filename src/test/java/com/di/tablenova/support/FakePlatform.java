package com.di.tablenova.support;

import com.di.tablenova.analysis.model.TableDescriptor;
import com.di.tablenova.platform.ContainerInfo;
import com.di.tablenova.platform.PlatformException;
import com.di.tablenova.platform.PlatformRecord;
import com.di.tablenova.platform.TabularDataPlatform;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory platform. Metadata records are matched on their {@code table_id} field using the
 * {@code {table_id} = 'x'} filter form. Every write call is recorded with its chunk size.
 */
public class FakePlatform implements TabularDataPlatform {

    private static final Pattern TABLE_ID_FILTER = Pattern.compile("\\{table_id} = '(.*)'");

    private final Map<String, List<TableDescriptor>> schemas = new LinkedHashMap<>();
    private final Map<String, List<PlatformRecord>> records = new LinkedHashMap<>();
    private final Set<String> brokenContainers = new HashSet<>();
    private final List<Integer> createChunks = new ArrayList<>();
    private final List<Integer> updateChunks = new ArrayList<>();
    private boolean listContainersFails;
    private boolean writesFail;
    private boolean queriesFail;
    private int nextRecordId = 1;

    public FakePlatform withContainer(String containerId, TableDescriptor... tables) {
        List<TableDescriptor> rebased = new ArrayList<>();
        for (TableDescriptor table : tables) {
            rebased.add(table.toBuilder().containerId(containerId).build());
        }
        schemas.put(containerId, rebased);
        return this;
    }

    public FakePlatform withBrokenContainer(String containerId) {
        schemas.put(containerId, List.of());
        brokenContainers.add(containerId);
        return this;
    }

    public FakePlatform withExistingMetadata(String containerId, String tableId, String recordId, String forTableId) {
        records.computeIfAbsent(key(containerId, tableId), k -> new ArrayList<>())
                .add(PlatformRecord.builder().id(recordId).field("table_id", forTableId).build());
        return this;
    }

    public FakePlatform failingListContainers() {
        listContainersFails = true;
        return this;
    }

    public FakePlatform failingWrites() {
        writesFail = true;
        return this;
    }

    public FakePlatform failingQueries() {
        queriesFail = true;
        return this;
    }

    @Override
    public List<ContainerInfo> listContainers() {
        if (listContainersFails) {
            throw new PlatformException("airtable_list_bases", "connection refused", null);
        }
        List<ContainerInfo> containers = new ArrayList<>();
        schemas.keySet().forEach(id -> containers.add(new ContainerInfo(id, "Container " + id)));
        return containers;
    }

    @Override
    public List<TableDescriptor> getSchema(String containerId) {
        if (brokenContainers.contains(containerId)) {
            throw new PlatformException("airtable_get_schema", "500 Internal Server Error", null);
        }
        return schemas.getOrDefault(containerId, List.of());
    }

    @Override
    public List<PlatformRecord> listRecords(String containerId, String tableId, String filterFormula) {
        if (queriesFail) {
            throw new PlatformException("airtable_list_records", "timeout", null);
        }
        List<PlatformRecord> all = records.getOrDefault(key(containerId, tableId), List.of());
        if (filterFormula == null) {
            return new ArrayList<>(all);
        }
        Matcher matcher = TABLE_ID_FILTER.matcher(filterFormula);
        if (!matcher.matches()) {
            return List.of();
        }
        String wanted = matcher.group(1);
        List<PlatformRecord> matching = new ArrayList<>();
        for (PlatformRecord record : all) {
            if (wanted.equals(record.getFields().get("table_id"))) {
                matching.add(record);
            }
        }
        return matching;
    }

    @Override
    public void createRecords(String containerId, String tableId, List<PlatformRecord> newRecords) {
        createChunks.add(newRecords.size());
        if (writesFail) {
            throw new PlatformException("airtable_create_records", "422 Unprocessable Entity", null);
        }
        List<PlatformRecord> stored = records.computeIfAbsent(key(containerId, tableId), k -> new ArrayList<>());
        for (PlatformRecord record : newRecords) {
            stored.add(PlatformRecord.builder().id("rec" + nextRecordId++).fields(record.getFields()).build());
        }
    }

    @Override
    public void updateRecords(String containerId, String tableId, List<PlatformRecord> changed) {
        updateChunks.add(changed.size());
        if (writesFail) {
            throw new PlatformException("airtable_update_records", "422 Unprocessable Entity", null);
        }
        List<PlatformRecord> stored = records.computeIfAbsent(key(containerId, tableId), k -> new ArrayList<>());
        for (PlatformRecord update : changed) {
            for (int i = 0; i < stored.size(); i++) {
                PlatformRecord current = stored.get(i);
                if (current.getId().equals(update.getId())) {
                    Map<String, Object> merged = new LinkedHashMap<>(current.getFields());
                    merged.putAll(update.getFields());
                    stored.set(i, PlatformRecord.builder().id(current.getId()).fields(merged).build());
                }
            }
        }
    }

    public List<PlatformRecord> records(String containerId, String tableId) {
        return records.getOrDefault(key(containerId, tableId), List.of());
    }

    public List<Integer> getCreateChunks() {
        return createChunks;
    }

    public List<Integer> getUpdateChunks() {
        return updateChunks;
    }

    private static String key(String containerId, String tableId) {
        return containerId + "/" + tableId;
    }
}
