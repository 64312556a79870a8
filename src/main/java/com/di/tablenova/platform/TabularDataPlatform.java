package com.di.tablenova.platform;

import com.di.tablenova.analysis.model.TableDescriptor;

import java.util.List;

/**
 * The external tabular-data platform: containers (bases) of tables, their schemas and records.
 * Every method throws {@link PlatformException} when the platform cannot be reached or answers
 * with an error.
 */
public interface TabularDataPlatform {

    List<ContainerInfo> listContainers();

    /** Tables of a container with fields, views and relationships; record counts are not known. */
    List<TableDescriptor> getSchema(String containerId);

    /**
     * @param filterFormula platform formula, e.g. {@code {table_id} = 'tbl1'}; null lists everything
     */
    List<PlatformRecord> listRecords(String containerId, String tableId, String filterFormula);

    /** Creates records; ids of the given records are ignored. */
    void createRecords(String containerId, String tableId, List<PlatformRecord> records);

    /** Updates records by id; only the given fields change. */
    void updateRecords(String containerId, String tableId, List<PlatformRecord> records);
}
