package com.di.tablenova.platform;

import com.di.tablenova.analysis.model.FieldDescriptor;
import com.di.tablenova.analysis.model.TableDescriptor;
import com.di.tablenova.analysis.model.ViewDescriptor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TabularDataPlatform} backed by the platform's tool-execution gateway: every operation is
 * a {@code POST /api/v1/tools/execute} with body {@code {"tool": ..., "arguments": {...}}}.
 */
@Slf4j
@Component
public class McpToolPlatformClient implements TabularDataPlatform {

    static final String TOOLS_PATH = "/api/v1/tools/execute";

    static final String LIST_BASES = "airtable_list_bases";
    static final String GET_SCHEMA = "airtable_get_schema";
    static final String LIST_RECORDS = "airtable_list_records";
    static final String CREATE_RECORDS = "airtable_create_records";
    static final String UPDATE_RECORDS = "airtable_update_records";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public McpToolPlatformClient(@Qualifier(PlatformClientConfig.PLATFORM_REST_CLIENT) RestClient restClient,
                                 ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ContainerInfo> listContainers() {
        JsonNode response = callTool(LIST_BASES, new LinkedHashMap<>());
        List<ContainerInfo> containers = new ArrayList<>();
        for (JsonNode base : response.path("bases")) {
            containers.add(new ContainerInfo(base.path("id").asText(), base.path("name").asText(null)));
        }
        log.info("[PLATFORM] {} containers listed", containers.size());
        return containers;
    }

    @Override
    public List<TableDescriptor> getSchema(String containerId) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("base_id", containerId);
        JsonNode response = callTool(GET_SCHEMA, arguments);

        List<TableDescriptor> tables = new ArrayList<>();
        for (JsonNode table : response.path("tables")) {
            List<FieldDescriptor> fields = new ArrayList<>();
            for (JsonNode field : table.path("fields")) {
                fields.add(toField(field));
            }
            List<ViewDescriptor> views = new ArrayList<>();
            for (JsonNode view : table.path("views")) {
                views.add(ViewDescriptor.builder()
                        .id(view.path("id").asText(null))
                        .name(view.path("name").asText(null))
                        .type(view.path("type").asText(null))
                        .build());
            }
            tables.add(TableDescriptor.builder()
                    .containerId(containerId)
                    .tableId(table.path("id").asText())
                    .tableName(table.path("name").asText())
                    .fields(fields)
                    .relationships(RelationshipExtractor.extract(fields))
                    .views(views)
                    .build());
        }
        log.info("[PLATFORM] Container {} has {} tables", containerId, tables.size());
        return tables;
    }

    @Override
    public List<PlatformRecord> listRecords(String containerId, String tableId, String filterFormula) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("base_id", containerId);
        arguments.put("table_id", tableId);
        if (filterFormula != null) {
            arguments.put("filter_by_formula", filterFormula);
        }
        JsonNode response = callTool(LIST_RECORDS, arguments);
        List<PlatformRecord> records = new ArrayList<>();
        for (JsonNode record : response.path("records")) {
            records.add(PlatformRecord.builder()
                    .id(record.path("id").asText(null))
                    .fields(record.has("fields") ? objectMapper.convertValue(record.get("fields"), MAP_TYPE) : Map.of())
                    .build());
        }
        return records;
    }

    @Override
    public void createRecords(String containerId, String tableId, List<PlatformRecord> records) {
        List<Map<String, Object>> payload = new ArrayList<>();
        for (PlatformRecord record : records) {
            payload.add(Map.of("fields", record.getFields()));
        }
        callTool(CREATE_RECORDS, writeArguments(containerId, tableId, payload));
        log.info("[PLATFORM] Created {} records in {}/{}", records.size(), containerId, tableId);
    }

    @Override
    public void updateRecords(String containerId, String tableId, List<PlatformRecord> records) {
        List<Map<String, Object>> payload = new ArrayList<>();
        for (PlatformRecord record : records) {
            if (record.isNew()) {
                throw new IllegalArgumentException("Record to update has no id");
            }
            payload.add(Map.of("id", record.getId(), "fields", record.getFields()));
        }
        callTool(UPDATE_RECORDS, writeArguments(containerId, tableId, payload));
        log.info("[PLATFORM] Updated {} records in {}/{}", records.size(), containerId, tableId);
    }

    private static Map<String, Object> writeArguments(String containerId, String tableId, List<Map<String, Object>> records) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("base_id", containerId);
        arguments.put("table_id", tableId);
        arguments.put("records", records);
        return arguments;
    }

    private FieldDescriptor toField(JsonNode field) {
        FieldDescriptor.FieldDescriptorBuilder builder = FieldDescriptor.builder()
                .id(field.path("id").asText(null))
                .name(field.path("name").asText(null))
                .type(field.path("type").asText(null))
                .description(field.path("description").asText(null));
        if (field.path("options").isObject()) {
            builder.options(objectMapper.convertValue(field.get("options"), MAP_TYPE));
        }
        return builder.build();
    }

    private JsonNode callTool(String tool, Map<String, Object> arguments) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tool", tool);
        body.put("arguments", arguments);
        try {
            JsonNode response = restClient.post()
                    .uri(TOOLS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            return response != null ? response : MissingNode.getInstance();
        } catch (RestClientException e) {
            log.error("[PLATFORM] Tool call failed: {} - {}", tool, e.getMessage());
            throw new PlatformException(tool, e.getMessage(), e);
        }
    }
}
