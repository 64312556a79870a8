package com.di.tablenova.platform;

import com.di.tablenova.analysis.model.RelationshipDescriptor;
import com.di.tablenova.analysis.model.TableDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("McpToolPlatformClient Tests")
class McpToolPlatformClientTest {

    private static final String TOOLS_URL = "http://platform.test/api/v1/tools/execute";

    private MockRestServiceServer server;
    private McpToolPlatformClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://platform.test");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new McpToolPlatformClient(builder.build(), new ObjectMapper());
    }

    // ============================================================
    // Reads
    // ============================================================

    @Test
    @DisplayName("Should list containers through the list-bases tool")
    void testListContainers() {
        server.expect(requestTo(TOOLS_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.tool").value("airtable_list_bases"))
                .andRespond(withSuccess("{\"bases\":[{\"id\":\"app1\",\"name\":\"CRM\"},{\"id\":\"app2\"}]}",
                        MediaType.APPLICATION_JSON));

        List<ContainerInfo> containers = client.listContainers();

        server.verify();
        assertEquals(2, containers.size());
        assertEquals("app1", containers.get(0).getId());
        assertEquals("CRM", containers.get(0).getName());
        assertNull(containers.get(1).getName());
    }

    @Test
    @DisplayName("Should map schema tables with fields, views and derived relationships")
    void testGetSchema() {
        server.expect(requestTo(TOOLS_URL))
                .andExpect(jsonPath("$.tool").value("airtable_get_schema"))
                .andExpect(jsonPath("$.arguments.base_id").value("app1"))
                .andRespond(withSuccess("{\"tables\":[{\"id\":\"tbl1\",\"name\":\"Customers\","
                        + "\"fields\":[{\"id\":\"fld1\",\"name\":\"Name\",\"type\":\"singleLineText\"},"
                        + "{\"id\":\"fld2\",\"name\":\"Orders\",\"type\":\"multipleRecordLinks\","
                        + "\"options\":{\"linkedTableId\":\"tbl2\"}}],"
                        + "\"views\":[{\"id\":\"viw1\",\"name\":\"Grid view\",\"type\":\"grid\"}]}]}",
                        MediaType.APPLICATION_JSON));

        List<TableDescriptor> tables = client.getSchema("app1");

        server.verify();
        assertEquals(1, tables.size());
        TableDescriptor customers = tables.get(0);
        assertEquals("app1", customers.getContainerId());
        assertEquals("tbl1", customers.getTableId());
        assertEquals("Customers", customers.getTableName());
        assertEquals(2, customers.getFields().size());
        assertEquals("tbl2", customers.getFields().get(1).getOptions().get("linkedTableId"));
        assertEquals("Grid view", customers.getViews().get(0).getName());
        assertEquals(1, customers.getRelationships().size());
        assertEquals(RelationshipDescriptor.Kind.LINK, customers.getRelationships().get(0).getKind());
        assertNull(customers.getRecordCount());
    }

    @Test
    @DisplayName("Should pass the filter formula when listing records")
    void testListRecords() {
        server.expect(requestTo(TOOLS_URL))
                .andExpect(jsonPath("$.tool").value("airtable_list_records"))
                .andExpect(jsonPath("$.arguments.table_id").value("table_metadata"))
                .andExpect(jsonPath("$.arguments.filter_by_formula").value("{table_id} = 'tbl1'"))
                .andRespond(withSuccess("{\"records\":[{\"id\":\"rec1\",\"fields\":{\"table_id\":\"tbl1\"}}]}",
                        MediaType.APPLICATION_JSON));

        List<PlatformRecord> records = client.listRecords("app1", "table_metadata", "{table_id} = 'tbl1'");

        server.verify();
        assertEquals(1, records.size());
        assertEquals("rec1", records.get(0).getId());
        assertEquals("tbl1", records.get(0).getFields().get("table_id"));
    }

    @Test
    @DisplayName("Should treat an empty response body as no records")
    void testListRecords_EmptyBody() {
        server.expect(requestTo(TOOLS_URL)).andRespond(withSuccess());

        assertTrue(client.listRecords("app1", "table_metadata", null).isEmpty());
    }

    // ============================================================
    // Writes
    // ============================================================

    @Test
    @DisplayName("Should send record ids and fields on update")
    void testUpdateRecords() {
        server.expect(requestTo(TOOLS_URL))
                .andExpect(jsonPath("$.tool").value("airtable_update_records"))
                .andExpect(jsonPath("$.arguments.records[0].id").value("rec1"))
                .andExpect(jsonPath("$.arguments.records[0].fields.analysis_status").value("completed"))
                .andRespond(withSuccess("{\"records\":[]}", MediaType.APPLICATION_JSON));

        client.updateRecords("app1", "table_metadata", List.of(
                PlatformRecord.builder().id("rec1").field("analysis_status", "completed").build()));

        server.verify();
    }

    @Test
    @DisplayName("Should send only fields on create")
    void testCreateRecords() {
        server.expect(requestTo(TOOLS_URL))
                .andExpect(jsonPath("$.tool").value("airtable_create_records"))
                .andExpect(jsonPath("$.arguments.records[0].fields.table_id").value("tbl1"))
                .andExpect(jsonPath("$.arguments.records[0].id").doesNotExist())
                .andRespond(withSuccess("{\"records\":[]}", MediaType.APPLICATION_JSON));

        client.createRecords("app1", "table_metadata", List.of(
                PlatformRecord.builder().field("table_id", "tbl1").build()));

        server.verify();
    }

    @Test
    @DisplayName("Should refuse to update a record without id")
    void testUpdateRecords_MissingId() {
        assertThrows(IllegalArgumentException.class, () -> client.updateRecords("app1", "table_metadata",
                List.of(PlatformRecord.builder().field("table_id", "tbl1").build())));
    }

    @Test
    @DisplayName("Should wrap transport failures with the tool name")
    void testCallTool_ServerError() {
        server.expect(requestTo(TOOLS_URL)).andRespond(withServerError());

        PlatformException e = assertThrows(PlatformException.class, () -> client.getSchema("app1"));
        assertEquals("airtable_get_schema", e.getTool());
    }
}
