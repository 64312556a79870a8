package com.di.tablenova.platform;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Binding for {@code tablenova.platform.*}.
 *
 * <pre>
 * tablenova:
 *   platform:
 *     base-url:              http://localhost:8001
 *     connect-timeout:       10s
 *     read-timeout:          30s
 *     metadata-container-id: appXXXXXXXX
 *     metadata-table-id:     table_metadata
 *     write-chunk-size:      10
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "tablenova.platform")
public class PlatformProperties {

    /** Base URL of the tool-execution gateway. */
    private String   baseUrl        = "http://localhost:8001";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout    = Duration.ofSeconds(30);

    /** Container and table holding one metadata record per analysed table. */
    private String metadataContainerId;
    private String metadataTableId = "table_metadata";

    /** Upper bound of records per create/update call. */
    private int writeChunkSize = 10;
}
