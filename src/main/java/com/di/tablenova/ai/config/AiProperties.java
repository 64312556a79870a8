package com.di.tablenova.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Strongly-typed binding for all {@code tablenova.ai.*} properties.
 *
 * <p>Connection settings for Vertex AI itself stay under {@code spring.ai.vertex.ai.gemini.*}.
 *
 * <pre>
 * tablenova:
 *   ai:
 *     call-timeout: 60s
 *     chat:
 *       model:             gemini-2.0-flash-001
 *       temperature:       0.1
 *       max-output-tokens: 4000
 *     pricing:
 *       input-per-1k-tokens:  0.00025
 *       output-per-1k-tokens: 0.001
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "tablenova.ai")
public class AiProperties {

    /** Upper bound for a single completion call, enforced client-side. */
    private Duration callTimeout = Duration.ofSeconds(60);

    @NestedConfigurationProperty
    private ChatConfig chat = new ChatConfig();

    @NestedConfigurationProperty
    private PricingConfig pricing = new PricingConfig();

    // ------------------------------------------------------------------ //

    @Data
    public static class ChatConfig {
        private String model           = "gemini-2.0-flash-001";
        private double temperature     = 0.1;
        private int    maxOutputTokens = 4000;
    }

    @Data
    public static class PricingConfig {
        private double inputPer1kTokens  = 0.00025;
        private double outputPer1kTokens = 0.001;
    }
}
