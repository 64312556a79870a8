package com.di.tablenova.ai.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring AI wiring for Vertex AI / Gemini.
 *
 * <p>{@code spring-ai-starter-model-vertex-ai-gemini} auto-configures the {@link ChatModel};
 * this class wraps it into the stateless {@link ChatClient} used for table analysis. Every
 * analysis call carries its own system and user messages, so no default system prompt or
 * conversation memory is attached.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ChatClientConfig {

    private final AiProperties aiProperties;

    @Bean
    public ChatClient analysisChatClient(ChatModel chatModel) {
        log.info("[AI-CONFIG] Initialising analysis ChatClient: model={}, temperature={}, maxOutputTokens={}, timeout={}",
                aiProperties.getChat().getModel(),
                aiProperties.getChat().getTemperature(),
                aiProperties.getChat().getMaxOutputTokens(),
                aiProperties.getCallTimeout());
        return ChatClient.builder(chatModel).build();
    }
}
