package com.al.clinicalsummary.config;

import com.al.clinicalsummary.extraction.EntityExtractionAssistant;
import com.al.clinicalsummary.extraction.EntityExtractor;
import com.al.clinicalsummary.extraction.ExtractionRegistry;
import com.al.clinicalsummary.extraction.LlmEntityExtractor;
import com.al.clinicalsummary.extraction.PromptLoader;
import com.al.clinicalsummary.model.EntityKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Chat model and the eleven LLM-backed extractors. Model settings come only from
 * {@link ExtractionProperties}.
 */
@Configuration
@Slf4j
public class LlmConfig {

    // Lets the context start without a key; every extraction then fails with an auth error
    private static final String MISSING_API_KEY = "not-configured";

    @Bean
    public ChatModel chatModel(ExtractionProperties properties) {
        ExtractionProperties.Llm llm = properties.getLlm();
        String apiKey = llm.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No LLM API key configured (app.extraction.llm.api-key or OPENAI_API_KEY); extractions will fail");
            apiKey = MISSING_API_KEY;
        }

        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(llm.getModelName())
                .temperature(llm.getTemperature())
                .maxRetries(llm.getMaxRetries())
                .timeout(llm.getTimeout());
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        log.info("Chat model configured: {}", llm.getModelName());
        return builder.build();
    }

    @Bean
    public EntityExtractionAssistant entityExtractionAssistant(ChatModel chatModel) {
        return AiServices.builder(EntityExtractionAssistant.class)
                .chatModel(chatModel)
                .build();
    }

    @Bean
    public ExtractionRegistry extractionRegistry(EntityExtractionAssistant assistant,
            PromptLoader promptLoader,
            ObjectMapper objectMapper,
            Validator validator) {
        List<EntityExtractor<?>> extractors = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            extractors.add(llmExtractor(kind, kind.getPayloadType(), assistant, promptLoader, objectMapper, validator));
        }
        return new ExtractionRegistry(extractors);
    }

    private static <T> EntityExtractor<T> llmExtractor(EntityKind kind,
            Class<T> payloadType,
            EntityExtractionAssistant assistant,
            PromptLoader promptLoader,
            ObjectMapper objectMapper,
            Validator validator) {
        return new LlmEntityExtractor<>(kind, payloadType, assistant, promptLoader.load(kind), objectMapper, validator);
    }
}
