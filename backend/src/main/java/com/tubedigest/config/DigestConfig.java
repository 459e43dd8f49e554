package com.tubedigest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tubedigest.feed.http.PoliteHttpClient;
import com.tubedigest.feed.llm.OpenAiCompatibleSummarizer;
import com.tubedigest.feed.llm.Summarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DigestConfig {
    private static final Logger log = LoggerFactory.getLogger(DigestConfig.class);

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Summarizer summarizer(DigestProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        DigestProperties.Summarizer config = properties.getSummarizer();
        String provider = config.getProvider() == null ? "" : config.getProvider().trim().toLowerCase(Locale.ROOT);
        DigestProperties.Provider selected = switch (provider) {
            case "groq" -> config.getGroq();
            case "ollama" -> config.getOllama();
            default -> throw new DigestConfigurationException(
                "Unsupported summarizer provider '" + config.getProvider() + "' (expected groq or ollama)"
            );
        };
        if (selected == null || selected.getBaseUrl() == null || selected.getBaseUrl().isBlank()) {
            throw new DigestConfigurationException("digest.summarizer." + provider + ".base-url is required");
        }
        if (selected.getModel() == null || selected.getModel().isBlank()) {
            throw new DigestConfigurationException("digest.summarizer." + provider + ".model is required");
        }
        if ("groq".equals(provider) && (selected.getApiKey() == null || selected.getApiKey().isBlank())) {
            throw new DigestConfigurationException("digest.summarizer.groq.api-key is required (set GROQ_API_KEY)");
        }
        log.info("Summarizer provider={} model={} baseUrl={}", provider, selected.getModel(), selected.getBaseUrl());
        return new OpenAiCompatibleSummarizer(
            provider,
            httpClient,
            objectMapper,
            selected.getBaseUrl(),
            selected.getApiKey(),
            selected.getModel(),
            config.getMaxTokens(),
            config.getTemperature()
        );
    }
}
