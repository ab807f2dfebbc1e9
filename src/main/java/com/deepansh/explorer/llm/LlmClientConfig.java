package com.deepansh.explorer.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the provider client selected by LLM_PROVIDER.
 * The LLM is optional: without an API key the reasoning and summary tools
 * fall back to their heuristic answers.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url:https://api.openai.com/v1}") private String openAiBaseUrl;
    @Value("${openai.model:gpt-4o-mini}") private String openAiModel;
    @Value("${openai.max-tokens:1024}") private int openAiMaxTokens;
    @Value("${openai.temperature:0.2}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url:https://api.groq.com/openai/v1}") private String groqBaseUrl;
    @Value("${groq.model:llama-3.3-70b-versatile}") private String groqModel;
    @Value("${groq.max-tokens:1024}") private int groqMaxTokens;
    @Value("${groq.temperature:0.2}") private double groqTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("LLM provider: {} [model={}]", provider.toUpperCase(), activeModel());
    }

    /**
     * Raw provider client. Wrapped by {@link ResilientLlmClient} with retry + circuit breaker.
     */
    @Bean("providerLlmClient")
    public LlmClient providerLlmClient(RestClient.Builder builder) {
        if ("openai".equalsIgnoreCase(provider)) {
            logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
            return new GenericLlmClient(
                    props(openAiKey, openAiBaseUrl, openAiModel, openAiMaxTokens, openAiTemp), "openai", builder.clone());
        }
        logKey("GROQ", groqKey, "GROQ_API_KEY");
        return new GenericLlmClient(
                props(groqKey, groqBaseUrl, groqModel, groqMaxTokens, groqTemp), "groq", builder.clone());
    }

    private static LlmProviderProperties props(String key, String baseUrl, String model, int maxTokens, double temperature) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(key);
        p.setBaseUrl(baseUrl);
        p.setModel(model);
        p.setMaxTokens(maxTokens);
        p.setTemperature(temperature);
        return p;
    }

    private String activeModel() {
        return "openai".equalsIgnoreCase(provider) ? openAiModel : groqModel;
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.warn("{} API key not set ({}). LLM tools will use heuristic fallbacks.", name, envVar);
        } else {
            log.info("{} key: {}...", name, key.substring(0, Math.min(8, key.length())));
        }
    }
}
