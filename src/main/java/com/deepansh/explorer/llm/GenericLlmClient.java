package com.deepansh.explorer.llm;

import com.deepansh.explorer.exception.ExplorationException;
import com.deepansh.explorer.model.LlmResponse;
import com.deepansh.explorer.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat client. Works with OpenAI and Groq.
 *
 * Error handling strategy:
 *
 * | Error               | Action                                              |
 * |---------------------|-----------------------------------------------------|
 * | 401 / other 4xx     | ExplorationException (not retried, not a CB failure) |
 * | 429 rate limit      | RuntimeException (retried)                          |
 * | 5xx server error    | RuntimeException (retried, counts as failure)       |
 * | network error       | ResourceAccessException (retried)                   |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props, String providerName, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public boolean isAvailable() {
        return props.getApiKey() != null && !props.getApiKey().isBlank();
    }

    @Override
    public LlmResponse chat(List<Message> messages) {
        log.debug("Sending {} messages to {} [model={}]", messages.size(), providerName, props.getModel());

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(buildRequestBody(messages))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                    throw new RuntimeException(
                            providerName + " server error [" + res.getStatusCode() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        return parseResponse(response);
    }

    private void handle4xxError(String body, int statusCode) {
        if (statusCode == 401) {
            throw new ExplorationException(
                    providerName + " API key is invalid. Check your "
                            + providerName.toUpperCase() + "_API_KEY environment variable.");
        }
        if (statusCode == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded. Will retry.");
        }
        throw new ExplorationException(providerName + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(List<Message> messages) {
        List<Map<String, Object>> formatted = messages.stream()
                .map(msg -> {
                    Map<String, Object> m = new HashMap<>();
                    m.put("role", msg.getRole().name());
                    m.put("content", msg.getContent() != null ? msg.getContent() : "");
                    return m;
                })
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formatted);
        return body;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = response == null ? null : (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new ExplorationException(providerName + " returned no choices in response");
        }

        int promptTokens = 0;
        int completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        return LlmResponse.builder()
                .content(message != null ? (String) message.get("content") : null)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
