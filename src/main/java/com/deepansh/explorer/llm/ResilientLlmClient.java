package com.deepansh.explorer.llm;

import com.deepansh.explorer.model.LlmResponse;
import com.deepansh.explorer.model.Message;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the provider client that adds retry + circuit breaker.
 *
 * @Primary so the agents' tools get this bean, not the raw client.
 * Fallback responses are flagged with {@code fallback=true}; the LLM tools
 * replace them with their heuristic answers.
 *
 * Retry and circuit breaker settings live in application.yml under resilience4j.*.llmClient.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("providerLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public LlmResponse chat(List<Message> messages) {
        return delegate.chat(messages);
    }

    /**
     * Retry fallback: all retry attempts exhausted.
     */
    public LlmResponse retryFallback(List<Message> messages, Exception ex) {
        log.error("LLM call failed after all retries: {}", ex.getMessage());
        return LlmResponse.builder()
                .fallback(true)
                .content("LLM temporarily unavailable: " + ex.getMessage())
                .build();
    }

    /**
     * Circuit breaker fallback: circuit is open, requests are short-circuited.
     */
    public LlmResponse circuitBreakerFallback(List<Message> messages, Exception ex) {
        log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        return LlmResponse.builder()
                .fallback(true)
                .content("LLM circuit open")
                .build();
    }
}
