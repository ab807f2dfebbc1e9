package com.deepansh.explorer.llm;

import com.deepansh.explorer.exception.ExplorationException;
import com.deepansh.explorer.model.LlmResponse;
import com.deepansh.explorer.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GenericLlmClientTest {

    private MockRestServiceServer server;
    private GenericLlmClient client;
    private LlmProviderProperties props;

    @BeforeEach
    void setUp() {
        props = new LlmProviderProperties();
        props.setApiKey("test-key");
        props.setBaseUrl("https://llm.example.com/v1");
        props.setModel("test-model");
        props.setMaxTokens(256);
        props.setTemperature(0.2);

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GenericLlmClient(props, "groq", builder);
    }

    @Test
    void chat_parsesFirstChoiceAndUsage() {
        server.expect(requestTo("https://llm.example.com/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":"Read main.py next"}}],
                         "usage":{"prompt_tokens":12,"completion_tokens":5}}
                        """, MediaType.APPLICATION_JSON));

        LlmResponse response = client.chat(List.of(Message.system("sys"), Message.user("what next?")));

        assertThat(response.getContent()).isEqualTo("Read main.py next");
        assertThat(response.getPromptTokens()).isEqualTo(12);
        assertThat(response.isFallback()).isFalse();
        server.verify();
    }

    @Test
    void chat_unauthorized_isNotRetryable() {
        server.expect(requestTo("https://llm.example.com/v1/chat/completions"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{}"));

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi"))))
                .isInstanceOf(ExplorationException.class)
                .hasMessageContaining("GROQ_API_KEY");
    }

    @Test
    void chat_serverError_isRetryable() {
        server.expect(requestTo("https://llm.example.com/v1/chat/completions"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY).body("upstream down"));

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi"))))
                .isInstanceOf(RuntimeException.class)
                .isNotInstanceOf(ExplorationException.class)
                .hasMessageContaining("server error");
    }

    @Test
    void isAvailable_requiresApiKey() {
        assertThat(client.isAvailable()).isTrue();

        props.setApiKey(" ");
        assertThat(new GenericLlmClient(props, "groq", RestClient.builder()).isAvailable()).isFalse();
    }
}
