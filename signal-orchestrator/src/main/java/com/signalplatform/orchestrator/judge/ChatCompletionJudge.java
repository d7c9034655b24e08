package com.signalplatform.orchestrator.judge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.JudgeException;
import com.signalplatform.common.model.FailureKind;
import com.signalplatform.orchestrator.config.JudgeProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * {@link Judge} backed by an OpenAI-compatible {@code /chat/completions} endpoint
 * (Groq, Together and most hosted model gateways speak this dialect).
 *
 * <p>No retries and no fallback here: a failed call surfaces as an error and the pool
 * records the judge as failed for this invocation.
 */
public class ChatCompletionJudge implements Judge {

    static final String SYSTEM_PROMPT =
        "You are a professional trading analyst. Respond only with valid JSON in the requested format.";

    private final JudgeProperties.Definition definition;
    private final WebClient client;
    private final ObjectMapper objectMapper;

    public ChatCompletionJudge(JudgeProperties.Definition definition, WebClient.Builder builder,
                               ObjectMapper objectMapper) {
        this.definition   = definition;
        this.objectMapper = objectMapper;
        this.client = builder.clone()
            .baseUrl(definition.baseUrl())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Override
    public String id() {
        return definition.id();
    }

    @Override
    public Mono<String> evaluate(String prompt) {
        if (definition.apiKey() == null || definition.apiKey().isBlank()) {
            return Mono.error(new JudgeException(id(), FailureKind.TRANSPORT, "No API key configured"));
        }

        Map<String, Object> requestBody = Map.of(
            "model", definition.model(),
            "temperature", definition.temperatureOrDefault(),
            "max_tokens", definition.maxTokensOrDefault(),
            "messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + definition.apiKey())
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .map(this::extractContent);
    }

    private String extractContent(String response) {
        JsonNode content;
        try {
            content = objectMapper.readTree(response).path("choices").path(0).path("message").path("content");
        } catch (Exception e) {
            throw new JudgeException(id(), FailureKind.MALFORMED_RESPONSE, "Response envelope is not JSON", e);
        }
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new JudgeException(id(), FailureKind.MALFORMED_RESPONSE, "Response has no message content");
        }
        return content.asText();
    }
}
