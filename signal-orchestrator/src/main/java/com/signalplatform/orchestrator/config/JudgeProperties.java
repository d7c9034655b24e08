package com.signalplatform.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Judge pool configuration bound from {@code judges.*}.
 *
 * <pre>
 * judges:
 *   timeout: PT20S
 *   definitions:
 *     - id: groq
 *       base-url: https://api.groq.com/openai/v1
 *       model: llama-3.3-70b-versatile
 *       api-key: ${GROQ_API_KEY:}
 * </pre>
 * Definition order is the tie-break order used by the consensus resolver.
 */
@ConfigurationProperties(prefix = "judges")
public record JudgeProperties(Duration timeout, List<Definition> definitions) {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);

    public JudgeProperties {
        timeout     = timeout == null ? DEFAULT_TIMEOUT : timeout;
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
    }

    public record Definition(String id, String baseUrl, String model, String apiKey,
                             Double temperature, Integer maxTokens) {

        public double temperatureOrDefault() {
            return temperature == null ? 0.1 : temperature;
        }

        public int maxTokensOrDefault() {
            return maxTokens == null ? 1000 : maxTokens;
        }
    }
}
