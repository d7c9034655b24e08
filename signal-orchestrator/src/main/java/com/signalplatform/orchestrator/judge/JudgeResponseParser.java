package com.signalplatform.orchestrator.judge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.JudgeException;
import com.signalplatform.common.model.FailureKind;
import com.signalplatform.common.model.JudgeOpinion;
import com.signalplatform.common.model.RiskLevel;
import com.signalplatform.common.model.TradeDecision;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Strict boundary between free-form model output and {@link JudgeOpinion}.
 *
 * <p>Markdown code fences and prose around the JSON object are tolerated. A missing or
 * unrecognised {@code decision}, or a missing or out-of-range {@code confidence}, is not:
 * the reply is rejected with {@link FailureKind#MALFORMED_RESPONSE} rather than guessed at.
 *
 * <p>Confidence is expected on a 0-100 scale; a fractional value in (0, 1] is read as a
 * probability and scaled by 100.
 */
@Component
public class JudgeResponseParser {

    private static final Set<String> ACCEPTED_DECISIONS = Set.of("BUY", "SELL", "NO_TRADE", "NO TRADE", "HOLD");

    private final ObjectMapper objectMapper;

    public JudgeResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JudgeOpinion parse(String judgeId, String responseText) {
        JsonNode json = readJson(judgeId, responseText);

        String rawDecision = json.path("decision").asText("").trim().toUpperCase(Locale.ROOT);
        if (!ACCEPTED_DECISIONS.contains(rawDecision)) {
            throw malformed(judgeId, "Unrecognised decision '" + json.path("decision").asText("") + "'");
        }
        TradeDecision decision = TradeDecision.fromText(rawDecision);

        double confidence = readConfidence(judgeId, json.path("confidence"));

        List<String> keyFactors = new ArrayList<>();
        json.path("keyFactors").forEach(node -> {
            if (node.isTextual() && !node.asText().isBlank()) keyFactors.add(node.asText());
        });

        return JudgeOpinion.success(judgeId, decision, confidence,
                                    json.path("reasoning").asText(""),
                                    keyFactors,
                                    RiskLevel.fromText(json.path("riskLevel").asText(null)),
                                    optionalNumber(json, "stopLossLevel", "stopLoss"),
                                    optionalNumber(json, "takeProfitLevel", "takeProfit"));
    }

    private JsonNode readJson(String judgeId, String responseText) {
        if (responseText == null || responseText.isBlank()) {
            throw malformed(judgeId, "Empty response");
        }
        String cleaned = responseText
            .replaceAll("```json", "")
            .replaceAll("```", "")
            .trim();
        int start = cleaned.indexOf('{');
        int end   = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw malformed(judgeId, "No JSON object in response");
        }
        try {
            JsonNode json = objectMapper.readTree(cleaned.substring(start, end + 1));
            if (!json.isObject()) throw malformed(judgeId, "Response JSON is not an object");
            return json;
        } catch (JudgeException e) {
            throw e;
        } catch (Exception e) {
            throw new JudgeException(judgeId, FailureKind.MALFORMED_RESPONSE, "Invalid JSON: " + e.getMessage(), e);
        }
    }

    private double readConfidence(String judgeId, JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
            if (node.isFloatingPointNumber() && value > 0.0 && value <= 1.0) value *= 100.0;
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().replace("%", "").trim());
            } catch (NumberFormatException e) {
                throw new JudgeException(judgeId, FailureKind.MALFORMED_RESPONSE,
                                         "Non-numeric confidence '" + node.asText() + "'", e);
            }
        } else {
            throw malformed(judgeId, "Missing confidence");
        }
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw malformed(judgeId, "Confidence out of range: " + value);
        }
        return value;
    }

    private static Double optionalNumber(JsonNode json, String... fieldNames) {
        for (String field : fieldNames) {
            JsonNode node = json.path(field);
            if (node.isNumber()) return node.asDouble();
        }
        return null;
    }

    private static JudgeException malformed(String judgeId, String message) {
        return new JudgeException(judgeId, FailureKind.MALFORMED_RESPONSE, message);
    }
}
