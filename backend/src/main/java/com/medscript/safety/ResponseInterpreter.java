package com.medscript.safety;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medscript.dto.SafetyAnalysisDTO.AllergyFinding;
import com.medscript.dto.SafetyAnalysisDTO.AlternativeSuggestion;
import com.medscript.dto.SafetyAnalysisDTO.AnalysisResult;
import com.medscript.dto.SafetyAnalysisDTO.ContraindicationFinding;
import com.medscript.dto.SafetyAnalysisDTO.InteractionFinding;
import com.medscript.dto.SafetyAnalysisDTO.MonitoringItem;
import com.medscript.dto.SafetyAnalysisDTO.RiskLevel;
import com.medscript.dto.SafetyAnalysisDTO.Severity;
import com.medscript.dto.SafetyAnalysisDTO.Source;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Turns the raw completion text into an {@link AnalysisResult}.
 *
 * Well-formed JSON is validated field by field. Anything else goes through keyword
 * extraction, so a result is always produced.
 */
@Component
@Slf4j
public class ResponseInterpreter {

    static final String DEFAULT_SUMMARY = "Analysis completed. Review individual sections for details.";
    static final int RAW_PREVIEW_LENGTH = 200;
    static final String UNSPECIFIED_DRUG = "Unspecified medication";
    static final String OTHER_DRUGS = "Other prescribed medications";

    private static final List<String> INTERACTION_KEYWORDS = List.of("interaction", "interact", "contraindicated");
    private static final List<String> MONITORING_KEYWORDS = List.of("monitor", "check", "follow", "watch");
    private static final List<String> HIGH_RISK_KEYWORDS = List.of("high risk", "dangerous", "severe", "major");
    private static final List<String> LOW_RISK_KEYWORDS = List.of("low risk", "safe", "minor");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ResponseInterpreter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public AnalysisResult interpret(String rawText) {
        String content = stripCodeFence(rawText == null ? "" : rawText);

        JsonNode root = null;
        try {
            root = content.isEmpty() ? null : objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.debug("Completion content is not JSON: {}", e.getOriginalMessage());
        }

        if (root != null && root.isObject()) {
            return fromJson(root);
        }
        log.warn("AI response was not structured JSON; using keyword extraction");
        return fromText(content);
    }

    static String stripCodeFence(String text) {
        String content = text.trim();
        if (content.regionMatches(true, 0, "```json", 0, 7)) {
            content = content.substring(7);
        } else if (content.startsWith("```")) {
            content = content.substring(3);
        }
        if (content.endsWith("```")) {
            content = content.substring(0, content.length() - 3);
        }
        return content.trim();
    }

    private AnalysisResult fromJson(JsonNode root) {
        String summary = text(root.get("summary"));

        return AnalysisResult.builder()
            .interactions(list(root.get("interactions"), this::toInteraction))
            .allergies(list(root.get("allergies"), node -> AllergyFinding.builder()
                .drug(text(node.get("drug")))
                .allergy(text(node.get("allergy")))
                .risk(text(node.get("risk")))
                .build()))
            .contraindications(list(root.get("contraindications"), node -> ContraindicationFinding.builder()
                .drug(text(node.get("drug")))
                .condition(text(node.get("condition")))
                .risk(text(node.get("risk")))
                .build()))
            .alternatives(list(root.get("alternatives"), node -> AlternativeSuggestion.builder()
                .insteadOf(text(node.get("instead_of")))
                .suggested(text(node.get("suggested")))
                .reason(text(node.get("reason")))
                .build()))
            .monitoring(list(root.get("monitoring"), node -> MonitoringItem.builder()
                .parameter(text(node.get("parameter")))
                .frequency(text(node.get("frequency")))
                .reason(text(node.get("reason")))
                .build()))
            .overallRisk(RiskLevel.parse(text(root.get("overall_risk"))).orElse(RiskLevel.MODERATE))
            .summary(summary.isBlank() ? DEFAULT_SUMMARY : summary)
            .source(Source.AI)
            .timestamp(Instant.now(clock))
            .build();
    }

    private InteractionFinding toInteraction(JsonNode node) {
        List<String> drugs = new ArrayList<>();
        JsonNode drugsNode = node.get("drugs");
        if (drugsNode != null && drugsNode.isArray()) {
            drugsNode.forEach(drug -> {
                if (drug.isValueNode() && !drug.asText().isBlank()) {
                    drugs.add(drug.asText().trim());
                }
            });
        } else if (drugsNode != null && drugsNode.isTextual() && !drugsNode.asText().isBlank()) {
            drugs.add(drugsNode.asText().trim());
        }

        return InteractionFinding.builder()
            .drugs(asPair(drugs))
            .severity(Severity.parse(text(node.get("severity"))).orElse(Severity.MODERATE))
            .description(text(node.get("description")))
            .recommendation(text(node.get("recommendation")))
            .build();
    }

    private AnalysisResult fromText(String text) {
        String lower = text.toLowerCase(Locale.ROOT);

        List<InteractionFinding> interactions = new ArrayList<>();
        if (containsAny(lower, INTERACTION_KEYWORDS)) {
            interactions.add(InteractionFinding.builder()
                .drugs(asPair(List.of("Multiple medications")))
                .severity(Severity.MODERATE)
                .description("Potential interactions detected in AI analysis")
                .recommendation("Review full AI response for details")
                .build());
        }

        List<MonitoringItem> monitoring = new ArrayList<>();
        if (containsAny(lower, MONITORING_KEYWORDS)) {
            monitoring.add(MonitoringItem.builder()
                .parameter("General monitoring")
                .frequency("As clinically indicated")
                .reason("Based on AI analysis recommendations")
                .build());
        }

        RiskLevel risk = RiskLevel.MODERATE;
        if (containsAny(lower, HIGH_RISK_KEYWORDS)) {
            risk = RiskLevel.HIGH;
        } else if (containsAny(lower, LOW_RISK_KEYWORDS)) {
            risk = RiskLevel.LOW;
        }

        String rawPreview = preview(text);
        return AnalysisResult.builder()
            .interactions(List.copyOf(interactions))
            .monitoring(List.copyOf(monitoring))
            .overallRisk(risk)
            .summary("AI analysis completed. Review original response: " + rawPreview + "...")
            .source(Source.AI)
            .timestamp(Instant.now(clock))
            .build();
    }

    /**
     * An interaction always names at least two drugs; missing names are filled with placeholders.
     */
    static List<String> asPair(List<String> drugs) {
        List<String> pair = new ArrayList<>(drugs);
        if (pair.isEmpty()) {
            pair.add(UNSPECIFIED_DRUG);
        }
        if (pair.size() < 2) {
            pair.add(OTHER_DRUGS);
        }
        return List.copyOf(pair);
    }

    static String preview(String text) {
        if (text.length() <= RAW_PREVIEW_LENGTH) {
            return text;
        }
        int end = RAW_PREVIEW_LENGTH;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private static <T> List<T> list(JsonNode node, Function<JsonNode, T> mapper) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<T> items = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isObject()) {
                items.add(mapper.apply(element));
            }
        }
        return List.copyOf(items);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return "";
        }
        return node.asText().trim();
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
