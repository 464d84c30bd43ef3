package com.medscript.safety;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medscript.dto.SafetyAnalysisDTO.AnalysisResult;
import com.medscript.dto.SafetyAnalysisDTO.RiskLevel;
import com.medscript.dto.SafetyAnalysisDTO.Severity;
import com.medscript.dto.SafetyAnalysisDTO.Source;

/**
 * Unit tests for ResponseInterpreter
 *
 * Structured JSON completions are validated and coerced; free text goes through
 * keyword extraction. Neither path may throw.
 */
@DisplayName("ResponseInterpreter Tests")
class ResponseInterpreterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:30:00Z");

    private static final String FULL_RESPONSE = "{"
            + "\"interactions\": [{\"drugs\": [\"Warfarin\", \"Aspirin\"], \"severity\": \"major\","
            + " \"description\": \"Bleeding risk\", \"recommendation\": \"Avoid combination\"}],"
            + "\"allergies\": [{\"drug\": \"Amoxicillin\", \"allergy\": \"Penicillin\", \"risk\": \"Cross-reactivity\"}],"
            + "\"contraindications\": [{\"drug\": \"Ibuprofen\", \"condition\": \"CKD\", \"risk\": \"Renal decline\"}],"
            + "\"alternatives\": [{\"instead_of\": \"Ibuprofen\", \"suggested\": \"Paracetamol\", \"reason\": \"Renal safety\"}],"
            + "\"monitoring\": [{\"parameter\": \"INR\", \"frequency\": \"Weekly\", \"reason\": \"Anticoagulation\"}],"
            + "\"overall_risk\": \"high\","
            + "\"summary\": \"Significant bleeding risk.\""
            + "}";

    private ResponseInterpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new ResponseInterpreter(new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Structured Response Tests")
    class StructuredResponseTests {

        @Test
        @DisplayName("Should map every section of a complete response")
        void shouldMapCompleteResponse() {
            // Act
            AnalysisResult result = interpreter.interpret(FULL_RESPONSE);

            // Assert
            assertEquals(Source.AI, result.getSource());
            assertEquals(RiskLevel.HIGH, result.getOverallRisk());
            assertEquals("Significant bleeding risk.", result.getSummary());
            assertEquals(List.of("Warfarin", "Aspirin"), result.getInteractions().get(0).getDrugs());
            assertEquals(Severity.MAJOR, result.getInteractions().get(0).getSeverity());
            assertEquals("Penicillin", result.getAllergies().get(0).getAllergy());
            assertEquals("CKD", result.getContraindications().get(0).getCondition());
            assertEquals("Ibuprofen", result.getAlternatives().get(0).getInsteadOf());
            assertEquals("Paracetamol", result.getAlternatives().get(0).getSuggested());
            assertEquals("INR", result.getMonitoring().get(0).getParameter());
            assertEquals(NOW, result.getTimestamp());
        }

        @Test
        @DisplayName("Should strip a json code fence before parsing")
        void shouldStripCodeFence() {
            // Act
            AnalysisResult result = interpreter.interpret("```json\n" + FULL_RESPONSE + "\n```");

            // Assert
            assertEquals(RiskLevel.HIGH, result.getOverallRisk());
            assertEquals(1, result.getInteractions().size());
        }

        @Test
        @DisplayName("Should default missing and mistyped fields")
        void shouldDefaultMissingFields() {
            // Act
            AnalysisResult result = interpreter.interpret(
                    "{\"interactions\": \"none\", \"monitoring\": {\"parameter\": \"INR\"}, \"overall_risk\": \"extreme\"}");

            // Assert
            assertTrue(result.getInteractions().isEmpty());
            assertTrue(result.getAllergies().isEmpty());
            assertTrue(result.getContraindications().isEmpty());
            assertTrue(result.getAlternatives().isEmpty());
            assertTrue(result.getMonitoring().isEmpty());
            assertEquals(RiskLevel.MODERATE, result.getOverallRisk());
            assertEquals(ResponseInterpreter.DEFAULT_SUMMARY, result.getSummary());
            assertEquals(Source.AI, result.getSource());
        }

        @Test
        @DisplayName("Should strip an upper-case JSON code fence before parsing")
        void shouldStripUpperCaseCodeFence() {
            // Act
            AnalysisResult result = interpreter.interpret("```JSON\n" + FULL_RESPONSE + "\n```");

            // Assert
            assertEquals(RiskLevel.HIGH, result.getOverallRisk());
            assertEquals("Significant bleeding risk.", result.getSummary());
        }

        @Test
        @DisplayName("Should name at least two drugs for every interaction")
        void shouldPadInteractionDrugsToPair() {
            // Act
            AnalysisResult result = interpreter.interpret(
                    "{\"interactions\": [{\"drugs\": [], \"severity\": \"minor\"},"
                            + " {\"severity\": \"major\"}], \"overall_risk\": \"moderate\"}");

            // Assert
            assertEquals(2, result.getInteractions().size());
            assertEquals(List.of(ResponseInterpreter.UNSPECIFIED_DRUG, ResponseInterpreter.OTHER_DRUGS),
                    result.getInteractions().get(0).getDrugs());
            assertEquals(Severity.MINOR, result.getInteractions().get(0).getSeverity());
            assertEquals(2, result.getInteractions().get(1).getDrugs().size());
        }

        @Test
        @DisplayName("Should coerce unknown severity to moderate")
        void shouldCoerceUnknownSeverity() {
            // Act
            AnalysisResult result = interpreter.interpret(
                    "{\"interactions\": [{\"drugs\": \"Simvastatin\", \"severity\": \"contraindicated\"}],"
                            + " \"overall_risk\": \"LOW\", \"summary\": \"\"}");

            // Assert
            assertEquals(Severity.MODERATE, result.getInteractions().get(0).getSeverity());
            assertEquals(List.of("Simvastatin", ResponseInterpreter.OTHER_DRUGS),
                    result.getInteractions().get(0).getDrugs());
            assertEquals(RiskLevel.LOW, result.getOverallRisk());
            assertEquals(ResponseInterpreter.DEFAULT_SUMMARY, result.getSummary());
        }
    }

    @Nested
    @DisplayName("Free Text Response Tests")
    class FreeTextResponseTests {

        @Test
        @DisplayName("Should extract monitoring item from free text advice")
        void shouldExtractMonitoringFromFreeText() {
            // Act
            AnalysisResult result = interpreter.interpret(
                    "Patient should avoid NSAIDs, monitor kidney function closely");

            // Assert
            assertEquals(1, result.getMonitoring().size());
            assertEquals("General monitoring", result.getMonitoring().get(0).getParameter());
            assertTrue(result.getInteractions().isEmpty());
            assertEquals(RiskLevel.MODERATE, result.getOverallRisk());
            assertEquals(Source.AI, result.getSource());
        }

        @Test
        @DisplayName("Should synthesize interaction and high risk from keywords")
        void shouldDetectHighRiskInteraction() {
            // Act
            AnalysisResult result = interpreter.interpret(
                    "These drugs interact and the combination is dangerous.");

            // Assert
            assertEquals(1, result.getInteractions().size());
            assertEquals(Severity.MODERATE, result.getInteractions().get(0).getSeverity());
            assertEquals(List.of("Multiple medications", ResponseInterpreter.OTHER_DRUGS),
                    result.getInteractions().get(0).getDrugs());
            assertEquals(RiskLevel.HIGH, result.getOverallRisk());
        }

        @Test
        @DisplayName("Should report low risk when text says the regimen is safe")
        void shouldDetectLowRisk() {
            // Act
            AnalysisResult result = interpreter.interpret("The regimen appears safe.");

            // Assert
            assertEquals(RiskLevel.LOW, result.getOverallRisk());
        }

        @Test
        @DisplayName("Should embed a truncated preview of the raw text in the summary")
        void shouldTruncatePreview() {
            // Arrange
            String raw = "x".repeat(500);

            // Act
            AnalysisResult result = interpreter.interpret(raw);

            // Assert
            assertEquals("AI analysis completed. Review original response: " + "x".repeat(200) + "...",
                    result.getSummary());
        }

        @Test
        @DisplayName("Should not split a surrogate pair when truncating the preview")
        void shouldNotSplitSurrogatePair() {
            // Arrange
            String raw = "x".repeat(199) + "\uD83D\uDC8A" + "y".repeat(50);

            // Act
            AnalysisResult result = interpreter.interpret(raw);

            // Assert
            assertEquals("AI analysis completed. Review original response: " + "x".repeat(199) + "...",
                    result.getSummary());
            String summary = result.getSummary();
            for (int i = 0; i < summary.length(); i++) {
                if (Character.isHighSurrogate(summary.charAt(i))) {
                    assertTrue(i + 1 < summary.length() && Character.isLowSurrogate(summary.charAt(i + 1)));
                }
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "[1, 2, 3]", "42", "{broken json", "```", "null"})
        @DisplayName("Should never throw on malformed content")
        void shouldNeverThrow(String raw) {
            // Act
            AnalysisResult result = assertDoesNotThrow(() -> interpreter.interpret(raw));

            // Assert
            assertNotNull(result.getOverallRisk());
            assertEquals(Source.AI, result.getSource());
        }

        @Test
        @DisplayName("Should handle null content")
        void shouldHandleNullContent() {
            // Act
            AnalysisResult result = interpreter.interpret(null);

            // Assert
            assertEquals(RiskLevel.MODERATE, result.getOverallRisk());
        }
    }
}
