package com.medscript.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class SafetyAnalysisDTO {

    public enum Severity {
        MAJOR,
        MODERATE,
        MINOR;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<Severity> parse(String value) {
            return parseEnum(Severity.class, value);
        }
    }

    public enum RiskLevel {
        LOW,
        MODERATE,
        HIGH;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<RiskLevel> parse(String value) {
            return parseEnum(RiskLevel.class, value);
        }
    }

    /**
     * Provenance of an analysis result. Callers use it to decide how far to trust the findings.
     */
    public enum Source {
        AI,
        FALLBACK,
        SYSTEM,
        ERROR;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @Value
    @Builder
    public static class InteractionFinding {
        List<String> drugs;
        Severity severity;
        String description;
        String recommendation;
    }

    @Value
    @Builder
    public static class AllergyFinding {
        String drug;
        String allergy;
        String risk;
    }

    @Value
    @Builder
    public static class ContraindicationFinding {
        String drug;
        String condition;
        String risk;
    }

    @Value
    @Builder
    public static class AlternativeSuggestion {
        String insteadOf;
        String suggested;
        String reason;
    }

    @Value
    @Builder
    public static class MonitoringItem {
        String parameter;
        String frequency;
        String reason;
    }

    @Value
    @Builder(toBuilder = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AnalysisResult {
        @Builder.Default
        List<InteractionFinding> interactions = List.of();
        @Builder.Default
        List<AllergyFinding> allergies = List.of();
        @Builder.Default
        List<ContraindicationFinding> contraindications = List.of();
        @Builder.Default
        List<AlternativeSuggestion> alternatives = List.of();
        @Builder.Default
        List<MonitoringItem> monitoring = List.of();
        @Builder.Default
        RiskLevel overallRisk = RiskLevel.MODERATE;
        String summary;
        Source source;
        int attempts;
        String error;
        Instant timestamp;
    }

    @Value
    @Builder
    public static class ServiceStatus {
        boolean enabled;
        boolean apiConfigured;
        boolean fallbackEnabled;
        String model;
        int maxRetries;
    }

    private static <E extends Enum<E>> Optional<E> parseEnum(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
