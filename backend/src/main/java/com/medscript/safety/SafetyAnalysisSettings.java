package com.medscript.safety;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable settings of the prescription safety engine, resolved once by {@link SafetyAnalysisConfig}.
 */
@Value
@Builder(toBuilder = true)
public class SafetyAnalysisSettings {

    public static final String DEFAULT_SYSTEM_PROMPT =
        "You are a clinical pharmacist AI assistant specializing in drug interaction analysis. "
            + "Always respond with valid JSON format.";

    @Builder.Default
    boolean enabled = true;

    String baseUrl;
    String model;

    @Builder.Default
    int maxTokens = 2000;

    @Builder.Default
    double temperature = 0.1;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    @Builder.Default
    Duration rateLimitDelay = Duration.ofSeconds(1);

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration retryDelay = Duration.ofSeconds(2);

    @Builder.Default
    boolean fallbackEnabled = true;

    @Builder.Default
    String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    String referer;
    String title;

    @ToString.Exclude
    String apiKey;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Attempt budget, never below one.
     */
    public int attemptBudget() {
        return Math.max(1, maxRetries);
    }
}
