package com.medscript.safety;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Prescription safety analysis configuration
 *
 * Supports:
 * - OpenRouter-compatible chat-completions endpoints
 * - Retry, rate limit and fallback tuning
 * - API key from the OPENROUTER_API_KEY environment variable
 */
@Configuration
public class SafetyAnalysisConfig {

    private static final Logger log = LoggerFactory.getLogger(SafetyAnalysisConfig.class);

    @Value("${medscript.ai.enabled:true}")
    private boolean enabled;

    @Value("${medscript.ai.base-url:https://openrouter.ai/api/v1/chat/completions}")
    private String baseUrl;

    @Value("${medscript.ai.model:openai/gpt-4o-mini}")
    private String model;

    @Value("${medscript.ai.max-tokens:2000}")
    private int maxTokens;

    @Value("${medscript.ai.temperature:0.1}")
    private double temperature;

    @Value("${medscript.ai.timeout-ms:30000}")
    private long timeoutMs;

    @Value("${medscript.ai.rate-limit-delay-ms:1000}")
    private long rateLimitDelayMs;

    @Value("${medscript.ai.max-retries:3}")
    private int maxRetries;

    @Value("${medscript.ai.retry-delay-ms:2000}")
    private long retryDelayMs;

    @Value("${medscript.ai.fallback-enabled:true}")
    private boolean fallbackEnabled;

    @Value("${medscript.ai.system-prompt:" + SafetyAnalysisSettings.DEFAULT_SYSTEM_PROMPT + "}")
    private String systemPrompt;

    @Value("${medscript.ai.referer:}")
    private String referer;

    @Value("${medscript.ai.title:}")
    private String title;

    @Value("${medscript.ai.api-key:${OPENROUTER_API_KEY:}}")
    private String apiKey;

    @Bean
    public SafetyAnalysisSettings safetyAnalysisSettings() {
        SafetyAnalysisSettings settings = SafetyAnalysisSettings.builder()
            .enabled(enabled)
            .baseUrl(baseUrl)
            .model(model)
            .maxTokens(maxTokens)
            .temperature(temperature)
            .timeout(Duration.ofMillis(timeoutMs))
            .rateLimitDelay(Duration.ofMillis(rateLimitDelayMs))
            .maxRetries(maxRetries)
            .retryDelay(Duration.ofMillis(retryDelayMs))
            .fallbackEnabled(fallbackEnabled)
            .systemPrompt(systemPrompt)
            .referer(referer)
            .title(title)
            .apiKey(apiKey)
            .build();

        if (enabled && !settings.hasApiKey()) {
            log.warn("AI safety analysis is enabled but no API key is configured; rule-based analysis will be used");
        }
        log.info("Safety analysis settings: {}", settings);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
