package com.medscript.safety;

import com.medscript.dto.PrescriptionDTO.MedicationItem;
import com.medscript.dto.PrescriptionDTO.PatientContext;
import com.medscript.dto.SafetyAnalysisDTO.AnalysisResult;
import com.medscript.dto.SafetyAnalysisDTO.RiskLevel;
import com.medscript.dto.SafetyAnalysisDTO.ServiceStatus;
import com.medscript.dto.SafetyAnalysisDTO.Source;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Prescription safety analysis entry point
 *
 * Tries AI analysis up to the configured attempt budget, then falls back to the
 * rule-based analyzer. Operational failures never reach the caller as exceptions:
 * the result's source tells the caller which path produced it.
 */
@Service
@Slf4j
public class AnalysisOrchestrator {

    private final SafetyAnalysisSettings settings;
    private final PromptBuilder promptBuilder;
    private final InferenceClient inferenceClient;
    private final ResponseInterpreter responseInterpreter;
    private final RuleBasedAnalyzer ruleBasedAnalyzer;
    private final Clock clock;
    private final RateLimiter rateLimiter;

    public AnalysisOrchestrator(
            SafetyAnalysisSettings settings,
            PromptBuilder promptBuilder,
            InferenceClient inferenceClient,
            ResponseInterpreter responseInterpreter,
            RuleBasedAnalyzer ruleBasedAnalyzer,
            Clock clock) {
        this.settings = settings;
        this.promptBuilder = promptBuilder;
        this.inferenceClient = inferenceClient;
        this.responseInterpreter = responseInterpreter;
        this.ruleBasedAnalyzer = ruleBasedAnalyzer;
        this.clock = clock;
        this.rateLimiter = new RateLimiter(settings.getRateLimitDelay());
    }

    /**
     * Analyze a prescription for interactions, allergy conflicts, contraindications and monitoring needs
     */
    public AnalysisResult analyzeSafety(List<MedicationItem> medications, PatientContext patient) {
        List<MedicationItem> meds = medications != null ? medications : List.of();
        PatientContext context = patient != null ? patient : PatientContext.unknown();

        if (!settings.isEnabled()) {
            return systemResult("AI safety analysis is disabled.");
        }
        if (meds.isEmpty()) {
            return systemResult("No medications to analyze.");
        }

        int budget = settings.attemptBudget();
        InferenceException lastFailure = null;
        int attempt = 0;

        while (attempt < budget) {
            attempt++;
            log.info("Analyzing prescription safety with AI (attempt {} of {})", attempt, budget);
            try {
                AnalysisResult result = attemptAiAnalysis(meds, context);
                log.info("AI safety analysis completed on attempt {} of {}", attempt, budget);
                return result.toBuilder().attempts(attempt).build();
            } catch (InferenceException e) {
                lastFailure = e;
                log.warn("AI safety analysis attempt {} of {} failed: {}", attempt, budget, e.getMessage());
                if (!shouldRetry(e, attempt, budget)) {
                    break;
                }
                try {
                    pause(settings.getRetryDelay());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("AI safety analysis interrupted while waiting to retry");
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastFailure = new TransportException("AI safety analysis interrupted", e);
                log.warn("AI safety analysis interrupted on attempt {} of {}", attempt, budget);
                break;
            }
        }

        if (settings.isFallbackEnabled()) {
            log.info("AI safety analysis unavailable after {} attempt(s), using rule-based analysis", attempt);
            return ruleBasedAnalyzer.analyze(meds, context).toBuilder().attempts(attempt).build();
        }

        String message = lastFailure != null ? lastFailure.getMessage() : "AI analysis failed after all retries";
        log.error("AI safety analysis failed after {} attempt(s) and fallback is disabled: {}", attempt, message);
        return errorResult(message, attempt);
    }

    public boolean isAiAvailable() {
        return settings.isEnabled() && inferenceClient.isConfigured();
    }

    public ServiceStatus getServiceStatus() {
        return ServiceStatus.builder()
            .enabled(settings.isEnabled())
            .apiConfigured(inferenceClient.isConfigured())
            .fallbackEnabled(settings.isFallbackEnabled())
            .model(settings.getModel())
            .maxRetries(settings.attemptBudget())
            .build();
    }

    static boolean shouldRetry(InferenceException failure, int attempt, int budget) {
        return failure.isRetryable() && attempt < budget;
    }

    private AnalysisResult attemptAiAnalysis(List<MedicationItem> medications, PatientContext context)
            throws InterruptedException {
        inferenceClient.checkConfigured();
        String prompt = promptBuilder.build(medications, context);
        rateLimiter.waitIfNeeded();
        String rawText = inferenceClient.invoke(prompt);
        return responseInterpreter.interpret(rawText);
    }

    private static void pause(Duration delay) throws InterruptedException {
        if (!delay.isNegative() && !delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }

    private AnalysisResult systemResult(String summary) {
        return AnalysisResult.builder()
            .overallRisk(RiskLevel.LOW)
            .summary(summary)
            .source(Source.SYSTEM)
            .attempts(0)
            .timestamp(Instant.now(clock))
            .build();
    }

    private AnalysisResult errorResult(String message, int attempts) {
        return AnalysisResult.builder()
            .overallRisk(RiskLevel.MODERATE)
            .summary("Safety analysis could not be completed. Manual review of this prescription is required.")
            .source(Source.ERROR)
            .attempts(attempts)
            .error(message)
            .timestamp(Instant.now(clock))
            .build();
    }
}
