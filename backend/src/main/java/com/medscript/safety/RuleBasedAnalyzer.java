package com.medscript.safety;

import com.medscript.dto.PrescriptionDTO.MedicationItem;
import com.medscript.dto.PrescriptionDTO.PatientContext;
import com.medscript.dto.SafetyAnalysisDTO.AllergyFinding;
import com.medscript.dto.SafetyAnalysisDTO.AnalysisResult;
import com.medscript.dto.SafetyAnalysisDTO.ContraindicationFinding;
import com.medscript.dto.SafetyAnalysisDTO.InteractionFinding;
import com.medscript.dto.SafetyAnalysisDTO.MonitoringItem;
import com.medscript.dto.SafetyAnalysisDTO.RiskLevel;
import com.medscript.dto.SafetyAnalysisDTO.Severity;
import com.medscript.dto.SafetyAnalysisDTO.Source;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Local safety check used when AI analysis is unavailable.
 *
 * Matching is case-insensitive substring containment against each medication's
 * name and generic name. The pattern tables are a small illustrative set, not a
 * pharmacology reference.
 */
@Component
public class RuleBasedAnalyzer {

    static final String DISCLAIMER = "AI analysis was unavailable - this is a basic safety check only.";

    private static final Set<String> NO_ALLERGY_SENTINELS =
        Set.of("none", "none known", "nka", "nkda", "no known allergies");

    private static final List<InteractionRule> INTERACTION_RULES = List.of(
        new InteractionRule(List.of("warfarin", "aspirin"), Severity.MAJOR,
            "Increased bleeding risk",
            "Monitor INR closely, consider alternative"),
        new InteractionRule(List.of("metformin", "contrast"), Severity.MAJOR,
            "Risk of lactic acidosis",
            "Hold metformin before and after contrast procedures"),
        new InteractionRule(List.of("ace inhibitor", "potassium"), Severity.MODERATE,
            "Risk of hyperkalemia",
            "Monitor serum potassium levels"),
        new InteractionRule(List.of("nsaid", "ace inhibitor"), Severity.MODERATE,
            "Reduced antihypertensive effect, kidney function risk",
            "Monitor blood pressure and kidney function")
    );

    private static final List<ContraindicationRule> CONTRAINDICATION_RULES = List.of(
        new ContraindicationRule("nsaid", "kidney disease",
            "NSAIDs can worsen kidney function"),
        new ContraindicationRule("metformin", "kidney disease",
            "Risk of lactic acidosis with reduced kidney function"),
        new ContraindicationRule("beta blocker", "asthma",
            "Beta blockers can trigger bronchospasm in asthma patients")
    );

    private static final List<MonitoringRule> MONITORING_RULES = List.of(
        new MonitoringRule("warfarin", "INR",
            "Weekly initially, then monthly when stable",
            "Monitor anticoagulation effect"),
        new MonitoringRule("ace inhibitor", "Kidney function and potassium",
            "2-4 weeks after initiation, then every 6 months",
            "Monitor for kidney effects and hyperkalemia"),
        new MonitoringRule("statin", "Liver function",
            "6-12 weeks after initiation, then annually",
            "Monitor for liver toxicity"),
        new MonitoringRule("metformin", "Kidney function and vitamin B12",
            "Every 6-12 months",
            "Monitor for kidney effects and B12 deficiency")
    );

    private final Clock clock;

    public RuleBasedAnalyzer(Clock clock) {
        this.clock = clock;
    }

    public AnalysisResult analyze(List<MedicationItem> medications, PatientContext patient) {
        List<MedicationItem> meds = medications != null ? medications : List.of();
        PatientContext context = patient != null ? patient : PatientContext.unknown();

        List<InteractionFinding> interactions = checkInteractions(meds);
        List<AllergyFinding> allergies = checkAllergies(meds, context.getAllergies());
        List<ContraindicationFinding> contraindications = checkContraindications(meds, context.getMedicalConditions());
        List<MonitoringItem> monitoring = monitoringFor(meds);

        RiskLevel risk = RiskLevel.LOW;
        if (!interactions.isEmpty() || !contraindications.isEmpty()) {
            risk = RiskLevel.MODERATE;
        }
        if (interactions.stream().anyMatch(i -> i.getSeverity() == Severity.MAJOR)) {
            risk = RiskLevel.HIGH;
        }

        StringBuilder summary = new StringBuilder()
            .append("Basic analysis completed for ").append(meds.size()).append(" medication(s). ");
        if (!interactions.isEmpty()) {
            summary.append("Found ").append(interactions.size()).append(" potential interaction(s). ");
        }
        if (!allergies.isEmpty()) {
            summary.append("Found ").append(allergies.size()).append(" allergy concern(s). ");
        }
        summary.append(DISCLAIMER);

        return AnalysisResult.builder()
            .interactions(interactions)
            .allergies(allergies)
            .contraindications(contraindications)
            .alternatives(List.of())
            .monitoring(monitoring)
            .overallRisk(risk)
            .summary(summary.toString())
            .source(Source.FALLBACK)
            .timestamp(Instant.now(clock))
            .build();
    }

    List<InteractionFinding> checkInteractions(List<MedicationItem> medications) {
        List<String> names = medications.stream()
            .flatMap(RuleBasedAnalyzer::searchableNames)
            .collect(Collectors.toList());

        List<InteractionFinding> findings = new ArrayList<>();
        for (InteractionRule rule : INTERACTION_RULES) {
            List<String> matched = rule.getDrugPatterns().stream()
                .filter(pattern -> names.stream().anyMatch(name -> name.contains(pattern)))
                .collect(Collectors.toList());
            if (matched.size() >= 2) {
                findings.add(InteractionFinding.builder()
                    .drugs(matched.stream().map(RuleBasedAnalyzer::titleCase).collect(Collectors.toUnmodifiableList()))
                    .severity(rule.getSeverity())
                    .description(rule.getDescription())
                    .recommendation(rule.getRecommendation())
                    .build());
            }
        }
        return List.copyOf(findings);
    }

    List<AllergyFinding> checkAllergies(List<MedicationItem> medications, String allergyText) {
        String normalized = allergyText == null ? "" : allergyText.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || NO_ALLERGY_SENTINELS.contains(normalized)) {
            return List.of();
        }

        List<String> allergens = splitList(normalized);
        List<AllergyFinding> findings = new ArrayList<>();
        for (MedicationItem medication : medications) {
            for (String allergen : allergens) {
                if (matches(medication, allergen)) {
                    findings.add(AllergyFinding.builder()
                        .drug(displayName(medication))
                        .allergy(titleCase(allergen))
                        .risk("Patient has documented allergy to this medication")
                        .build());
                }
            }
        }
        return List.copyOf(findings);
    }

    List<ContraindicationFinding> checkContraindications(List<MedicationItem> medications, String conditionText) {
        String conditions = conditionText == null ? "" : conditionText.toLowerCase(Locale.ROOT);
        if (conditions.isBlank()) {
            return List.of();
        }

        List<ContraindicationFinding> findings = new ArrayList<>();
        for (MedicationItem medication : medications) {
            for (ContraindicationRule rule : CONTRAINDICATION_RULES) {
                if (matches(medication, rule.getDrugPattern()) && conditions.contains(rule.getConditionPattern())) {
                    findings.add(ContraindicationFinding.builder()
                        .drug(displayName(medication))
                        .condition(titleCase(rule.getConditionPattern()))
                        .risk(rule.getRisk())
                        .build());
                }
            }
        }
        return List.copyOf(findings);
    }

    List<MonitoringItem> monitoringFor(List<MedicationItem> medications) {
        List<MonitoringItem> items = new ArrayList<>();
        for (MedicationItem medication : medications) {
            for (MonitoringRule rule : MONITORING_RULES) {
                if (matches(medication, rule.getDrugPattern())) {
                    items.add(MonitoringItem.builder()
                        .parameter(rule.getParameter())
                        .frequency(rule.getFrequency())
                        .reason(rule.getReason())
                        .build());
                }
            }
        }
        return List.copyOf(items);
    }

    private static boolean matches(MedicationItem medication, String pattern) {
        return searchableNames(medication).anyMatch(name -> name.contains(pattern));
    }

    private static Stream<String> searchableNames(MedicationItem medication) {
        return Stream.of(medication.getName(), medication.getGenericName())
            .filter(name -> name != null && !name.isBlank())
            .map(name -> name.toLowerCase(Locale.ROOT));
    }

    private static String displayName(MedicationItem medication) {
        return medication.getName() != null && !medication.getName().isBlank() ? medication.getName() : "Unknown";
    }

    private static List<String> splitList(String text) {
        return Arrays.stream(text.split("[,;]"))
            .map(String::trim)
            .filter(token -> !token.isEmpty())
            .collect(Collectors.toList());
    }

    static String titleCase(String text) {
        return Arrays.stream(text.split(" "))
            .filter(word -> !word.isEmpty())
            .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
            .collect(Collectors.joining(" "));
    }

    @Value
    private static class InteractionRule {
        List<String> drugPatterns;
        Severity severity;
        String description;
        String recommendation;
    }

    @Value
    private static class ContraindicationRule {
        String drugPattern;
        String conditionPattern;
        String risk;
    }

    @Value
    private static class MonitoringRule {
        String drugPattern;
        String parameter;
        String frequency;
        String reason;
    }
}
