package com.medscript.safety;

import com.medscript.dto.PrescriptionDTO.MedicationItem;
import com.medscript.dto.PrescriptionDTO.PatientContext;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the analysis request sent to the inference endpoint.
 * Output depends only on the arguments.
 */
@Component
public class PromptBuilder {

    static final String UNKNOWN = "Unknown";
    static final String NO_ALLERGIES = "None known";
    static final String NO_CONDITIONS = "None reported";

    private static final String RESPONSE_FORMAT = String.join("\n",
        "Please provide a comprehensive analysis in the following JSON format:",
        "",
        "{",
        "    \"interactions\": [",
        "        {",
        "            \"drugs\": [\"Drug A\", \"Drug B\"],",
        "            \"severity\": \"major|moderate|minor\",",
        "            \"description\": \"Description of the interaction\",",
        "            \"recommendation\": \"Clinical recommendation\"",
        "        }",
        "    ],",
        "    \"allergies\": [",
        "        {",
        "            \"drug\": \"Drug name\",",
        "            \"allergy\": \"Known allergy\",",
        "            \"risk\": \"Risk assessment\"",
        "        }",
        "    ],",
        "    \"contraindications\": [",
        "        {",
        "            \"drug\": \"Drug name\",",
        "            \"condition\": \"Medical condition\",",
        "            \"risk\": \"Risk level and explanation\"",
        "        }",
        "    ],",
        "    \"alternatives\": [",
        "        {",
        "            \"instead_of\": \"Current drug\",",
        "            \"suggested\": \"Alternative drug\",",
        "            \"reason\": \"Reason for alternative\"",
        "        }",
        "    ],",
        "    \"monitoring\": [",
        "        {",
        "            \"parameter\": \"What to monitor\",",
        "            \"frequency\": \"How often\",",
        "            \"reason\": \"Why monitoring is needed\"",
        "        }",
        "    ],",
        "    \"overall_risk\": \"low|moderate|high\",",
        "    \"summary\": \"Brief overall assessment\"",
        "}",
        "",
        "Focus on clinically significant interactions and provide actionable recommendations. "
            + "If no significant issues are found, indicate that in your response."
    ) + "\n";

    public String build(List<MedicationItem> medications, PatientContext patient) {
        PatientContext context = patient != null ? patient : PatientContext.unknown();

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a clinical pharmacist AI assistant. Analyze the following prescription ")
            .append("for potential drug interactions, contraindications, and safety concerns.\n\n");

        prompt.append("PATIENT INFORMATION:\n")
            .append("- Age: ").append(context.getAge() != null ? context.getAge().toString() : UNKNOWN).append('\n')
            .append("- Gender: ").append(orDefault(context.getGender(), UNKNOWN)).append('\n')
            .append("- Known Allergies: ").append(orDefault(context.getAllergies(), NO_ALLERGIES)).append('\n')
            .append("- Medical Conditions: ").append(orDefault(context.getMedicalConditions(), NO_CONDITIONS))
            .append("\n\n");

        prompt.append("PRESCRIBED MEDICATIONS:\n");
        if (medications != null) {
            for (MedicationItem medication : medications) {
                prompt.append(renderMedication(medication)).append('\n');
            }
        }
        prompt.append('\n').append(RESPONSE_FORMAT);
        return prompt.toString();
    }

    String renderMedication(MedicationItem medication) {
        StringBuilder line = new StringBuilder("- ")
            .append(orDefault(medication.getName(), UNKNOWN))
            .append(" (").append(orDefault(medication.getGenericName(), "N/A")).append(')');
        if (hasText(medication.getDosage())) {
            line.append(" - ").append(medication.getDosage().trim());
        }
        if (hasText(medication.getFrequency())) {
            line.append(' ').append(medication.getFrequency().trim());
        }
        return line.toString();
    }

    private static String orDefault(String value, String fallback) {
        return hasText(value) ? value.trim() : fallback;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
