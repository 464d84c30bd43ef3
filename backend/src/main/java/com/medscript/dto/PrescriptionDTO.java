package com.medscript.dto;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class PrescriptionDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MedicationItem {
        private String name;
        private String genericName;
        private String dosage;
        private String frequency;
    }

    /**
     * Clinical context of the patient receiving the prescription.
     * Allergies and conditions are free text, delimited by commas or semicolons.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PatientContext {
        @JsonDeserialize(using = AgeDeserializer.class)
        private Integer age;
        private String gender;
        private String allergies;
        private String medicalConditions;

        public static PatientContext unknown() {
            return new PatientContext();
        }
    }

    /**
     * Reads age as a number or numeric text; "unknown" and other non-numeric text mean no age.
     */
    public static class AgeDeserializer extends JsonDeserializer<Integer> {

        @Override
        public Integer deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            if (parser.currentToken().isNumeric()) {
                return parser.getIntValue();
            }
            if (parser.currentToken().isStructStart()) {
                parser.skipChildren();
                return null;
            }
            String text = parser.getValueAsString();
            if (text == null || text.isBlank() || !text.trim().matches("\\d{1,3}")) {
                return null;
            }
            return Integer.valueOf(text.trim());
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AnalysisRequest {
        @Builder.Default
        private List<MedicationItem> medications = new ArrayList<>();
        private PatientContext patient;
    }
}
