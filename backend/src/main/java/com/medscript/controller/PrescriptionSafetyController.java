package com.medscript.controller;

import com.medscript.dto.PrescriptionDTO;
import com.medscript.dto.SafetyAnalysisDTO;
import com.medscript.safety.AnalysisOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/prescriptions/safety-analysis")
@RequiredArgsConstructor
@Tag(name = "Prescription Safety", description = "Drug interaction and prescription safety analysis")
public class PrescriptionSafetyController {

    private final AnalysisOrchestrator analysisOrchestrator;

    @PostMapping
    @Operation(summary = "Analyze a prescription for safety concerns")
    public ResponseEntity<SafetyAnalysisDTO.AnalysisResult> analyze(
            @RequestBody PrescriptionDTO.AnalysisRequest request) {

        SafetyAnalysisDTO.AnalysisResult result =
            analysisOrchestrator.analyzeSafety(request.getMedications(), request.getPatient());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/status")
    @Operation(summary = "Get safety analysis service status")
    public ResponseEntity<SafetyAnalysisDTO.ServiceStatus> getStatus() {
        return ResponseEntity.ok(analysisOrchestrator.getServiceStatus());
    }
}
