package tech.noetzold.risk_assessment_api.model;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record AnalyzeRequest(
        @NotBlank String predictor_type,
        Map<String, Object> data
) {}
