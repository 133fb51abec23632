package tech.noetzold.risk_assessment_api.model;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record PredictRequest(
        @NotBlank String predictor_type,
        Map<String, Object> data,
        Boolean include_analysis
) {
    public boolean includeAnalysis() {
        return include_analysis == null || include_analysis;
    }
}
