package tech.noetzold.risk_assessment_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

// detailed_analysis and analysis_error are mutually exclusive
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssessmentResult(
        String predictor_type,
        double risk_score,
        RiskLevel risk_level,
        double confidence,
        List<ContributingFactor> risk_factors,
        List<String> recommendations,
        VisualizationPayload chart_data,
        String explanation,
        DetailedAnalysis detailed_analysis,
        String analysis_error
) {
    public AssessmentResult {
        risk_factors = List.copyOf(risk_factors);
        recommendations = List.copyOf(recommendations);
    }
}
