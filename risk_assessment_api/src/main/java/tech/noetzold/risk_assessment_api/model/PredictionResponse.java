package tech.noetzold.risk_assessment_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PredictionResponse(
        String predictor_type,
        double risk_score,
        RiskLevel risk_level,
        double confidence,
        List<ContributingFactor> risk_factors,
        List<String> recommendations,
        VisualizationPayload chart_data,
        String explanation,
        DetailedAnalysis detailed_analysis,
        String analysis_error,
        String timestamp
) {
    public static PredictionResponse fromResult(AssessmentResult result, Instant at) {
        return new PredictionResponse(
                result.predictor_type(),
                result.risk_score(),
                result.risk_level(),
                result.confidence(),
                result.risk_factors(),
                result.recommendations(),
                result.chart_data(),
                result.explanation(),
                result.detailed_analysis(),
                result.analysis_error(),
                at.toString()
        );
    }
}
