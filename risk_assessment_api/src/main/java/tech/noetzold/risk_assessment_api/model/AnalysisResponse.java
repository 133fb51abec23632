package tech.noetzold.risk_assessment_api.model;

public record AnalysisResponse(
        String predictor_type,
        DetailedAnalysis analysis,
        String timestamp
) {}
