package tech.noetzold.risk_assessment_api.model;

public record ContributingFactor(
        String field,
        String factor,             // display label
        Object value,
        Double normalized_value,
        double contribution_score,
        Severity severity,
        String explanation,
        String remediation
) {}
