package tech.noetzold.risk_assessment_api.model;

import java.util.Map;

public record DomainSummary(
        String predictor_type,
        String name,
        String description,
        Map<String, String> required_fields
) {}
