package tech.noetzold.risk_assessment_api.model;

import java.util.Map;

public record DomainSchema(
        String predictor_type,
        String name,
        String description,
        Map<String, String> required_fields,
        Map<String, String> field_descriptions,
        boolean supports_factor_analysis
) {}
