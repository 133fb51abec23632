package tech.noetzold.risk_assessment_api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DetailedAnalysis(
        List<ContributingFactor> contributing_factors,
        Map<String, Object> health_metrics,
        String lifestyle_impact
) {
    public DetailedAnalysis {
        contributing_factors = contributing_factors == null ? List.of() : List.copyOf(contributing_factors);
        health_metrics = health_metrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(health_metrics));
    }
}
