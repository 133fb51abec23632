package tech.noetzold.risk_assessment_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.SchemaEntry;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.List;

@Component
public class ConfidenceEstimator {

    public static final double BASE = 0.75;
    public static final double FLOOR = 0.60;
    public static final double CEILING = 0.95;
    private static final double FULL_SUPPORT_FACTORS = 5.0;

    public double estimate(TypedRecord typed, SchemaEntry schema, double score, List<ContributingFactor> factors) {
        double completeness = (double) typed.providedCount() / schema.size();
        double certainty = 1.0 - 2.0 * Math.abs(0.5 - score);
        double factorSupport = Math.min(1.0, factors.size() / FULL_SUPPORT_FACTORS);

        double confidence = BASE * (0.4 * completeness + 0.4 * certainty + 0.2 * factorSupport);
        return Math.max(FLOOR, Math.min(CEILING, confidence));
    }
}
