package tech.noetzold.risk_assessment_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.risk_assessment_api.model.RiskLevel;

@Component
public class RiskClassifier {

    public static final double MODERATE_FROM = 0.30;
    public static final double HIGH_FROM = 0.60;
    public static final double VERY_HIGH_FROM = 0.80;

    public RiskLevel classify(double score) {
        if (score < MODERATE_FROM) return RiskLevel.LOW;
        if (score < HIGH_FROM) return RiskLevel.MODERATE;
        if (score < VERY_HIGH_FROM) return RiskLevel.HIGH;
        return RiskLevel.VERY_HIGH;
    }
}
