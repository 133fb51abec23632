package tech.noetzold.risk_assessment_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.risk_assessment_api.exception.ScoringConfigurationException;
import tech.noetzold.risk_assessment_api.model.FeatureVector;
import tech.noetzold.risk_assessment_api.service.scoring.FallbackEstimator;
import tech.noetzold.risk_assessment_api.service.scoring.ScoringRules;
import tech.noetzold.risk_assessment_api.service.scoring.ScoringStrategy;

@Slf4j
@Component
public class RiskScorer {

    private final FallbackEstimator fallbackEstimator;

    public RiskScorer(FallbackEstimator fallbackEstimator) {
        this.fallbackEstimator = fallbackEstimator;
    }

    public double score(FeatureVector vector, ScoringRules rules) {
        ScoringStrategy strategy = rules != null ? rules : fallbackEstimator;
        double raw = strategy.rawScore(vector);
        if (Double.isNaN(raw)) {
            throw new ScoringConfigurationException("Scoring strategy '" + strategy.name() + "' produced NaN");
        }
        double bounded = Math.max(0.0, Math.min(1.0, raw));
        log.debug("Scored with {} strategy: raw={} bounded={}", strategy.name(), raw, bounded);
        return bounded;
    }
}
