package tech.noetzold.risk_assessment_api.service.scoring;

import tech.noetzold.risk_assessment_api.model.FeatureVector;

public interface ScoringStrategy {

    double rawScore(FeatureVector vector);

    String name();
}
