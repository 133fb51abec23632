package tech.noetzold.risk_assessment_api.domain;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.List;
import java.util.Map;

public interface FactorAnalysis {

    List<ContributingFactor> contributingFactors(TypedRecord record);

    Map<String, Object> healthMetrics(TypedRecord record);

    String lifestyleImpact(TypedRecord record);
}
