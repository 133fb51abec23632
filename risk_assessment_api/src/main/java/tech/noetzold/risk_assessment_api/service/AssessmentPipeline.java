package tech.noetzold.risk_assessment_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.domain.FactorAnalysis;
import tech.noetzold.risk_assessment_api.exception.AnalysisUnsupportedException;
import tech.noetzold.risk_assessment_api.model.AssessmentResult;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.DetailedAnalysis;
import tech.noetzold.risk_assessment_api.model.FeatureVector;
import tech.noetzold.risk_assessment_api.model.RiskLevel;
import tech.noetzold.risk_assessment_api.model.TypedRecord;
import tech.noetzold.risk_assessment_api.model.VisualizationPayload;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class AssessmentPipeline {

    static final int EXPLAINED_FACTORS = 3;

    private final RecordValidator recordValidator;
    private final RiskScorer riskScorer;
    private final RiskClassifier riskClassifier;
    private final FactorRanker factorRanker;
    private final ConfidenceEstimator confidenceEstimator;
    private final RecommendationComposer recommendationComposer;
    private final VisualizationPayloadBuilder visualizationPayloadBuilder;

    public AssessmentResult run(DomainDefinition domain, Map<String, Object> raw, boolean includeAnalysis) {
        TypedRecord typed = recordValidator.coerce(raw, domain.getSchema());
        FeatureVector vector = recordValidator.normalize(typed);
        log.debug("[{}] features {}", domain.getName(), vector);

        double score = riskScorer.score(vector, domain.getScoring());
        RiskLevel level = riskClassifier.classify(score);
        List<ContributingFactor> factors = factorRanker.rank(domain, typed, vector);
        double confidence = confidenceEstimator.estimate(typed, domain.getSchema(), score, factors);
        List<String> recommendations = recommendationComposer.compose(level, factors,
                recommendationComposer.lifestyleNotes(domain, typed, score, level));
        VisualizationPayload chartData = visualizationPayloadBuilder.build(score, factors, typed, domain.getRadarAxes());
        String explanation = explain(domain, score, level, factors);
        log.debug("[{}] score={} level={} factors={} confidence={}",
                domain.getName(), score, level, factors.size(), confidence);

        DetailedAnalysis analysis = null;
        String analysisError = null;
        if (includeAnalysis && domain.supportsFactorAnalysis()) {
            try {
                analysis = analyze(domain.getAnalysis(), typed);
            } catch (RuntimeException e) {
                log.warn("[{}] Enhanced analysis failed, returning base assessment: {}", domain.getName(), e.getMessage(), e);
                analysisError = "Enhanced analysis failed: " + e.getMessage();
            }
        }

        return new AssessmentResult(domain.getName(), score, level, confidence, factors, recommendations,
                chartData, explanation, analysis, analysisError);
    }

    public DetailedAnalysis analyze(DomainDefinition domain, Map<String, Object> raw) {
        FactorAnalysis analysis = domain.factorAnalysis()
                .orElseThrow(() -> new AnalysisUnsupportedException(domain.getName()));
        TypedRecord typed = recordValidator.coerce(raw, domain.getSchema());
        return analyze(analysis, typed);
    }

    private DetailedAnalysis analyze(FactorAnalysis analysis, TypedRecord typed) {
        return new DetailedAnalysis(
                analysis.contributingFactors(typed),
                analysis.healthMetrics(typed),
                analysis.lifestyleImpact(typed));
    }

    String explain(DomainDefinition domain, double score, RiskLevel level, List<ContributingFactor> factors) {
        StringBuilder text = new StringBuilder()
                .append("Based on the provided health information, your ")
                .append(domain.getDisplayName().toLowerCase(Locale.ROOT))
                .append(" shows a ")
                .append(level.label().toLowerCase(Locale.ROOT))
                .append(" risk level with a score of ")
                .append(String.format(Locale.ROOT, "%.1f%%", score * 100.0))
                .append('.');
        if (!factors.isEmpty()) {
            text.append(" The primary contributing factors are: ")
                    .append(factors.stream()
                            .limit(EXPLAINED_FACTORS)
                            .map(ContributingFactor::factor)
                            .collect(Collectors.joining(", ")))
                    .append('.');
        }
        if (score < 0.3) {
            text.append(" This indicates a relatively low risk, but maintaining healthy habits is important for prevention.");
        } else if (score < 0.6) {
            text.append(" This suggests moderate risk that can be managed through lifestyle modifications and regular monitoring.");
        } else {
            text.append(" This indicates elevated risk that requires immediate attention and potentially medical intervention.");
        }
        return text.toString();
    }
}
