package tech.noetzold.risk_assessment_api.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.noetzold.risk_assessment_api.config.AssessmentEngineConfig;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.domain.FactorAnalysis;
import tech.noetzold.risk_assessment_api.exception.AnalysisUnsupportedException;
import tech.noetzold.risk_assessment_api.exception.MissingFieldException;
import tech.noetzold.risk_assessment_api.model.AssessmentResult;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.DetailedAnalysis;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.model.RiskLevel;
import tech.noetzold.risk_assessment_api.model.TypedRecord;
import tech.noetzold.risk_assessment_api.service.scoring.FallbackEstimator;
import tech.noetzold.risk_assessment_api.service.scoring.ScoringRules;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AssessmentPipelineTest {

    private final AssessmentPipeline pipeline = new AssessmentPipeline(
            new RecordValidator(),
            new RiskScorer(new FallbackEstimator(1000, 42, 300)),
            new RiskClassifier(),
            new FactorRanker(),
            new ConfidenceEstimator(),
            new RecommendationComposer(),
            new VisualizationPayloadBuilder());

    private static DomainDefinition domain(String name) {
        return AssessmentEngineConfig.allDomains().stream()
                .filter(d -> d.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("heart disease, every risk factor present")
    class HeartDisease {

        private final Map<String, Object> record = Map.of(
                "age", 70, "cholesterol", 260, "systolic_bp", 150, "smoking", true, "diabetes", true);

        @Test
        void scoresVeryHigh() {
            AssessmentResult result = pipeline.run(domain("heart_disease"), record, false);

            assertThat(result.risk_score()).isCloseTo(1.0, within(1e-9));
            assertThat(result.risk_level()).isEqualTo(RiskLevel.VERY_HIGH);
            assertThat(result.confidence()).isBetween(0.60, 0.95);
        }

        @Test
        void smokingLeadsTheFactorsAndItsRemediationIsRecommended() {
            AssessmentResult result = pipeline.run(domain("heart_disease"), record, false);

            assertThat(result.risk_factors()).extracting(ContributingFactor::field)
                    .containsExactly("smoking", "diabetes");
            assertThat(result.recommendations())
                    .startsWith("Urgent medical consultation recommended")
                    .contains("URGENT: Smoking cessation program, nicotine replacement therapy, and behavioral counseling",
                            "Quit smoking immediately")
                    .doesNotHaveDuplicates()
                    .hasSizeLessThanOrEqualTo(RecommendationComposer.MAX_RECOMMENDATIONS);
        }

        @Test
        void explanationNamesLevelScoreAndFactors() {
            AssessmentResult result = pipeline.run(domain("heart_disease"), record, false);

            assertThat(result.explanation())
                    .startsWith("Based on the provided health information, your heart disease risk predictor shows a very high risk level with a score of 100.0%.")
                    .contains("The primary contributing factors are: Current smoking status, Diabetes diagnosis.")
                    .endsWith("requires immediate attention and potentially medical intervention.");
        }

        @Test
        void analysisIsAttachedOnlyWhenRequested() {
            AssessmentResult without = pipeline.run(domain("heart_disease"), record, false);
            AssessmentResult with = pipeline.run(domain("heart_disease"), record, true);

            assertThat(without.detailed_analysis()).isNull();
            assertThat(with.detailed_analysis()).isNotNull();
            assertThat(with.detailed_analysis().contributing_factors()).hasSize(5);
            assertThat(with.analysis_error()).isNull();
        }

        @Test
        void repeatedRunsAreIdentical() {
            AssessmentResult first = pipeline.run(domain("heart_disease"), record, true);
            AssessmentResult second = pipeline.run(domain("heart_disease"), record, true);

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("heart disease, non-smoker without diabetes")
    class HeartDiseaseNonSmoker {

        private final Map<String, Object> record = Map.of(
                "age", 40, "cholesterol", 180, "systolic_bp", 115, "smoking", false, "diabetes", false);

        @Test
        void absentRiskFlagsAreNotRemediated() {
            AssessmentResult result = pipeline.run(domain("heart_disease"), record, false);

            assertThat(result.recommendations())
                    .noneMatch(r -> r.startsWith("URGENT: Smoking cessation"))
                    .noneMatch(r -> r.startsWith("Optimal glycemic control"))
                    .doesNotContain("Quit smoking immediately");
        }

        @Test
        void smokingFactorReadsAsProtective() {
            AssessmentResult result = pipeline.run(domain("heart_disease"), record, false);

            assertThat(result.risk_factors()).filteredOn(f -> f.field().equals("smoking"))
                    .singleElement()
                    .satisfies(f -> {
                        assertThat(f.explanation()).isEqualTo("The value no for Current smoking status lowers the overall risk.");
                        assertThat(f.remediation()).isNull();
                    });
        }
    }

    @Nested
    @DisplayName("obesity risk, healthy profile")
    class Obesity {

        private final Map<String, Object> record = Map.of("bmi", 22, "sedentary_hours", 2, "activity_level", 3);

        @Test
        void scoresLowWithFewFactors() {
            AssessmentResult result = pipeline.run(domain("obesity_risk"), record, false);

            assertThat(result.risk_score()).isEqualTo(0.0);
            assertThat(result.risk_level()).isEqualTo(RiskLevel.LOW);
            assertThat(result.risk_factors()).hasSizeLessThanOrEqualTo(3);
            assertThat(result.recommendations()).startsWith("Maintain your current healthy lifestyle");
            assertThat(result.confidence()).isEqualTo(ConfidenceEstimator.FLOOR);
        }

        @Test
        void omittedDefaultedFieldsAreFilled() {
            AssessmentResult result = pipeline.run(domain("obesity_risk"), record, false);

            assertThat(result.chart_data().health_metrics().labels()).contains("Calories");
        }

        @Test
        void lowRiskValuesAreExplainedAsProtectiveWithoutRemediation() {
            AssessmentResult result = pipeline.run(domain("obesity_risk"), record, false);

            assertThat(result.risk_factors()).extracting(ContributingFactor::field)
                    .contains("activity_level", "family_history_obesity");
            assertThat(result.risk_factors()).allSatisfy(f -> {
                assertThat(f.remediation()).isNull();
                assertThat(f.explanation()).endsWith("lowers the overall risk.");
            });
            assertThat(result.recommendations())
                    .doesNotContain("Behavioral counseling if needed", "Regular physical activity (150 min/week)");
        }

        @Test
        void omittedRequiredFieldFails() {
            assertThatThrownBy(() -> pipeline.run(domain("obesity_risk"), Map.of("bmi", 22, "activity_level", 3), false))
                    .isInstanceOfSatisfying(MissingFieldException.class,
                            e -> assertThat(e.field()).isEqualTo("sedentary_hours"));
        }
    }

    @Nested
    @DisplayName("factor analysis")
    class Analysis {

        private final DomainDefinition broken = DomainDefinition.builder()
                .name("broken_analysis")
                .field(FieldSpec.decimal("x", "X", 10))
                .scoring(ScoringRules.builder().capped("x", 10, 1.0).build())
                .analysis(new FactorAnalysis() {
                    @Override
                    public List<ContributingFactor> contributingFactors(TypedRecord record) {
                        throw new IllegalStateException("lookup table missing");
                    }

                    @Override
                    public Map<String, Object> healthMetrics(TypedRecord record) {
                        return Map.of();
                    }

                    @Override
                    public String lifestyleImpact(TypedRecord record) {
                        return "";
                    }
                })
                .build();

        @Test
        void failureIsIsolatedFromTheAssessment() {
            AssessmentResult result = pipeline.run(broken, Map.of("x", 4), true);

            assertThat(result.risk_score()).isCloseTo(0.4, within(1e-9));
            assertThat(result.risk_level()).isEqualTo(RiskLevel.MODERATE);
            assertThat(result.detailed_analysis()).isNull();
            assertThat(result.analysis_error()).isEqualTo("Enhanced analysis failed: lookup table missing");
        }

        @Test
        void standaloneAnalysisOfUnsupportedDomainFails() {
            assertThatThrownBy(() -> pipeline.analyze(domain("parkinson"), Map.of()))
                    .isInstanceOf(AnalysisUnsupportedException.class)
                    .hasMessageContaining("parkinson");
        }

        @Test
        void standaloneAnalysisReturnsAllThreeSections() {
            DetailedAnalysis analysis = pipeline.analyze(domain("heart_disease"),
                    Map.of("age", 40, "cholesterol", 180, "systolic_bp", 115, "smoking", false, "diabetes", false));

            assertThat(analysis.contributing_factors()).isEmpty();
            assertThat(analysis.health_metrics()).containsKeys("cardiovascular_assessment", "risk_stratification");
            assertThat(analysis.lifestyle_impact()).startsWith("Your current risk factors are well-controlled.");
        }
    }

    @Test
    void domainWithoutFormulaIsScoredByFallback() {
        Map<String, Object> record = Map.ofEntries(
                Map.entry("age", 54), Map.entry("sex", 1), Map.entry("chest_pain_type", 2),
                Map.entry("resting_bp", 130), Map.entry("cholesterol", 246), Map.entry("fasting_blood_sugar", false),
                Map.entry("resting_ecg", 0), Map.entry("max_heart_rate", 150), Map.entry("exercise_angina", false),
                Map.entry("st_depression", 1.0), Map.entry("st_slope", 1), Map.entry("smoking", false),
                Map.entry("family_history", true));
        DomainDefinition clinical = domain("heart_disease_clinical");

        AssessmentResult first = pipeline.run(clinical, record, true);
        AssessmentResult second = pipeline.run(clinical, record, true);

        assertThat(first.risk_score()).isBetween(0.0, 1.0).isEqualTo(second.risk_score());
        assertThat(first.detailed_analysis()).isNull();
        assertThat(first.analysis_error()).isNull();
    }
}
