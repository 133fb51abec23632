package tech.noetzold.risk_assessment_api.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.noetzold.risk_assessment_api.config.AssessmentEngineConfig;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.exception.AnalysisUnsupportedException;
import tech.noetzold.risk_assessment_api.exception.MissingFieldException;
import tech.noetzold.risk_assessment_api.exception.UnknownDomainException;
import tech.noetzold.risk_assessment_api.model.AssessmentResult;
import tech.noetzold.risk_assessment_api.model.DomainSchema;
import tech.noetzold.risk_assessment_api.model.DomainSummary;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.repository.DomainRepository;
import tech.noetzold.risk_assessment_api.repository.impl.InMemoryDomainRepository;
import tech.noetzold.risk_assessment_api.service.scoring.FallbackEstimator;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AssessmentServiceTest {

    private static AssessmentPipeline pipeline() {
        return new AssessmentPipeline(
                new RecordValidator(),
                new RiskScorer(new FallbackEstimator(1000, 42, 300)),
                new RiskClassifier(),
                new FactorRanker(),
                new ConfidenceEstimator(),
                new RecommendationComposer(),
                new VisualizationPayloadBuilder());
    }

    // Valid record with every field drawn uniformly from its declared range.
    private static Map<String, Object> sampleRecord(DomainDefinition domain, Random random) {
        Map<String, Object> record = new HashMap<>();
        for (FieldSpec spec : domain.getSchema().fields()) {
            Object value = switch (spec.type()) {
                case INTEGER -> (int) Math.round(random.nextDouble() * spec.scale());
                case FLOAT -> random.nextDouble() * spec.scale();
                case BOOLEAN -> random.nextBoolean();
                case ORDINAL -> random.nextInt(spec.maxLevel() + 1);
                case STRING -> "sample";
            };
            record.put(spec.name(), value);
        }
        return record;
    }

    @Nested
    @DisplayName("against the full domain catalog")
    class Catalog {

        private final AssessmentService service = new AssessmentService(
                new InMemoryDomainRepository(AssessmentEngineConfig.allDomains()), pipeline());

        @Test
        void listsEveryDomainWithItsFieldTypes() {
            List<DomainSummary> domains = service.listDomains();

            assertThat(domains).hasSize(24);
            assertThat(domains).extracting(DomainSummary::predictor_type)
                    .contains("heart_disease", "obesity_risk", "diabetes", "cancer_recurrence");
            assertThat(domains.get(0).required_fields())
                    .containsEntry("age", "int")
                    .containsEntry("cholesterol", "float")
                    .containsEntry("smoking", "bool");
        }

        @Test
        void schemaReportsAnalysisSupport() {
            DomainSchema heart = service.getSchema("heart_disease");

            assertThat(heart.supports_factor_analysis()).isTrue();
            assertThat(heart.field_descriptions()).containsKeys("age", "cholesterol", "systolic_bp", "smoking", "diabetes");
        }

        @ParameterizedTest
        @ValueSource(strings = {"heart_disease", "stroke_risk", "hypertension", "cholesterol_risk",
                "sepsis", "icu_mortality", "post_surgery_complication",
                "cancer_detection", "liver_disease", "alzheimer", "diabetes",
                "obesity_risk", "mental_health", "sleep_apnea",
                "covid_risk", "asthma_copd", "anemia", "thyroid_disorder"})
        void domainsWithClinicalAnalysis(String domain) {
            assertThat(service.getSchema(domain).supports_factor_analysis()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"heart_disease_clinical", "hospital_readmission", "pregnancy_complication",
                "kidney_disease", "parkinson", "cancer_recurrence"})
        void domainsWithoutClinicalAnalysis(String domain) {
            assertThat(service.getSchema(domain).supports_factor_analysis()).isFalse();
        }

        @Test
        void everyDomainStaysWithinBoundsOnRandomInput() {
            Random random = new Random(7);
            for (DomainSummary summary : service.listDomains()) {
                DomainDefinition domain = AssessmentEngineConfig.allDomains().stream()
                        .filter(d -> d.getName().equals(summary.predictor_type()))
                        .findFirst().orElseThrow();
                for (int i = 0; i < 25; i++) {
                    AssessmentResult result = service.assess(domain.getName(), sampleRecord(domain, random), true);

                    assertThat(result.risk_score()).as(domain.getName()).isBetween(0.0, 1.0);
                    assertThat(result.confidence()).as(domain.getName()).isBetween(0.60, 0.95);
                    assertThat(result.risk_factors()).as(domain.getName()).hasSizeLessThanOrEqualTo(10);
                    assertThat(result.recommendations()).as(domain.getName())
                            .hasSizeLessThanOrEqualTo(15)
                            .doesNotHaveDuplicates();
                    assertThat(result.analysis_error()).as(domain.getName()).isNull();
                }
            }
        }

        @Test
        void unknownDomainListsTheAvailableOnes() {
            assertThatThrownBy(() -> service.assess("unknown_x", Map.of(), false))
                    .isInstanceOfSatisfying(UnknownDomainException.class, e -> {
                        assertThat(e.domain()).isEqualTo("unknown_x");
                        assertThat(e.getMessage()).contains("heart_disease");
                    });
        }

        @Test
        void analysisOfUnsupportedDomainIsRejected() {
            assertThatThrownBy(() -> service.analyze("kidney_disease", Map.of()))
                    .isInstanceOf(AnalysisUnsupportedException.class);
        }

        @Test
        void missingFieldIsNamed() {
            Map<String, Object> record = new HashMap<>(Map.of("age", 50, "cholesterol", 200, "systolic_bp", 120, "smoking", false));

            assertThatThrownBy(() -> service.assess("heart_disease", record, false))
                    .isInstanceOfSatisfying(MissingFieldException.class,
                            e -> assertThat(e.field()).isEqualTo("diabetes"));
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class Resolution {

        @Mock
        private DomainRepository domainRepository;

        @Mock
        private AssessmentPipeline pipeline;

        @InjectMocks
        private AssessmentService service;

        @Test
        void unknownDomainNeverReachesThePipeline() {
            when(domainRepository.findByName("nope")).thenReturn(Optional.empty());
            when(domainRepository.names()).thenReturn(List.of("heart_disease"));

            assertThatThrownBy(() -> service.assess("nope", Map.of(), true))
                    .isInstanceOf(UnknownDomainException.class)
                    .hasMessage("Predictor 'nope' not found. Available predictors: [heart_disease]");
            verify(pipeline, never()).run(any(), any(), anyBoolean());
        }
    }
}
