package tech.noetzold.risk_assessment_api.domain.analysis;

import org.junit.jupiter.api.Test;
import tech.noetzold.risk_assessment_api.config.AssessmentEngineConfig;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;
import tech.noetzold.risk_assessment_api.service.RecordValidator;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.LIST;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

class SepsisAnalysisTest {

    private final SepsisAnalysis analysis = new SepsisAnalysis();

    private static TypedRecord vitals(double temperature, double heartRate, double respiratoryRate, double wbc) {
        DomainDefinition sepsis = AssessmentEngineConfig.allDomains().stream()
                .filter(d -> d.getName().equals("sepsis"))
                .findFirst().orElseThrow();
        return new RecordValidator().coerce(Map.of("temperature", temperature, "heart_rate", heartRate,
                "respiratory_rate", respiratoryRate, "white_blood_cells", wbc), sepsis.getSchema());
    }

    @Test
    void septicVitalsProduceFindingsPerSign() {
        List<ContributingFactor> factors = analysis.contributingFactors(vitals(103.5, 135, 32, 22000));

        assertThat(factors).extracting(ContributingFactor::factor)
                .containsExactly("Fever", "Tachycardia", "Tachypnea", "Leukocytosis");
        assertThat(factors).extracting(ContributingFactor::severity).containsOnly(Severity.SEVERE);
    }

    @Test
    void normalVitalsProduceNoFindings() {
        TypedRecord normal = vitals(98.6, 75, 14, 7000);

        assertThat(analysis.contributingFactors(normal)).isEmpty();
        assertThat(SepsisAnalysis.sirsPoints(normal)).isZero();
        assertThat(analysis.lifestyleImpact(normal)).startsWith("No strong sepsis signal.");
    }

    @Test
    void lowTemperatureAndCountAreFlagged() {
        List<ContributingFactor> factors = analysis.contributingFactors(vitals(95.5, 80, 18, 3000));

        assertThat(factors).extracting(ContributingFactor::factor).containsExactly("Hypothermia", "Leukopenia");
    }

    @Test
    void metricsGradeSirsPoints() {
        Map<String, Object> metrics = analysis.healthMetrics(vitals(102, 95, 21, 8000));

        assertThat(metrics).extractingByKey("sepsis_assessment", MAP)
                .containsEntry("sirs_points", 3)
                .containsEntry("sepsis_risk", "high")
                .containsEntry("monitoring_level", "intensive");
        assertThat(metrics).extractingByKey("risk_indicators", LIST)
                .containsExactly("Temperature dysregulation", "SIRS criteria met");
    }
}
