package tech.noetzold.risk_assessment_api.domain.analysis;

import org.junit.jupiter.api.Test;
import tech.noetzold.risk_assessment_api.config.AssessmentEngineConfig;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;
import tech.noetzold.risk_assessment_api.service.RecordValidator;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnemiaAnalysisTest {

    private final AnemiaAnalysis analysis = new AnemiaAnalysis();

    private static TypedRecord record(double hemoglobin, double iron, boolean heavyBleeding, Boolean ironAdequate) {
        DomainDefinition anemia = AssessmentEngineConfig.allDomains().stream()
                .filter(d -> d.getName().equals("anemia"))
                .findFirst().orElseThrow();
        Map<String, Object> raw = new HashMap<>();
        raw.put("hemoglobin", hemoglobin);
        raw.put("serum_iron", iron);
        raw.put("heavy_menstrual_bleeding", heavyBleeding);
        if (ironAdequate != null) {
            raw.put("dietary_iron_adequate", ironAdequate);
        }
        return new RecordValidator().coerce(raw, anemia.getSchema());
    }

    @Test
    void lowValuesAreTheRiskSide() {
        List<ContributingFactor> factors = analysis.contributingFactors(record(7.5, 25, true, false));

        assertThat(factors).extracting(ContributingFactor::field)
                .containsExactly("hemoglobin", "serum_iron", "heavy_menstrual_bleeding", "dietary_iron_adequate");
        assertThat(factors.get(0).severity()).isEqualTo(Severity.SEVERE);
        assertThat(analysis.healthMetrics(record(7.5, 25, true, false)))
                .containsEntry("likely_type", "Iron deficiency");
    }

    @Test
    void healthyValuesProduceNothing() {
        TypedRecord healthy = record(14.5, 110, false, null);

        assertThat(analysis.contributingFactors(healthy)).isEmpty();
        assertThat(analysis.healthMetrics(healthy)).containsEntry("likely_type", "None");
        assertThat(analysis.lifestyleImpact(healthy)).startsWith("Diet and bleeding history do not point to an iron problem.");
    }

    @Test
    void mildAnemiaWithoutIronDeficiencyIsUndetermined() {
        TypedRecord record = record(11.2, 90, false, true);

        assertThat(analysis.contributingFactors(record)).singleElement()
                .satisfies(f -> assertThat(f.severity()).isEqualTo(Severity.MILD));
        assertThat(analysis.healthMetrics(record)).containsEntry("likely_type", "Undetermined");
    }
}
