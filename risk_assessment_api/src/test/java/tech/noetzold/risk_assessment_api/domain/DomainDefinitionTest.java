package tech.noetzold.risk_assessment_api.domain;

import org.junit.jupiter.api.Test;
import tech.noetzold.risk_assessment_api.config.AssessmentEngineConfig;
import tech.noetzold.risk_assessment_api.exception.ScoringConfigurationException;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.service.scoring.ScoringRules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainDefinitionTest {

    @Test
    void formulaOnUndeclaredFieldFailsAtConstruction() {
        DomainDefinition.DomainDefinitionBuilder builder = DomainDefinition.builder()
                .name("mismatch")
                .field(FieldSpec.decimal("bmi", "BMI", 50))
                .scoring(ScoringRules.builder().capped("bmi", 50, 0.5).flag("smoking", 0.2).build());

        assertThatThrownBy(builder::build)
                .isInstanceOf(ScoringConfigurationException.class)
                .hasMessageContaining("mismatch")
                .hasMessageContaining("smoking");
    }

    @Test
    void explanationForUndeclaredFieldFailsAtConstruction() {
        DomainDefinition.DomainDefinitionBuilder builder = DomainDefinition.builder()
                .name("typo")
                .field(FieldSpec.decimal("bmi", "BMI", 50))
                .explanation("bim", "BMI {value}");

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bim");
    }

    @Test
    void duplicateFieldIsRejected() {
        DomainDefinition.DomainDefinitionBuilder builder = DomainDefinition.builder()
                .name("dupe")
                .field(FieldSpec.decimal("bmi", "BMI", 50))
                .field(FieldSpec.integer("bmi", "BMI again", 50));

        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void templatesFillTheValueAndFallBackToGenericText() {
        DomainDefinition domain = DomainDefinition.builder()
                .name("texts")
                .displayName("Texts")
                .field(FieldSpec.decimal("bmi", "Body Mass Index", 50).weight(0.4))
                .field(FieldSpec.flag("smoking", "Smoking"))
                .explanation("bmi", "BMI {value} is above target")
                .remediation("bmi", "Portion control")
                .build();

        assertThat(domain.explain("bmi", "Body Mass Index", "31.5")).isEqualTo("BMI 31.5 is above target");
        assertThat(domain.explain("smoking", "Smoking", "yes"))
                .isEqualTo("The value yes for Smoking contributes to the overall risk assessment.");
        assertThat(domain.remediate("bmi", "Body Mass Index")).isEqualTo("Portion control");
        assertThat(domain.remediate("smoking", "Smoking")).isEqualTo("Address the smoking to reduce risk.");
        assertThat(domain.weights()).containsOnlyKeys("bmi");
        assertThat(domain.supportsFactorAnalysis()).isFalse();
        assertThat(domain.scoringRules()).isEmpty();
    }

    @Test
    void everyCatalogDomainHasAFormulaExceptTheClinicalHeartModel() {
        assertThat(AssessmentEngineConfig.allDomains())
                .filteredOn(d -> d.getScoring() == null)
                .extracting(DomainDefinition::getName)
                .containsExactly("heart_disease_clinical");
    }
}
