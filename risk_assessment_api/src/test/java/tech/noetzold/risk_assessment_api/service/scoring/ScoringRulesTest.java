package tech.noetzold.risk_assessment_api.service.scoring;

import org.junit.jupiter.api.Test;
import tech.noetzold.risk_assessment_api.exception.ScoringConfigurationException;
import tech.noetzold.risk_assessment_api.model.FeatureVector;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.model.SchemaEntry;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoringRulesTest {

    private static FeatureVector clinical(double level, double bmi, double smoker) {
        return new FeatureVector(List.of("level", "bmi", "smoker"),
                new double[]{0, 0, 0}, new double[]{level, bmi, smoker});
    }

    @Test
    void termsReceiveClinicalValuesAndAreSummed() {
        ScoringRules rules = ScoringRules.builder()
                .above("bmi", 25, 25, 0.4)
                .flag("smoker", 0.15)
                .levels("level", 0.0, 0.1, 0.3)
                .build();

        assertThat(rules.rawScore(clinical(1, 30, 1))).isCloseTo(0.08 + 0.15 + 0.1, within(1e-9));
        assertThat(rules.rawScore(clinical(0, 20, 0))).isEqualTo(0.0);
    }

    @Test
    void levelsAboveTheTableUseTheLastEntry() {
        ScoringRules rules = ScoringRules.builder().levels("level", 0.0, 0.2).build();

        assertThat(rules.rawScore(clinical(4, 0, 0))).isEqualTo(0.2);
    }

    @Test
    void cappedAndBelowStopAtTheirBounds() {
        ScoringRules capped = ScoringRules.builder().capped("bmi", 100, 0.3).build();
        ScoringRules below = ScoringRules.builder().below("bmi", 18.5, 18.5, 0.2).build();

        assertThat(capped.rawScore(clinical(0, 150, 0))).isEqualTo(0.3);
        assertThat(below.rawScore(clinical(0, 25, 0))).isEqualTo(0.0);
        assertThat(below.rawScore(clinical(0, 0, 0))).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void requiredFeaturesKeepDeclarationOrder() {
        ScoringRules rules = ScoringRules.builder()
                .flag("smoker", 0.1)
                .capped("bmi", 50, 0.2)
                .term("smoker", v -> v)
                .build();

        assertThat(rules.requiredFeatures()).containsExactly("smoker", "bmi");
    }

    @Test
    void verificationRejectsUndeclaredFeature() {
        SchemaEntry schema = new SchemaEntry(List.of(FieldSpec.decimal("bmi", "BMI", 50)));
        ScoringRules rules = ScoringRules.builder().capped("bmi", 50, 0.2).flag("smoker", 0.1).build();

        assertThatThrownBy(() -> rules.verifyAgainst("demo", schema))
                .isInstanceOf(ScoringConfigurationException.class)
                .hasMessageContaining("'smoker'");
        assertThatCode(() -> ScoringRules.builder().capped("bmi", 50, 0.2).build().verifyAgainst("demo", schema))
                .doesNotThrowAnyException();
    }

    @Test
    void emptyRulesAreRejected() {
        assertThatThrownBy(() -> ScoringRules.builder().build())
                .isInstanceOf(IllegalStateException.class);
    }
}
