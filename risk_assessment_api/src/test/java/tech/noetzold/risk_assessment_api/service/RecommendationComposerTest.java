package tech.noetzold.risk_assessment_api.service;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.domain.LifestyleRule;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.model.RiskLevel;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationComposerTest {

    private final RecommendationComposer composer = new RecommendationComposer();

    private static ContributingFactor factor(String field, String remediation) {
        return new ContributingFactor(field, field, 1, 1.0, 0.5, Severity.SEVERE, "", remediation);
    }

    @Nested
    class Compose {

        @Test
        void genericAdviceThenRemediationThenLifestyle() {
            List<String> out = composer.compose(RiskLevel.MODERATE,
                    List.of(factor("a", "Fix a"), factor("b", "Fix b")),
                    List.of("Walk daily"));

            List<String> expected = new ArrayList<>(RecommendationComposer.genericAdvice(RiskLevel.MODERATE));
            expected.addAll(List.of("Fix a", "Fix b", "Walk daily"));
            assertThat(out).containsExactlyElementsOf(expected);
        }

        @Test
        void onlyTopFiveFactorsAreRemediated() {
            List<ContributingFactor> factors = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                factors.add(factor("f" + i, "Fix " + i));
            }

            List<String> out = composer.compose(RiskLevel.LOW, factors, List.of());

            assertThat(out).contains("Fix 0", "Fix 4").doesNotContain("Fix 5", "Fix 6");
        }

        @Test
        void duplicatesAreSkippedKeepingFirstPosition() {
            List<String> out = composer.compose(RiskLevel.LOW,
                    List.of(factor("a", "Fix a"), factor("b", "Fix a")),
                    List.of("Maintain your current healthy lifestyle", "Fix a", "New advice"));

            assertThat(out).doesNotHaveDuplicates();
            assertThat(out.get(0)).isEqualTo("Maintain your current healthy lifestyle");
            assertThat(out).endsWith("Fix a", "New advice");
        }

        @Test
        void cappedAtFifteen() {
            List<String> notes = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                notes.add("Note " + i);
            }

            List<String> out = composer.compose(RiskLevel.HIGH, List.of(factor("a", "Fix a")), notes);

            assertThat(out).hasSize(RecommendationComposer.MAX_RECOMMENDATIONS);
            assertThat(out.get(4)).isEqualTo("Fix a");
        }

        @Test
        void blankRemediationIsIgnored() {
            List<String> out = composer.compose(RiskLevel.LOW, List.of(factor("a", " ")), List.of());

            assertThat(out).containsExactlyElementsOf(RecommendationComposer.genericAdvice(RiskLevel.LOW));
        }
    }

    @Nested
    class LifestyleNotes {

        private final DomainDefinition domain = DomainDefinition.builder()
                .name("lifestyle_test")
                .field(FieldSpec.flag("smoking", "Smoking"))
                .lifestyleRule(LifestyleRule.when(r -> r.flag("smoking"), "Quit smoking immediately"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Regular exercise and healthy diet"))
                .build();

        private TypedRecord record(boolean smoking) {
            return new RecordValidator().coerce(Map.of("smoking", smoking), domain.getSchema());
        }

        @Test
        void lowScoreGetsOnlyMatchingDomainRules() {
            List<String> notes = composer.lifestyleNotes(domain, record(false), 0.2, RiskLevel.LOW);

            assertThat(notes).containsExactly("Regular exercise and healthy diet");
        }

        @Test
        void scoreAboveHalfAddsGenericLifestyleAdvice() {
            List<String> notes = composer.lifestyleNotes(domain, record(true), 0.55, RiskLevel.MODERATE);

            assertThat(notes).hasSize(5);
            assertThat(notes.get(0)).isEqualTo("Quit smoking immediately");
        }

        @Test
        void elevatedLevelAddsMonitoringAdvice() {
            List<String> notes = composer.lifestyleNotes(domain, record(true), 0.9, RiskLevel.VERY_HIGH);

            assertThat(notes).hasSize(8)
                    .contains("Keep a health diary to track symptoms and improvements");
        }
    }
}
