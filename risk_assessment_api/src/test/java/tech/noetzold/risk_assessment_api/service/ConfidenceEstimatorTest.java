package tech.noetzold.risk_assessment_api.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.model.SchemaEntry;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceEstimatorTest {

    private final ConfidenceEstimator estimator = new ConfidenceEstimator();

    private final SchemaEntry schema = new SchemaEntry(List.of(
            FieldSpec.decimal("a", "A", 1),
            FieldSpec.decimal("b", "B", 1)));

    private TypedRecord record(Set<String> provided) {
        return new TypedRecord(schema, Map.of("a", 0.5, "b", 0.5), provided);
    }

    private static List<ContributingFactor> factors(int n) {
        ContributingFactor f = new ContributingFactor("a", "A", 1.0, 1.0, 0.5, Severity.SEVERE, "", "");
        return Collections.nCopies(n, f);
    }

    @Test
    void alwaysWithinFloorAndCeiling() {
        for (int i = 0; i <= 100; i++) {
            double score = i / 100.0;
            for (int n = 0; n <= 10; n++) {
                double c = estimator.estimate(record(Set.of("a")), schema, score, factors(n));
                assertThat(c).isBetween(ConfidenceEstimator.FLOOR, ConfidenceEstimator.CEILING);
            }
        }
    }

    @Test
    void midpointScoreWithFullInputAndSupportGivesBase() {
        double c = estimator.estimate(record(Set.of("a", "b")), schema, 0.5, factors(5));

        assertThat(c).isCloseTo(ConfidenceEstimator.BASE, within(1e-9));
    }

    @Test
    void extremeScoreWithNothingProvidedIsFloored() {
        double c = estimator.estimate(record(Set.of()), schema, 0.0, List.of());

        assertThat(c).isEqualTo(ConfidenceEstimator.FLOOR);
    }

    @Test
    void moreCompleteInputNeverLowersConfidence() {
        double partial = estimator.estimate(record(Set.of("a")), schema, 0.45, factors(3));
        double full = estimator.estimate(record(Set.of("a", "b")), schema, 0.45, factors(3));

        assertThat(full).isGreaterThanOrEqualTo(partial);
    }
}
