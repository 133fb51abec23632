package tech.noetzold.risk_assessment_api.service.scoring;

import tech.noetzold.risk_assessment_api.exception.ScoringConfigurationException;
import tech.noetzold.risk_assessment_api.model.FeatureVector;
import tech.noetzold.risk_assessment_api.model.SchemaEntry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

public final class ScoringRules implements ScoringStrategy {

    private final List<Term> terms;

    private ScoringRules(List<Term> terms) {
        this.terms = List.copyOf(terms);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public double rawScore(FeatureVector vector) {
        double score = 0.0;
        for (Term term : terms) {
            if (!vector.has(term.feature())) {
                throw new ScoringConfigurationException(
                        "Scoring formula references feature '" + term.feature() + "' missing from vector " + vector.names());
            }
            score += term.contribution().applyAsDouble(vector.clinical(term.feature()));
        }
        return score;
    }

    @Override
    public String name() {
        return "formula";
    }

    public Set<String> requiredFeatures() {
        Set<String> features = new LinkedHashSet<>();
        terms.forEach(t -> features.add(t.feature()));
        return features;
    }

    public void verifyAgainst(String domain, SchemaEntry schema) {
        for (String feature : requiredFeatures()) {
            if (!schema.contains(feature)) {
                throw new ScoringConfigurationException(
                        "Domain '" + domain + "' scores on '" + feature + "' which its schema does not declare");
            }
        }
    }

    public record Term(String feature, DoubleUnaryOperator contribution) {}

    public static final class Builder {
        private final List<Term> terms = new ArrayList<>();

        public Builder term(String feature, DoubleUnaryOperator contribution) {
            terms.add(new Term(feature, contribution));
            return this;
        }

        public Builder flag(String feature, double points) {
            return term(feature, v -> v != 0.0 ? points : 0.0);
        }

        public Builder capped(String feature, double divisor, double cap) {
            return term(feature, v -> Math.min(v / divisor, cap));
        }

        public Builder above(String feature, double threshold, double span, double weight) {
            return term(feature, v -> Math.max(0.0, (v - threshold) / span) * weight);
        }

        public Builder below(String feature, double threshold, double span, double weight) {
            return term(feature, v -> Math.max(0.0, (threshold - v) / span) * weight);
        }

        // last entry applies to higher levels
        public Builder levels(String feature, double... pointsByLevel) {
            double[] table = pointsByLevel.clone();
            return term(feature, v -> table[(int) Math.max(0, Math.min(v, table.length - 1))]);
        }

        public ScoringRules build() {
            if (terms.isEmpty()) {
                throw new IllegalStateException("scoring rules need at least one term");
            }
            return new ScoringRules(terms);
        }
    }
}
