package tech.noetzold.risk_assessment_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.FeatureVector;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * {@code contribution = |normalized - 0.5| * 2 * weight}, ties broken by schema order.
 * Fields sitting on their low-risk side are explained as protective and get no remediation.
 */
@Component
public class FactorRanker {

    public static final double DEFAULT_WEIGHT = 0.5;
    public static final double SIGNIFICANCE_THRESHOLD = 0.1;
    public static final int MAX_FACTORS = 10;

    private static final Comparator<Ranked> ORDER = Comparator
            .comparingDouble((Ranked r) -> r.factor().contribution_score()).reversed()
            .thenComparingInt(Ranked::schemaIndex);

    public List<ContributingFactor> rank(DomainDefinition domain, TypedRecord typed, FeatureVector vector) {
        Map<String, Double> weights = domain.weights();
        List<Ranked> significant = new ArrayList<>();

        List<FieldSpec> specs = domain.getSchema().fields();
        for (int i = 0; i < specs.size(); i++) {
            FieldSpec spec = specs.get(i);
            double normalized = vector.normalized(i);
            double weight = weights.getOrDefault(spec.name(), DEFAULT_WEIGHT);
            double contribution = Math.abs(normalized - 0.5) * 2.0 * weight;
            if (contribution <= SIGNIFICANCE_THRESHOLD) {
                continue;
            }
            String display = typed.display(spec.name());
            boolean risky = spec.raisesRisk(normalized);
            significant.add(new Ranked(i, new ContributingFactor(
                    spec.name(),
                    spec.description(),
                    typed.get(spec.name()),
                    normalized,
                    contribution,
                    Severity.of(contribution),
                    risky ? domain.explain(spec.name(), spec.description(), display)
                            : domain.explainProtective(spec.description(), display),
                    risky ? domain.remediate(spec.name(), spec.description()) : null
            )));
        }

        significant.sort(ORDER);
        return significant.stream()
                .limit(MAX_FACTORS)
                .map(Ranked::factor)
                .toList();
    }

    private record Ranked(int schemaIndex, ContributingFactor factor) {}
}
