package tech.noetzold.risk_assessment_api.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.model.SchemaEntry;
import tech.noetzold.risk_assessment_api.service.scoring.ScoringRules;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Construction verifies the scoring formula against the schema, so a mismatch fails at
 * startup rather than on the first request.
 */
@Getter
public final class DomainDefinition {

    private final String name;
    private final String displayName;
    private final String description;
    private final SchemaEntry schema;
    private final ScoringRules scoring;
    private final Map<String, String> explanations;
    private final Map<String, String> remediations;
    private final List<LifestyleRule> lifestyleRules;
    private final List<RadarAxis> radarAxes;
    private final FactorAnalysis analysis;

    @Builder
    private DomainDefinition(String name,
                             String displayName,
                             String description,
                             @Singular("field") List<FieldSpec> fields,
                             ScoringRules scoring,
                             @Singular("explanation") Map<String, String> explanations,
                             @Singular("remediation") Map<String, String> remediations,
                             @Singular("lifestyleRule") List<LifestyleRule> lifestyleRules,
                             @Singular("radarAxis") List<RadarAxis> radarAxes,
                             FactorAnalysis analysis) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("domain name is required");
        }
        this.name = name;
        this.displayName = displayName != null ? displayName : name;
        this.description = description != null ? description : "";
        this.schema = new SchemaEntry(fields);
        this.scoring = scoring;
        this.explanations = Map.copyOf(explanations);
        this.remediations = Map.copyOf(remediations);
        this.lifestyleRules = List.copyOf(lifestyleRules);
        this.radarAxes = List.copyOf(radarAxes);
        this.analysis = analysis;

        if (scoring != null) {
            scoring.verifyAgainst(name, schema);
        }
        for (String field : this.explanations.keySet()) {
            requireDeclared(field, "explanation");
        }
        for (String field : this.remediations.keySet()) {
            requireDeclared(field, "remediation");
        }
    }

    public Optional<ScoringRules> scoringRules() {
        return Optional.ofNullable(scoring);
    }

    public Optional<FactorAnalysis> factorAnalysis() {
        return Optional.ofNullable(analysis);
    }

    public boolean supportsFactorAnalysis() {
        return analysis != null;
    }

    public Map<String, Double> weights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (FieldSpec spec : schema.fields()) {
            if (spec.weight() != null) {
                weights.put(spec.name(), spec.weight());
            }
        }
        return weights;
    }

    public String explain(String field, String label, String displayValue) {
        String template = explanations.get(field);
        if (template == null) {
            return "The value " + displayValue + " for " + label + " contributes to the overall risk assessment.";
        }
        return template.replace("{value}", displayValue);
    }

    public String explainProtective(String label, String displayValue) {
        return "The value " + displayValue + " for " + label + " lowers the overall risk.";
    }

    public String remediate(String field, String label) {
        return remediations.getOrDefault(field, "Address the " + label.toLowerCase() + " to reduce risk.");
    }

    private void requireDeclared(String field, String what) {
        if (!schema.contains(field)) {
            throw new IllegalArgumentException(
                    "Domain '" + name + "' has an " + what + " for undeclared field '" + field + "'");
        }
    }
}
