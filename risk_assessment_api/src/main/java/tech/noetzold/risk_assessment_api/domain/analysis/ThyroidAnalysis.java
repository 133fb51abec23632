package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ThyroidAnalysis extends ClinicalAnalysis {

    private static final int FEMALE = 0;

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        if (r.flag("autoimmune_disease")) {
            factors.add(finding(r, "autoimmune_disease", "Autoimmune disease", Severity.MODERATE,
                    "Autoimmune conditions often coexist with Hashimoto's or Graves' disease.",
                    "TSH and anti-TPO antibody testing"));
        }
        if (r.flag("family_history_thyroid")) {
            factors.add(finding(r, "family_history_thyroid", "Family history", Severity.MODERATE,
                    "Family history increases thyroid disorder risk.",
                    "Periodic thyroid function tests"));
        }
        if (r.level("gender") == FEMALE) {
            factors.add(finding(r, "gender", "Female sex", Severity.MILD,
                    "Women are 5-8 times more likely to develop thyroid disorders.",
                    "Thyroid check during routine care"));
        }
        if (r.number("age") > 60) {
            factors.add(finding(r, "age", "Advanced age", Severity.MILD,
                    "Thyroid disorders are more common with age.",
                    "TSH screening every few years"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        int points = riskPoints(r);
        Map<String, Object> overall = new LinkedHashMap<>();
        overall.put("points", points);
        overall.put("category", points >= 4 ? "High risk" : points >= 2 ? "Moderate risk" : "Low risk");

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("autoimmune_markers", r.flag("autoimmune_disease") ? "Autoimmune history present" : "No autoimmune history");
        metrics.put("age_risk", metric(r.get("age"), "risk_level", band(r.number("age"), 40, 60, "low", "moderate", "high")));
        metrics.put("sex", r.display("gender"));
        metrics.put("overall_risk", overall);
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        if (riskPoints(r) >= 2) {
            return "Ensure adequate iodine intake and manage stress. Regular thyroid function tests catch changes early.";
        }
        return "Thyroid risk is low. A balanced diet with adequate iodine supports normal thyroid function.";
    }

    static int riskPoints(TypedRecord r) {
        int points = 0;
        if (r.flag("autoimmune_disease")) points += 2;
        if (r.flag("family_history_thyroid")) points += 2;
        if (r.level("gender") == FEMALE) points++;
        if (r.number("age") > 60) points++;
        return points;
    }
}
