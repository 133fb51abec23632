package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CancerDetectionAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double age = r.number("age");
        if (age > 65) {
            factors.add(finding(r, "age", "Advanced age", Severity.MODERATE,
                    "Age " + r.display("age") + " significantly increases cancer risk.",
                    "Age-appropriate cancer screening"));
        } else if (age > 50) {
            factors.add(finding(r, "age", "Mature age", Severity.MILD,
                    "Age " + r.display("age") + " moderately increases cancer risk.",
                    "Start routine screening programs"));
        }
        double smokingYears = r.number("smoking_years");
        if (smokingYears >= 20) {
            factors.add(finding(r, "smoking_years", "Heavy smoking history", Severity.SEVERE,
                    r.display("smoking_years") + " years of smoking is a major risk for lung and multiple other cancers.",
                    "Smoking cessation and low-dose CT lung screening"));
        } else if (smokingYears >= 10) {
            factors.add(finding(r, "smoking_years", "Moderate smoking history", Severity.MODERATE,
                    "Smoking history of " + r.display("smoking_years") + " years elevates cancer risk.",
                    "Smoking cessation program"));
        }
        if (r.flag("family_history")) {
            factors.add(finding(r, "family_history", "Family history of cancer", Severity.MODERATE,
                    "A family history of cancer points to a genetic predisposition.",
                    "Genetic counseling"));
        }
        int symptoms = r.level("symptoms_count");
        if (symptoms >= 3) {
            factors.add(finding(r, "symptoms_count", "Multiple warning symptoms", symptoms >= 5 ? Severity.SEVERE : Severity.MODERATE,
                    symptoms + " warning symptoms reported.",
                    "Prompt diagnostic evaluation of reported symptoms"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double smokingYears = r.number("smoking_years");
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("age_risk", metric(r.get("age"), "risk_level", band(r.number("age"), 50, 65, "low", "moderate", "high")));
        metrics.put("smoking_status", metric(r.get("smoking_years"), "category",
                smokingYears == 0 ? "Never smoked (protective factor)"
                        : smokingYears < 10 ? "Light smoking history (low-moderate risk)"
                        : smokingYears < 20 ? "Moderate smoking history (significant risk)"
                        : "Heavy smoking history (major cancer risk factor)"));
        metrics.put("symptom_burden", metric(r.get("symptoms_count"), "category",
                band(r.number("symptoms_count"), 0, 2, "none", "some", "multiple")));
        metrics.put("genetic_risk", r.flag("family_history") ? "elevated" : "baseline");
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        List<String> changes = new ArrayList<>();
        if (r.number("smoking_years") >= 10) {
            changes.add("smoking cessation (can reduce risk by 50% within 5 years)");
        }
        changes.add("regular physical activity (can reduce risk by 20-30%)");
        changes.add("a diet rich in fruits, vegetables and whole grains");
        return "Lifestyle changes can reduce cancer risk by 30-50%. Key areas: " + String.join(", ", changes) + ".";
    }
}
