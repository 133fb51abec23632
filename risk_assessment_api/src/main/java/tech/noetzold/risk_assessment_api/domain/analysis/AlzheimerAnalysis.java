package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// MMSE: 24-30 normal, 18-23 mild impairment, below 18 dementia
public class AlzheimerAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        int mmse = r.level("cognitive_score");
        if (mmse < 24) {
            factors.add(finding(r, "cognitive_score", "Cognitive impairment",
                    mmse < 18 ? Severity.SEVERE : mmse < 21 ? Severity.MODERATE : Severity.MILD,
                    "MMSE score " + mmse + "/30 is below the normal range of 24-30.",
                    "Neurology referral for a full cognitive work-up"));
        }
        double age = r.number("age");
        if (age > 65) {
            factors.add(finding(r, "age", "Advanced age", age > 75 ? Severity.SEVERE : Severity.MODERATE,
                    "Dementia risk roughly doubles every 5 years after 65.",
                    "Annual cognitive screening"));
        }
        if (r.flag("family_history")) {
            factors.add(finding(r, "family_history", "Family history of dementia", Severity.MODERATE,
                    "A first-degree relative with Alzheimer's increases risk about 2.5 times.",
                    "Discuss genetic risk with a specialist"));
        }
        if (r.number("education_years") < 12) {
            factors.add(finding(r, "education_years", "Low cognitive reserve", Severity.MILD,
                    r.display("education_years") + " years of education provides less cognitive reserve.",
                    "Lifelong learning and cognitive stimulation"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        int mmse = r.level("cognitive_score");
        double education = r.number("education_years");
        Map<String, Object> cognitive = new LinkedHashMap<>();
        cognitive.put("mmse_score", metric(r.get("cognitive_score"), "interpretation",
                mmse >= 24 ? "Normal cognition" : mmse >= 18 ? "Mild cognitive impairment" : "Dementia range"));
        cognitive.put("cognitive_reserve", metric(r.get("education_years"), "interpretation",
                education >= 16 ? "High" : education >= 12 ? "Moderate" : "Low"));

        Map<String, Object> risk = new LinkedHashMap<>();
        risk.put("age_risk", metric(r.get("age"), "risk_level", band(r.number("age"), 65, 75, "low", "moderate", "high")));
        risk.put("family_history_multiplier", r.flag("family_history") ? 2.5 : 1.0);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("cognitive_assessment", cognitive);
        metrics.put("risk_factors", risk);
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        List<String> actions = new ArrayList<>(List.of("regular physical activity (reduces dementia risk by about 30%)",
                "social engagement"));
        if (r.number("education_years") < 12) {
            actions.add("lifelong learning and cognitive stimulation");
        }
        return "Modifiable factors can lower dementia risk. Focus on " + String.join(", ", actions) + ".";
    }
}
