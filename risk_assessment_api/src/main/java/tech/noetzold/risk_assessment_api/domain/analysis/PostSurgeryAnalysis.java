package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class PostSurgeryAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        int asa = r.level("asa_score");
        if (asa >= 3) {
            factors.add(finding(r, "asa_score", "High ASA class", asa >= 4 ? Severity.SEVERE : Severity.MODERATE,
                    "ASA class " + asa + " indicates significant systemic disease before surgery.",
                    "Optimize chronic conditions and plan post-operative monitoring"));
        }
        if (r.flag("emergency_surgery")) {
            factors.add(finding(r, "emergency_surgery", "Emergency procedure", Severity.SEVERE,
                    "Emergency surgery leaves little time for pre-operative optimization.",
                    "Close post-operative surveillance for the first 72 hours"));
        }
        if (r.number("surgery_duration") > 240) {
            factors.add(finding(r, "surgery_duration", "Prolonged surgery", Severity.MODERATE,
                    "Procedure time " + r.display("surgery_duration") + " minutes exceeds 4 hours.",
                    "Thromboprophylaxis and pressure injury prevention"));
        }
        if (r.number("age") > 70) {
            factors.add(finding(r, "age", "Advanced age", Severity.MODERATE,
                    "Age " + r.display("age") + " raises the risk of delirium and slower healing.",
                    "Delirium screening and early mobilization"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        int points = riskPoints(r);
        Map<String, Object> surgical = new LinkedHashMap<>();
        surgical.put("points", points);
        surgical.put("surgical_risk", points >= 4 ? "high" : points >= 2 ? "moderate-high" : "moderate");
        surgical.put("recovery_outlook", points >= 3 ? "guarded" : "good");

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("surgical_assessment", surgical);
        metrics.put("asa_class", metric(r.get("asa_score"), "category",
                band(r.number("asa_score"), 2, 3, "low", "moderate", "high")));
        metrics.put("duration", metric(r.get("surgery_duration"), "category",
                band(r.number("surgery_duration"), 120, 240, "short", "standard", "prolonged")));
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        List<String> steps = new ArrayList<>(List.of("early mobilization", "effective pain management"));
        if (riskPoints(r) >= 3) {
            steps.add("close follow-up in the first weeks");
        }
        steps.add("wound care and infection prevention");
        return "Recovery can be improved through " + String.join(", ", steps) + ".";
    }

    static int riskPoints(TypedRecord r) {
        int points = 0;
        if (r.level("asa_score") >= 3) points += 2;
        if (r.flag("emergency_surgery")) points += 2;
        if (r.number("age") > 65) points++;
        if (r.number("surgery_duration") > 240) points++;
        return points;
    }
}
