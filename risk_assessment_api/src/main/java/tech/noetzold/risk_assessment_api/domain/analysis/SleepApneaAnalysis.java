package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SleepApneaAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        if (r.flag("loud_snoring")) {
            factors.add(finding(r, "loud_snoring", "Loud snoring", Severity.MODERATE,
                    "Loud snoring reported", "Sleep study evaluation"));
        }
        if (r.flag("daytime_sleepiness")) {
            factors.add(finding(r, "daytime_sleepiness", "Daytime sleepiness", Severity.MODERATE,
                    "Excessive daytime sleepiness reported", "Sleep study evaluation"));
        }
        if (r.number("bmi") > 35) {
            factors.add(finding(r, "bmi", "BMI over 35", Severity.SEVERE,
                    "BMI " + r.display("bmi") + " strongly predicts obstructive sleep apnea", "Weight management if overweight"));
        } else if (r.number("bmi") >= 30) {
            factors.add(finding(r, "bmi", "Obesity", Severity.MODERATE,
                    "BMI " + r.display("bmi") + " indicates obesity", "Weight management if overweight"));
        }
        if (r.number("neck_circumference") > 16) {
            factors.add(finding(r, "neck_circumference", "Large neck circumference", Severity.MODERATE,
                    "Neck circumference " + r.display("neck_circumference") + " in exceeds 16 in", "ENT evaluation of the upper airway"));
        }
        if (r.number("age") > 50) {
            factors.add(finding(r, "age", "Age over 50", Severity.MILD,
                    "Airway muscle tone decreases with age", "Discuss sleep symptoms at routine check-ups"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        int points = stopBangPoints(r);
        Map<String, Object> screening = new LinkedHashMap<>();
        screening.put("points", points);
        screening.put("max_points", 5);
        screening.put("risk_category", points >= 3 ? "High" : points == 2 ? "Intermediate" : "Low");

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("screening", screening);
        metrics.put("bmi", metric(r.get("bmi"), "category", ObesityAnalysis.bmiCategory(r.number("bmi"))));
        metrics.put("neck_circumference", metric(r.get("neck_circumference"), "category",
                r.number("neck_circumference") > 16 ? "Enlarged" : "Normal"));
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        if (r.number("bmi") >= 25) {
            return "Excess weight is the main modifiable driver of sleep apnea. A 10% weight loss can reduce apnea severity by about 25%. Avoid alcohol and sedatives before bedtime.";
        }
        return "Weight is not a major driver here. Good sleep hygiene and sleeping on your side can reduce snoring and airway collapse.";
    }

    static int stopBangPoints(TypedRecord r) {
        int points = 0;
        if (r.flag("loud_snoring")) points++;
        if (r.flag("daytime_sleepiness")) points++;
        if (r.number("bmi") > 35) points++;
        if (r.number("age") > 50) points++;
        if (r.number("neck_circumference") > 16) points++;
        return points;
    }
}
