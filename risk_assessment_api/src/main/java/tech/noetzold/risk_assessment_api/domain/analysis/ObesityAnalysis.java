package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ObesityAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double bmi = r.number("bmi");
        if (bmi >= 30) {
            factors.add(finding(r, "bmi", "Obesity", bmi >= 40 ? Severity.CRITICAL : Severity.SEVERE,
                    "Current BMI indicates obesity (≥30)", "Structured weight-loss program with medical supervision"));
        } else if (bmi >= 25) {
            factors.add(finding(r, "bmi", "Overweight", Severity.MODERATE,
                    "Current BMI indicates overweight (25-29.9)", "Balanced diet with portion control"));
        }
        if (r.level("activity_level") <= 1) {
            factors.add(finding(r, "activity_level", "Low physical activity", Severity.MODERATE,
                    "Low physical activity level", "Regular physical activity (150 min/week)"));
        }
        if (r.number("sedentary_hours") >= 8) {
            factors.add(finding(r, "sedentary_hours", "Excessive sedentary time", Severity.MODERATE,
                    "Excessive sedentary time (≥8 hours/day)", "Break up sitting time with short walks every hour"));
        }
        if (r.number("daily_calories") > 2500) {
            factors.add(finding(r, "daily_calories", "High caloric intake", Severity.MILD,
                    "High daily caloric intake", "Calorie awareness and portion control"));
        }
        if (r.flag("family_history_obesity")) {
            factors.add(finding(r, "family_history_obesity", "Family history of obesity", Severity.MILD,
                    "Family history of obesity", "Early and consistent weight monitoring"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("bmi", metric(r.get("bmi"), "category", bmiCategory(r.number("bmi"))));
        metrics.put("activity", metric(r.display("activity_level"), "sedentary_hours", r.display("sedentary_hours")));
        metrics.put("energy_balance", metric(r.get("daily_calories"), "status",
                r.number("daily_calories") > 2500 ? "Surplus likely" : "Within typical needs"));
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        boolean inactive = r.level("activity_level") < 3;
        boolean sedentary = r.number("sedentary_hours") >= 8;
        if (!inactive && !sedentary) {
            return "Activity habits support a healthy weight. Keep activity level and sitting time where they are.";
        }
        List<String> levers = new ArrayList<>();
        if (inactive) levers.add("raising activity to at least 150 minutes per week");
        if (sedentary) levers.add("cutting daily sitting time below 8 hours");
        return "Weight risk is driven by daily habits. Main levers: " + String.join(" and ", levers) + ".";
    }

    static String bmiCategory(double bmi) {
        if (bmi < 18.5) return "Underweight";
        if (bmi < 25) return "Normal";
        if (bmi < 30) return "Overweight";
        return "Obese";
    }
}
