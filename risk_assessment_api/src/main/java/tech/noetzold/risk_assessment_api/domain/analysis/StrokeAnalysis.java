package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class StrokeAnalysis extends ClinicalAnalysis {

    private static final int CURRENT_SMOKER = 2;
    private static final int HEAVY_DRINKER = 3;
    private static final int SEDENTARY = 0;

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double age = r.number("age");
        if (age > 75) {
            factors.add(finding(r, "age", "Advanced age", Severity.SEVERE,
                    "Age over 75 significantly increases stroke risk.", "Regular vascular check-ups"));
        } else if (age > 55) {
            factors.add(finding(r, "age", "Older age", Severity.MODERATE,
                    "Age 55-75 is a major stroke risk factor.", "Regular vascular check-ups"));
        }
        if (r.flag("hypertension")) {
            factors.add(finding(r, "hypertension", "Hypertension", Severity.SEVERE,
                    "Hypertension is the leading modifiable risk factor for stroke.",
                    "Blood pressure control to below 130/80 mmHg"));
        }
        if (r.flag("heart_disease")) {
            factors.add(finding(r, "heart_disease", "Heart disease", Severity.SEVERE,
                    "Existing heart disease significantly increases stroke risk.",
                    "Cardiology follow-up and anticoagulation review"));
        }
        double glucose = r.number("avg_glucose_level");
        if (glucose > 140) {
            factors.add(finding(r, "avg_glucose_level", "Elevated glucose", Severity.MODERATE,
                    "Average glucose " + r.display("avg_glucose_level") + " mg/dL indicates diabetes risk.",
                    "Glucose control through diet, exercise, and medication review"));
        } else if (glucose > 100) {
            factors.add(finding(r, "avg_glucose_level", "Borderline glucose", Severity.MILD,
                    "Average glucose " + r.display("avg_glucose_level") + " mg/dL requires monitoring.",
                    "Recheck fasting glucose"));
        }
        double bmi = r.number("bmi");
        if (bmi > 30) {
            factors.add(finding(r, "bmi", "Obesity", Severity.MODERATE,
                    "BMI " + r.display("bmi") + " increases stroke risk through multiple pathways.",
                    "Weight reduction through diet and exercise"));
        } else if (bmi > 25) {
            factors.add(finding(r, "bmi", "Overweight", Severity.MILD,
                    "BMI " + r.display("bmi") + " contributes to stroke risk.", "Weight management"));
        }
        if (r.level("smoking_status") == CURRENT_SMOKER) {
            factors.add(finding(r, "smoking_status", "Current smoking", Severity.SEVERE,
                    "Current smoking dramatically increases stroke risk.",
                    "Smoking cessation program and nicotine replacement therapy"));
        } else if (r.level("smoking_status") == 1) {
            factors.add(finding(r, "smoking_status", "Former smoking", Severity.MILD,
                    "Former smoking still carries residual stroke risk.", "Stay smoke-free"));
        }
        if (r.level("alcohol_consumption") == HEAVY_DRINKER) {
            factors.add(finding(r, "alcohol_consumption", "Heavy alcohol use", Severity.MODERATE,
                    "Heavy alcohol consumption increases hemorrhagic stroke risk.", "Limit alcohol to at most one drink per day"));
        }
        if (r.level("physical_activity") == SEDENTARY) {
            factors.add(finding(r, "physical_activity", "Sedentary lifestyle", Severity.MODERATE,
                    "A sedentary lifestyle significantly increases stroke risk.",
                    "Increase physical activity to 150 minutes of moderate exercise weekly"));
        }
        if (r.flag("family_history_stroke")) {
            factors.add(finding(r, "family_history_stroke", "Family history of stroke", Severity.MILD,
                    "A family history of stroke indicates genetic predisposition.", "Discuss family history with your physician"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double glucose = r.number("avg_glucose_level");
        int smoking = r.level("smoking_status");
        int activity = r.level("physical_activity");

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("blood_pressure", r.flag("hypertension")
                ? "Hypertensive (major stroke risk factor requiring control)"
                : "Normal (protective against stroke)");
        metrics.put("blood_glucose", metric(r.get("avg_glucose_level"), "category",
                glucose < 100 ? "Normal" : glucose < 126 ? "Prediabetic range" : "Diabetic range"));
        metrics.put("bmi", metric(r.get("bmi"), "category", ObesityAnalysis.bmiCategory(r.number("bmi"))));
        metrics.put("smoking_status", switch (smoking) {
            case 0 -> "Never smoked (protective factor)";
            case 1 -> "Former smoker (risk decreases over time)";
            case CURRENT_SMOKER -> "Current smoker (major modifiable risk factor)";
            default -> "Unknown smoking history";
        });
        metrics.put("physical_activity", switch (activity) {
            case SEDENTARY -> "Sedentary (significant stroke risk)";
            case 1 -> "Light activity (some protective benefit)";
            case 2 -> "Moderate activity (good stroke protection)";
            default -> "Vigorous activity (excellent stroke protection)";
        });
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        List<String> changes = new ArrayList<>();
        if (r.level("smoking_status") == CURRENT_SMOKER) {
            changes.add("smoking cessation (can reduce risk by 50% within 2 years)");
        }
        if (r.level("physical_activity") == SEDENTARY) {
            changes.add("regular physical activity (30 minutes daily can reduce risk by 25%)");
        }
        if (r.number("bmi") > 25) {
            changes.add("weight management");
        }
        if (r.level("alcohol_consumption") == HEAVY_DRINKER) {
            changes.add("alcohol moderation (limiting to 1-2 drinks daily)");
        }
        if (r.number("avg_glucose_level") > 100) {
            changes.add("blood sugar control through diet and exercise");
        }
        if (changes.isEmpty()) {
            return "Your lifestyle choices support stroke prevention. Continue regular exercise, a healthy diet, and blood pressure checks.";
        }
        return "Lifestyle modifications can reduce stroke risk by up to 80%. Key areas: " + String.join(", ", changes) + ".";
    }
}
