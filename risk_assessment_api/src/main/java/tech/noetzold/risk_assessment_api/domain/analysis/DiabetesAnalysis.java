package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DiabetesAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double glucose = r.number("glucose_level");
        if (glucose >= 126) {
            factors.add(finding(r, "glucose_level", "Diabetic fasting glucose", glucose >= 180 ? Severity.SEVERE : Severity.MODERATE,
                    "Fasting glucose " + r.display("glucose_level") + " mg/dL is in the diabetic range (≥126).",
                    "Confirm with HbA1c and start a treatment plan"));
        } else if (glucose >= 100) {
            factors.add(finding(r, "glucose_level", "Prediabetic fasting glucose", Severity.MILD,
                    "Fasting glucose " + r.display("glucose_level") + " mg/dL indicates prediabetes (100-125).",
                    "Diet changes and glucose recheck in 6 months"));
        }
        double bmi = r.number("bmi");
        if (bmi >= 30) {
            factors.add(finding(r, "bmi", "Obesity", Severity.MODERATE,
                    "BMI " + r.display("bmi") + " drives insulin resistance.",
                    "Weight reduction of 5-7% of body weight"));
        } else if (bmi >= 25) {
            factors.add(finding(r, "bmi", "Overweight", Severity.MILD,
                    "BMI " + r.display("bmi") + " is above the healthy range.",
                    "Balanced diet with portion control"));
        }
        if (r.flag("family_history_diabetes")) {
            factors.add(finding(r, "family_history_diabetes", "Family history of diabetes", Severity.MODERATE,
                    "A family history of diabetes doubles the risk of type 2 diabetes.",
                    "Annual glucose screening"));
        }
        if (r.number("physical_activity") < 2.5) {
            factors.add(finding(r, "physical_activity", "Low physical activity", Severity.MILD,
                    r.display("physical_activity") + " hours of activity per week is below the 150 minute target.",
                    "Build up to 150 minutes of moderate activity weekly"));
        }
        if (r.number("age") > 45) {
            factors.add(finding(r, "age", "Age over 45", Severity.MILD,
                    "Type 2 diabetes risk rises after 45.",
                    "Screen for diabetes every 3 years"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double glucose = r.number("glucose_level");
        Map<String, Object> glycemic = new LinkedHashMap<>();
        glycemic.put("fasting_glucose", metric(r.get("glucose_level"), "category",
                glucose >= 126 ? "Diabetic" : glucose >= 100 ? "Prediabetic" : "Normal"));
        glycemic.put("insulin", metric(r.get("insulin_level"), "category",
                band(r.number("insulin_level"), 25, 100, "normal", "elevated", "high")));

        Map<String, Object> metabolic = new LinkedHashMap<>();
        metabolic.put("bmi", metric(r.get("bmi"), "category", ObesityAnalysis.bmiCategory(r.number("bmi"))));
        metabolic.put("diastolic_bp", metric(r.get("blood_pressure"), "category",
                band(r.number("blood_pressure"), 80, 90, "normal", "elevated", "hypertensive")));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("glycemic_control", glycemic);
        metrics.put("metabolic_profile", metabolic);
        metrics.put("hereditary_risk", metric(r.get("diabetes_pedigree_function"), "category",
                band(r.number("diabetes_pedigree_function"), 0.5, 1.0, "low", "moderate", "high")));
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        List<String> changes = new ArrayList<>();
        if (r.number("bmi") >= 25) {
            changes.add("weight loss (5-7% of body weight reduces diabetes risk by 58%)");
        }
        if (r.number("physical_activity") < 2.5) {
            changes.add("150 minutes of moderate activity per week");
        }
        if (r.number("glucose_level") >= 100) {
            changes.add("fewer refined carbohydrates and sugary drinks");
        }
        if (changes.isEmpty()) {
            return "No major modifiable diabetes drivers found. Keep the current habits and screen regularly.";
        }
        return "Lifestyle changes are the most effective diabetes prevention. Priorities: " + String.join(", ", changes) + ".";
    }
}
