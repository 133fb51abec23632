package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class HypertensionAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double systolic = r.number("systolic_bp");
        double diastolic = r.number("diastolic_bp");

        if (systolic >= 140 || diastolic >= 90) {
            factors.add(finding(r, "systolic_bp", "Hypertensive blood pressure",
                    systolic >= 180 || diastolic >= 120 ? Severity.CRITICAL : Severity.SEVERE,
                    "Current blood pressure indicates hypertension (≥140/90 mmHg)",
                    "Blood pressure treatment plan with your physician"));
        } else if (systolic >= 130 || diastolic >= 80) {
            factors.add(finding(r, "systolic_bp", "Elevated blood pressure", Severity.MODERATE,
                    "Elevated blood pressure (Stage 1 hypertension range)",
                    "Home blood pressure monitoring and lifestyle changes"));
        }
        if (r.number("sodium_intake_mg") > 2300) {
            factors.add(finding(r, "sodium_intake_mg", "High sodium intake", Severity.MODERATE,
                    "High sodium intake (>2300mg/day)",
                    "Reduce sodium intake (<2300mg/day)"));
        }
        if (r.flag("family_history")) {
            factors.add(finding(r, "family_history", "Family history of hypertension", Severity.MILD,
                    "Family history of hypertension",
                    "Annual blood pressure screening"));
        }
        if (r.number("age") >= 60) {
            factors.add(finding(r, "age", "Age-related arterial stiffening", Severity.MILD,
                    "Arterial stiffness increases with age and raises systolic pressure",
                    "Regular blood pressure checks"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double systolic = r.number("systolic_bp");
        double diastolic = r.number("diastolic_bp");

        Map<String, Object> bloodPressure = new LinkedHashMap<>();
        bloodPressure.put("systolic", r.get("systolic_bp"));
        bloodPressure.put("diastolic", r.get("diastolic_bp"));
        bloodPressure.put("category", category(systolic, diastolic));
        bloodPressure.put("risk_level", systolic >= 140 || diastolic >= 90 ? "High"
                : systolic >= 130 || diastolic >= 80 ? "Moderate" : "Low");

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("blood_pressure", bloodPressure);
        metrics.put("sodium_intake", metric(r.get("sodium_intake_mg"), "level", sodiumLevel(r.number("sodium_intake_mg"))));
        metrics.put("risk_points", riskPoints(r));
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        double sodium = r.number("sodium_intake_mg");
        StringBuilder impact = new StringBuilder("Sodium intake is ")
                .append(sodiumLevel(sodium).toLowerCase())
                .append('.');
        if (sodium > 2300) {
            impact.append(" Cutting sodium below 2300 mg/day typically lowers systolic pressure by 5-6 mmHg.");
        }
        if (r.number("systolic_bp") >= 130) {
            impact.append(" Regular aerobic exercise can lower blood pressure by 5-10 mmHg.");
        } else {
            impact.append(" Current blood pressure is in a healthy range; keep up regular activity.");
        }
        return impact.toString();
    }

    static String category(double systolic, double diastolic) {
        if (systolic < 120 && diastolic < 80) return "Normal";
        if (systolic < 130 && diastolic < 80) return "Elevated";
        if (systolic < 140 && diastolic < 90) return "Stage 1 Hypertension";
        return "Stage 2 Hypertension";
    }

    private static String sodiumLevel(double sodium) {
        return sodium > 2300 ? "High" : sodium > 1500 ? "Moderate" : "Low";
    }

    private static int riskPoints(TypedRecord r) {
        int points = 0;
        points += r.flag("family_history") ? 2 : 0;
        points += r.number("sodium_intake_mg") > 2300 ? 1 : 0;
        points += r.number("age") >= 60 ? 1 : 0;
        points += r.number("systolic_bp") >= 130 ? 2 : 0;
        points += r.number("diastolic_bp") >= 80 ? 1 : 0;
        return Math.min(10, points);
    }
}
