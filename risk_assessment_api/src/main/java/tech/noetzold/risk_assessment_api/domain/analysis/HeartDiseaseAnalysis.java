package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class HeartDiseaseAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        int age = (int) r.number("age");
        double cholesterol = r.number("cholesterol");
        double bp = r.number("systolic_bp");

        if (age > 65) {
            factors.add(finding(r, "age", "Advanced age", age > 75 ? Severity.SEVERE : Severity.MODERATE,
                    "Age " + age + " significantly increases cardiovascular risk. Risk doubles every decade after 55.",
                    "Enhanced cardiovascular monitoring and preventive medications as appropriate"));
        } else if (age > 45) {
            factors.add(finding(r, "age", "Mature age", Severity.MODERATE,
                    "Age " + age + " represents moderate cardiovascular risk increase.",
                    "Regular cardiovascular check-ups"));
        }

        if (cholesterol > 240) {
            factors.add(finding(r, "cholesterol", "High cholesterol", cholesterol > 300 ? Severity.SEVERE : Severity.MODERATE,
                    "Total cholesterol " + r.display("cholesterol") + " mg/dL is significantly elevated (normal <200). Increases heart attack risk by 2-3x.",
                    "Statin therapy consideration and dietary changes"));
        } else if (cholesterol > 200) {
            factors.add(finding(r, "cholesterol", "Borderline high cholesterol", Severity.MILD,
                    "Cholesterol " + r.display("cholesterol") + " mg/dL is borderline high. Lifestyle changes recommended.",
                    "Reduce saturated fat and recheck lipids in 6 months"));
        }

        if (bp > 140) {
            factors.add(finding(r, "systolic_bp", "Hypertension", bp > 180 ? Severity.SEVERE : Severity.MODERATE,
                    "Systolic BP " + r.display("systolic_bp") + " mmHg indicates hypertension. Each 20 mmHg increase doubles heart disease risk.",
                    "Blood pressure treatment plan with your physician"));
        } else if (bp > 120) {
            factors.add(finding(r, "systolic_bp", "Elevated blood pressure", Severity.MILD,
                    "BP " + r.display("systolic_bp") + " mmHg is elevated (normal <120). Early intervention recommended.",
                    "DASH diet and regular blood pressure checks"));
        }

        if (r.flag("smoking")) {
            factors.add(finding(r, "smoking", "Current smoking", Severity.SEVERE,
                    "Smoking increases heart disease risk by 2-4x and accelerates atherosclerosis.",
                    "URGENT: Smoking cessation program, nicotine replacement therapy, and behavioral counseling"));
        }
        if (r.flag("diabetes")) {
            factors.add(finding(r, "diabetes", "Diabetes mellitus", Severity.SEVERE,
                    "Diabetes increases heart disease risk by 2-4x through accelerated atherosclerosis.",
                    "Optimal glycemic control (HbA1c <7%)"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double age = r.number("age");
        double cholesterol = r.number("cholesterol");
        double bp = r.number("systolic_bp");

        Map<String, Object> assessment = new LinkedHashMap<>();
        assessment.put("age_risk", metric(r.get("age"), "risk_level", band(age, 45, 65, "low", "moderate", "high")));
        assessment.put("cholesterol_status", metric(r.get("cholesterol"), "category",
                band(cholesterol, 200, 240, "normal", "borderline", "high")));
        assessment.put("blood_pressure", metric(r.get("systolic_bp"), "category",
                band(bp, 120, 140, "normal", "elevated", "hypertensive")));

        Map<String, Object> modifiable = new LinkedHashMap<>();
        modifiable.put("smoking", r.flag("smoking"));
        modifiable.put("diabetes", r.flag("diabetes"));
        Map<String, Object> riskFactors = new LinkedHashMap<>();
        riskFactors.put("modifiable", modifiable);
        riskFactors.put("non_modifiable", Map.of("age", r.get("age")));

        double framingham = framinghamEquivalent(r);
        Map<String, Object> stratification = new LinkedHashMap<>();
        stratification.put("framingham_equivalent", framingham);
        stratification.put("risk_category", framingham < 0.1 ? "Low" : framingham < 0.2 ? "Intermediate" : "High");

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("cardiovascular_assessment", assessment);
        metrics.put("risk_factors", riskFactors);
        metrics.put("risk_stratification", stratification);
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        List<String> interventions = new ArrayList<>();
        if (r.flag("smoking")) {
            interventions.add("smoking cessation (can reduce risk by 50% within 1 year)");
        }
        if (r.number("cholesterol") > 200) {
            interventions.add("dietary modifications and possible statin therapy (can reduce risk by 25-35%)");
        }
        if (r.number("systolic_bp") > 120) {
            interventions.add("blood pressure management through diet, exercise, and medication (can reduce risk by 20-25%)");
        }
        if (r.flag("diabetes")) {
            interventions.add("optimal diabetes control (HbA1c <7% can reduce cardiovascular events by 10%)");
        }
        if (interventions.isEmpty()) {
            return "Your current risk factors are well-controlled. Continue heart-healthy lifestyle: regular exercise, balanced diet, no smoking, and stress management.";
        }
        return "Your lifestyle significantly impacts heart disease risk. Key interventions: "
                + String.join(", ", interventions)
                + ". Combined lifestyle changes can reduce risk by up to 80%.";
    }

    static double framinghamEquivalent(TypedRecord r) {
        double risk = 0.0;
        double age = r.number("age");
        if (age > 40) risk += (age - 40) * 0.02;
        if (r.flag("smoking")) risk += 0.15;
        if (r.flag("diabetes")) risk += 0.12;
        double cholesterol = r.number("cholesterol");
        if (cholesterol > 200) risk += (cholesterol - 200) / 1000;
        double bp = r.number("systolic_bp");
        if (bp > 120) risk += (bp - 120) / 500;
        return Math.min(risk, 1.0);
    }
}
