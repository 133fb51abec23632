package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// ATP III categories
public class CholesterolAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double total = r.number("total_cholesterol");
        if (total >= 240) {
            factors.add(finding(r, "total_cholesterol", "High total cholesterol", Severity.SEVERE,
                    "Total cholesterol " + r.display("total_cholesterol") + " mg/dL is high (≥240).",
                    "Heart-healthy diet (low saturated fat)"));
        } else if (total >= 200) {
            factors.add(finding(r, "total_cholesterol", "Borderline high total cholesterol", Severity.MODERATE,
                    "Total cholesterol " + r.display("total_cholesterol") + " mg/dL is borderline high (200-239).",
                    "Heart-healthy diet (low saturated fat)"));
        }
        double ldl = r.number("ldl_cholesterol");
        if (ldl >= 160) {
            factors.add(finding(r, "ldl_cholesterol", "High LDL cholesterol", Severity.SEVERE,
                    "LDL " + r.display("ldl_cholesterol") + " mg/dL is high (≥160).",
                    "Consider statin therapy if indicated"));
        } else if (ldl >= 130) {
            factors.add(finding(r, "ldl_cholesterol", "Borderline high LDL cholesterol", Severity.MODERATE,
                    "LDL " + r.display("ldl_cholesterol") + " mg/dL is borderline high (130-159).",
                    "Reduce saturated and trans fats"));
        }
        if (r.number("hdl_cholesterol") < 40) {
            factors.add(finding(r, "hdl_cholesterol", "Low HDL cholesterol", Severity.MODERATE,
                    "HDL " + r.display("hdl_cholesterol") + " mg/dL is below 40 and offers little protection.",
                    "Regular aerobic activity to raise HDL"));
        }
        if (r.number("triglycerides") >= 200) {
            factors.add(finding(r, "triglycerides", "High triglycerides", Severity.MODERATE,
                    "Triglycerides " + r.display("triglycerides") + " mg/dL are high (≥200).",
                    "Limit refined carbohydrates and alcohol"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double total = r.number("total_cholesterol");
        double ldl = r.number("ldl_cholesterol");
        double hdl = r.number("hdl_cholesterol");
        double triglycerides = r.number("triglycerides");

        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("total_cholesterol", metric(r.get("total_cholesterol"), "category",
                total < 200 ? "Desirable" : total < 240 ? "Borderline High" : "High"));
        profile.put("ldl_cholesterol", metric(r.get("ldl_cholesterol"), "category",
                ldl < 100 ? "Optimal" : ldl < 130 ? "Near Optimal" : ldl < 160 ? "Borderline High" : "High"));
        profile.put("hdl_cholesterol", metric(r.get("hdl_cholesterol"), "category",
                hdl < 40 ? "Low" : hdl >= 60 ? "High (Protective)" : "Normal"));
        profile.put("triglycerides", metric(r.get("triglycerides"), "category",
                triglycerides < 150 ? "Normal" : triglycerides < 200 ? "Borderline High" : "High"));

        double totalHdl = round1(total / Math.max(hdl, 1));
        Map<String, Object> ratios = new LinkedHashMap<>();
        ratios.put("total_hdl_ratio", totalHdl);
        ratios.put("ldl_hdl_ratio", round1(ldl / Math.max(hdl, 1)));
        ratios.put("risk_assessment", totalHdl > 5 ? "High" : totalHdl > 3.5 ? "Moderate" : "Low");

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("cholesterol_profile", profile);
        metrics.put("cholesterol_ratios", ratios);
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        List<String> changes = new ArrayList<>();
        if (r.number("ldl_cholesterol") >= 130 || r.number("total_cholesterol") >= 200) {
            changes.add("cutting saturated and trans fats");
        }
        if (r.number("hdl_cholesterol") < 40) {
            changes.add("regular aerobic exercise to raise HDL");
        }
        if (r.number("triglycerides") >= 150) {
            changes.add("limiting sugar and alcohol");
        }
        if (changes.isEmpty()) {
            return "Your lipid profile is in a healthy range. Keep a fiber-rich diet and regular exercise.";
        }
        return "Diet and activity can lower LDL by 10-20%. Focus on " + String.join(", ", changes) + ".";
    }

    private static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
