package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CovidAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double age = r.number("age");
        if (age >= 65) {
            factors.add(finding(r, "age", "Age 65 or older", age >= 80 ? Severity.SEVERE : Severity.MODERATE,
                    "Most severe COVID-19 outcomes occur in people aged 65 and older.",
                    "Early antiviral treatment if infected"));
        }
        int comorbidities = r.level("comorbidity_count");
        if (comorbidities >= 1) {
            factors.add(finding(r, "comorbidity_count", "Chronic conditions", comorbidities >= 3 ? Severity.SEVERE : Severity.MODERATE,
                    comorbidities + " chronic condition(s) increase the risk of severe disease.",
                    "Keep chronic conditions well controlled"));
        }
        if (!r.flag("fully_vaccinated")) {
            factors.add(finding(r, "fully_vaccinated", "Not fully vaccinated", Severity.MODERATE,
                    "Incomplete vaccination leaves less protection against severe disease.",
                    "Complete the recommended vaccination schedule"));
        }
        int symptoms = r.level("symptoms_severity");
        if (symptoms >= 3) {
            factors.add(finding(r, "symptoms_severity", "Significant symptoms", symptoms >= 4 ? Severity.SEVERE : Severity.MODERATE,
                    "Symptom severity " + symptoms + "/5.",
                    "Seek medical care if symptoms worsen"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("age_risk", metric(r.get("age"), "risk_level", band(r.number("age"), 49, 64, "low", "moderate", "high")));
        metrics.put("comorbidity_burden", metric(r.get("comorbidity_count"), "category",
                band(r.number("comorbidity_count"), 0, 2, "none", "some", "multiple")));
        metrics.put("vaccination", r.flag("fully_vaccinated") ? "Complete" : "Incomplete");
        metrics.put("symptoms", metric(r.get("symptoms_severity"), "category",
                band(r.number("symptoms_severity"), 2, 3, "mild", "moderate", "severe")));
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        if (!r.flag("fully_vaccinated")) {
            return "Vaccination is the single most effective way to lower severe COVID-19 risk. Good ventilation and staying home when sick also reduce exposure.";
        }
        return "Vaccination is complete. Stay up to date with boosters and keep chronic conditions under control.";
    }
}
