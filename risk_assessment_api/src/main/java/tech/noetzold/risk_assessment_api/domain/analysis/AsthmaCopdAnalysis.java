package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AsthmaCopdAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double packYears = r.number("smoking_pack_years");
        if (packYears > 20) {
            factors.add(finding(r, "smoking_pack_years", "Heavy smoking history", packYears > 40 ? Severity.SEVERE : Severity.MODERATE,
                    r.display("smoking_pack_years") + " pack-years is the primary risk factor for COPD.",
                    "Smoking cessation and spirometry"));
        } else if (packYears > 10) {
            factors.add(finding(r, "smoking_pack_years", "Smoking history", Severity.MILD,
                    r.display("smoking_pack_years") + " pack-years increases COPD risk.",
                    "Smoking cessation"));
        }
        if (r.flag("environmental_exposure")) {
            factors.add(finding(r, "environmental_exposure", "Occupational exposure", Severity.MODERATE,
                    "Workplace or environmental irritants worsen respiratory symptoms.",
                    "Respiratory protection and exposure reduction"));
        }
        if (r.flag("family_history_respiratory")) {
            factors.add(finding(r, "family_history_respiratory", "Family history", Severity.MILD,
                    "Family history of respiratory disease suggests a genetic predisposition.",
                    "Baseline lung function testing"));
        }
        if (r.number("age") > 40 && packYears > 10) {
            factors.add(finding(r, "age", "Age over 40 with smoking history", Severity.MODERATE,
                    "COPD typically presents after 40 in people with a smoking history.",
                    "Spirometry to screen for airflow obstruction"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double packYears = r.number("smoking_pack_years");
        int exposures = (r.flag("environmental_exposure") ? 1 : 0) + (r.flag("family_history_respiratory") ? 1 : 0);
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("smoking_exposure", metric(r.get("smoking_pack_years"), "category",
                packYears == 0 ? "Never smoked" : band(packYears, 10, 20, "light", "moderate", "heavy")));
        metrics.put("environmental_risk", exposures == 0 ? "low" : exposures == 1 ? "moderate" : "high");
        metrics.put("screening_recommended", r.number("age") > 40 && packYears > 10);
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        List<String> recommendations = new ArrayList<>();
        if (r.number("smoking_pack_years") > 0) {
            recommendations.add("Smoking cessation is the most important intervention for respiratory health");
        }
        if (r.flag("environmental_exposure")) {
            recommendations.add("Minimize exposure to air pollution and environmental irritants");
        }
        if (recommendations.isEmpty()) {
            return "No major modifiable respiratory risks. Stay active and keep vaccinations current.";
        }
        return String.join(". ", recommendations) + ".";
    }
}
