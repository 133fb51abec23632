package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class IcuMortalityAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double apache = r.number("apache_score");
        if (apache > 20) {
            factors.add(finding(r, "apache_score", "High APACHE II score",
                    apache > 30 ? Severity.CRITICAL : apache > 25 ? Severity.SEVERE : Severity.MODERATE,
                    "APACHE II score " + r.display("apache_score") + " reflects severe acute physiological derangement.",
                    "Daily reassessment of organ support and goals of care"));
        }
        if (r.flag("mechanical_ventilation")) {
            factors.add(finding(r, "mechanical_ventilation", "Respiratory failure", Severity.SEVERE,
                    "Mechanical ventilation indicates respiratory failure.",
                    "Daily spontaneous breathing trials and ventilator bundle"));
        }
        if (r.flag("sepsis")) {
            factors.add(finding(r, "sepsis", "Sepsis", Severity.SEVERE,
                    "Sepsis drives multi-organ dysfunction in critical illness.",
                    "Early antibiotics and sepsis bundle compliance"));
        }
        if (r.number("age") > 75) {
            factors.add(finding(r, "age", "Advanced age", Severity.MODERATE,
                    "Age " + r.display("age") + " reduces physiological reserve.",
                    "Geriatric consultation and delirium prevention"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double apache = r.number("apache_score");
        int failingSystems = (r.flag("mechanical_ventilation") ? 1 : 0) + (r.flag("sepsis") ? 1 : 0);

        List<String> critical = new ArrayList<>();
        if (apache > 25) critical.add("High APACHE II score");
        if (r.flag("mechanical_ventilation")) critical.add("Ventilator dependence");
        if (r.flag("sepsis")) critical.add("Septic process");

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("severity_level", metric(r.get("apache_score"), "category",
                band(apache, 15, 25, "moderate", "severe", "critical")));
        metrics.put("organ_function", metric(failingSystems, "status",
                failingSystems == 0 ? "preserved" : failingSystems == 1 ? "single organ support" : "multi-organ dysfunction"));
        metrics.put("age_reserve", metric(r.get("age"), "category", band(r.number("age"), 65, 75, "adequate", "reduced", "limited")));
        metrics.put("critical_indicators", critical);
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        List<String> focus = new ArrayList<>();
        focus.add("family support and involvement in care decisions");
        if (r.flag("mechanical_ventilation")) {
            focus.add("early mobilization once ventilation is weaned");
        }
        if (r.number("age") > 65) {
            focus.add("an extended recovery and rehabilitation period");
        }
        focus.add("structured follow-up after discharge");
        return "Outcome depends mainly on acute care, but recovery benefits from " + String.join(", ", focus) + ".";
    }
}
