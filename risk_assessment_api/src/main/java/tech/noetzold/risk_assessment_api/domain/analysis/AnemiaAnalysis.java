package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AnemiaAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double hemoglobin = r.number("hemoglobin");
        if (hemoglobin < 12) {
            factors.add(finding(r, "hemoglobin", "Low hemoglobin",
                    hemoglobin < 8 ? Severity.SEVERE : hemoglobin < 10 ? Severity.MODERATE : Severity.MILD,
                    "Hemoglobin " + r.display("hemoglobin") + " g/dL is below 12 g/dL.",
                    "Complete blood count with red cell indices"));
        }
        double iron = r.number("serum_iron");
        if (iron < 60) {
            factors.add(finding(r, "serum_iron", "Low serum iron", iron < 30 ? Severity.MODERATE : Severity.MILD,
                    "Serum iron " + r.display("serum_iron") + " μg/dL suggests iron deficiency.",
                    "Ferritin test and iron supplementation if confirmed"));
        }
        if (r.flag("heavy_menstrual_bleeding")) {
            factors.add(finding(r, "heavy_menstrual_bleeding", "Heavy menstrual bleeding", Severity.MODERATE,
                    "Heavy menstrual periods are a common cause of iron deficiency.",
                    "Gynecological evaluation for heavy menstrual bleeding"));
        }
        if (!r.flag("dietary_iron_adequate")) {
            factors.add(finding(r, "dietary_iron_adequate", "Inadequate dietary iron", Severity.MILD,
                    "Low dietary iron limits red blood cell production.",
                    "Iron-rich foods with vitamin C to aid absorption"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double hemoglobin = r.number("hemoglobin");
        double iron = r.number("serum_iron");
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("anemia_severity", metric(r.get("hemoglobin"), "category",
                hemoglobin < 8 ? "Severe" : hemoglobin < 10 ? "Moderate" : hemoglobin < 12 ? "Mild" : "Normal"));
        metrics.put("iron_status", metric(r.get("serum_iron"), "category",
                iron < 30 ? "Deficient" : iron < 60 ? "Low" : "Normal"));
        metrics.put("likely_type", hemoglobin < 12 && iron < 60 ? "Iron deficiency" : hemoglobin < 12 ? "Undetermined" : "None");
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        List<String> recommendations = new ArrayList<>();
        if (!r.flag("dietary_iron_adequate")) {
            recommendations.add("Ensure adequate iron intake through diet and consider supplementation");
        }
        if (r.flag("heavy_menstrual_bleeding")) {
            recommendations.add("Consider gynecological evaluation for heavy menstrual bleeding");
        }
        if (recommendations.isEmpty()) {
            return "Diet and bleeding history do not point to an iron problem. Keep a varied diet with iron-rich foods.";
        }
        return String.join(". ", recommendations) + ".";
    }
}
