package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// temperatures in °F
public class SepsisAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double temperature = r.number("temperature");
        double heartRate = r.number("heart_rate");
        double respiratoryRate = r.number("respiratory_rate");
        double wbc = r.number("white_blood_cells");

        if (feverish(temperature)) {
            factors.add(finding(r, "temperature", "Fever", temperature > 103 ? Severity.SEVERE : Severity.MODERATE,
                    "Temperature " + r.display("temperature") + " °F is above 101.3 °F and suggests a systemic inflammatory response.",
                    "Blood cultures and source evaluation"));
        } else if (hypothermic(temperature)) {
            factors.add(finding(r, "temperature", "Hypothermia", Severity.SEVERE,
                    "Temperature " + r.display("temperature") + " °F is below 96.8 °F, a marker of severe sepsis.",
                    "Active rewarming and immediate clinical review"));
        }
        if (heartRate > 100) {
            factors.add(finding(r, "heart_rate", "Tachycardia", heartRate > 130 ? Severity.SEVERE : Severity.MODERATE,
                    "Heart rate " + r.display("heart_rate") + " bpm indicates tachycardia.",
                    "Fluid status assessment and continuous heart rate monitoring"));
        } else if (heartRate < 60) {
            factors.add(finding(r, "heart_rate", "Bradycardia", Severity.MODERATE,
                    "Heart rate " + r.display("heart_rate") + " bpm is below 60 bpm.",
                    "ECG and medication review"));
        }
        if (respiratoryRate > 22) {
            factors.add(finding(r, "respiratory_rate", "Tachypnea", respiratoryRate > 30 ? Severity.SEVERE : Severity.MODERATE,
                    "Respiratory rate " + r.display("respiratory_rate") + "/min exceeds the qSOFA threshold of 22.",
                    "Oxygen saturation monitoring and blood gas analysis"));
        }
        if (wbc > 12000 || wbc < 4000) {
            factors.add(finding(r, "white_blood_cells", wbc > 12000 ? "Leukocytosis" : "Leukopenia",
                    wbc > 20000 || wbc < 2000 ? Severity.SEVERE : Severity.MODERATE,
                    "White blood cell count " + r.display("white_blood_cells") + " cells/μL is outside 4000-12000.",
                    "Repeat blood count with differential and infection work-up"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        int points = sirsPoints(r);
        Map<String, Object> assessment = new LinkedHashMap<>();
        assessment.put("sirs_points", points);
        assessment.put("sepsis_risk", points >= 3 ? "high" : points == 2 ? "moderate" : "low");
        assessment.put("monitoring_level", points >= 3 ? "intensive" : points == 2 ? "increased" : "routine");

        List<String> indicators = new ArrayList<>();
        double temperature = r.number("temperature");
        if (feverish(temperature) || hypothermic(temperature)) {
            indicators.add("Temperature dysregulation");
        }
        if (r.number("heart_rate") > 90 && r.number("respiratory_rate") > 20) {
            indicators.add("SIRS criteria met");
        }
        double wbc = r.number("white_blood_cells");
        if (wbc > 12000 || wbc < 4000) {
            indicators.add("Abnormal white blood cell count");
        }

        Map<String, Object> vitals = new LinkedHashMap<>();
        vitals.put("temperature", metric(r.get("temperature"), "status",
                feverish(temperature) ? "fever" : hypothermic(temperature) ? "hypothermia" : "normal"));
        vitals.put("heart_rate", metric(r.get("heart_rate"), "status",
                band(r.number("heart_rate"), 90, 100, "normal", "borderline", "tachycardic")));
        vitals.put("respiratory_rate", metric(r.get("respiratory_rate"), "status",
                band(r.number("respiratory_rate"), 20, 22, "normal", "borderline", "tachypneic")));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("sepsis_assessment", assessment);
        metrics.put("vital_signs", vitals);
        metrics.put("risk_indicators", indicators);
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        if (sirsPoints(r) >= 2) {
            return "Vital signs suggest an active inflammatory response. This needs prompt medical evaluation rather than lifestyle change. After recovery, complete any prescribed antibiotic course.";
        }
        return "No strong sepsis signal. Good hand hygiene, prompt care for infections, and medication compliance keep the risk low.";
    }

    static int sirsPoints(TypedRecord r) {
        int points = 0;
        double temperature = r.number("temperature");
        if (feverish(temperature) || hypothermic(temperature)) points++;
        if (r.number("heart_rate") > 90) points++;
        if (r.number("respiratory_rate") > 20) points++;
        double wbc = r.number("white_blood_cells");
        if (wbc > 12000 || wbc < 4000) points++;
        return points;
    }

    private static boolean feverish(double temperature) {
        return temperature > 101.3;
    }

    private static boolean hypothermic(double temperature) {
        return temperature < 96.8;
    }
}
