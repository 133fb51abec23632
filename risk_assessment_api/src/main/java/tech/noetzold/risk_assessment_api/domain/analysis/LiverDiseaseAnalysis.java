package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class LiverDiseaseAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double alt = r.number("alamine_aminotransferase");
        if (alt > 40) {
            factors.add(finding(r, "alamine_aminotransferase", "Elevated liver enzymes",
                    alt > 120 ? Severity.SEVERE : alt > 80 ? Severity.MODERATE : Severity.MILD,
                    "ALT " + r.display("alamine_aminotransferase") + " IU/L indicates hepatocellular damage (normal 7-40).",
                    "Hepatitis panel and liver ultrasound"));
        }
        double bilirubin = r.number("bilirubin");
        if (bilirubin > 1.2) {
            factors.add(finding(r, "bilirubin", "Elevated bilirubin",
                    bilirubin > 3.0 ? Severity.SEVERE : bilirubin > 2.0 ? Severity.MODERATE : Severity.MILD,
                    "Total bilirubin " + r.display("bilirubin") + " mg/dL is above 1.2 mg/dL.",
                    "Evaluate for biliary obstruction and hemolysis"));
        }
        double alp = r.number("alkaline_phosphotase");
        if (alp > 147) {
            factors.add(finding(r, "alkaline_phosphotase", "Elevated alkaline phosphatase",
                    alp > 400 ? Severity.SEVERE : alp > 250 ? Severity.MODERATE : Severity.MILD,
                    "ALP " + r.display("alkaline_phosphotase") + " IU/L suggests cholestatic injury or bile duct obstruction.",
                    "Imaging of the biliary tree"));
        }
        double drinks = r.number("alcohol_consumption");
        if (drinks > 7) {
            factors.add(finding(r, "alcohol_consumption", "Alcohol consumption", drinks > 14 ? Severity.SEVERE : Severity.MODERATE,
                    r.display("alcohol_consumption") + " drinks per week increases the risk of steatosis and cirrhosis.",
                    "Reduce alcohol intake, ideally to abstinence"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double bilirubin = r.number("bilirubin");
        Map<String, Object> enzymes = new LinkedHashMap<>();
        enzymes.put("alt", metric(r.get("alamine_aminotransferase"), "status",
                r.number("alamine_aminotransferase") > 40 ? "elevated" : "normal"));
        enzymes.put("alp", metric(r.get("alkaline_phosphotase"), "status",
                r.number("alkaline_phosphotase") > 147 ? "elevated" : "normal"));

        Map<String, Object> bilirubinMetabolism = new LinkedHashMap<>();
        bilirubinMetabolism.put("total_bilirubin", metric(r.get("bilirubin"), "status", bilirubin > 1.2 ? "elevated" : "normal"));
        bilirubinMetabolism.put("jaundice_risk", band(bilirubin, 1.5, 2.5, "low", "moderate", "high"));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("liver_enzymes", enzymes);
        metrics.put("bilirubin_metabolism", bilirubinMetabolism);
        metrics.put("alcohol_use", metric(r.get("alcohol_consumption"), "category",
                band(r.number("alcohol_consumption"), 7, 14, "low", "moderate", "heavy")));
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        if (r.number("alcohol_consumption") > 7) {
            return "Your lifestyle significantly impacts liver health. Priority intervention: alcohol reduction (current intake "
                    + r.display("alcohol_consumption") + " drinks/week increases liver damage risk). Reducing alcohol can halt liver disease progression.";
        }
        return "Your lifestyle factors support good liver health. Continue avoiding excessive alcohol, maintaining a healthy weight, and regular medical monitoring.";
    }
}
