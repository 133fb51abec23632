package tech.noetzold.risk_assessment_api.domain;

import tech.noetzold.risk_assessment_api.domain.analysis.AnemiaAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.AsthmaCopdAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.CovidAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.ThyroidAnalysis;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.service.scoring.ScoringRules;

import java.util.List;

public final class SpecializedDomains {

    private SpecializedDomains() {
    }

    public static List<DomainDefinition> all() {
        return List.of(covidRisk(), asthmaCopd(), anemia(), thyroidDisorder(), cancerRecurrence());
    }

    static DomainDefinition covidRisk() {
        return DomainDefinition.builder()
                .name("covid_risk")
                .displayName("COVID-19 Risk Predictor")
                .description("COVID-19 severity and complication risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.35))
                .field(FieldSpec.integer("comorbidity_count", "Number of chronic conditions", 10).weight(0.30))
                .field(FieldSpec.flag("fully_vaccinated", "Fully vaccinated").protect().weight(0.20))
                .field(FieldSpec.integer("symptoms_severity", "Symptom severity (1-5)", 5).weight(0.15))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.35)
                        .term("comorbidity_count", v -> Math.min(v / 5, 1) * 0.3)
                        .term("fully_vaccinated", v -> v != 0 ? 0 : 0.2)
                        .term("symptoms_severity", v -> (v - 1) / 4 * 0.15)
                        .build())
                .explanation("fully_vaccinated", "Vaccination status: {value} - vaccination sharply lowers the risk of severe disease")
                .remediation("fully_vaccinated", "Complete the recommended vaccination schedule")
                .remediation("symptoms_severity", "Seek medical care if symptoms worsen")
                .remediation("comorbidity_count", "Keep chronic conditions well controlled")
                .lifestyleRule(LifestyleRule.when(r -> r.number("symptoms_severity") >= 2, "Follow isolation guidelines"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Monitor symptoms closely"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Stay hydrated and rest"))
                .analysis(new CovidAnalysis())
                .build();
    }

    static DomainDefinition asthmaCopd() {
        return DomainDefinition.builder()
                .name("asthma_copd")
                .displayName("Asthma/COPD Risk Predictor")
                .description("Respiratory disease risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.25))
                .field(FieldSpec.decimal("smoking_pack_years", "Smoking history (pack-years)", 100).weight(0.40))
                .field(FieldSpec.flag("family_history_respiratory", "Family history of respiratory disease").weight(0.20))
                .field(FieldSpec.flag("environmental_exposure", "Occupational or environmental exposure").weight(0.15))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.25)
                        .term("smoking_pack_years", v -> Math.min(v / 50, 1) * 0.4)
                        .flag("family_history_respiratory", 0.2)
                        .flag("environmental_exposure", 0.15)
                        .build())
                .explanation("smoking_pack_years", "{value} pack-years - cumulative smoke exposure is the main cause of COPD")
                .remediation("smoking_pack_years", "Smoking cessation if applicable")
                .remediation("environmental_exposure", "Avoid environmental triggers")
                .remediation("family_history_respiratory", "Regular pulmonary function tests")
                .lifestyleRule(LifestyleRule.when(r -> r.number("smoking_pack_years") > 0, "Smoking cessation if applicable"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Vaccination (flu, pneumonia)"))
                .analysis(new AsthmaCopdAnalysis())
                .build();
    }

    static DomainDefinition anemia() {
        return DomainDefinition.builder()
                .name("anemia")
                .displayName("Anemia Risk Predictor")
                .description("Anemia risk assessment based on clinical factors")
                .field(FieldSpec.decimal("hemoglobin", "Hemoglobin (g/dL)", 24).protect().weight(0.40))
                .field(FieldSpec.decimal("serum_iron", "Serum iron (μg/dL)", 200).protect().weight(0.30))
                .field(FieldSpec.flag("heavy_menstrual_bleeding", "Heavy menstrual bleeding").weight(0.20))
                .field(FieldSpec.flag("dietary_iron_adequate", "Adequate dietary iron intake").protect().weight(0.10).defaultingTo(true))
                .scoring(ScoringRules.builder()
                        .below("hemoglobin", 12, 12, 0.4)
                        .below("serum_iron", 60, 60, 0.3)
                        .flag("heavy_menstrual_bleeding", 0.2)
                        .term("dietary_iron_adequate", v -> v != 0 ? 0 : 0.1)
                        .build())
                .explanation("hemoglobin", "Hemoglobin {value} g/dL - values below 12 g/dL indicate anemia")
                .explanation("serum_iron", "Serum iron {value} μg/dL - values below 60 μg/dL suggest iron deficiency")
                .remediation("hemoglobin", "Address underlying causes")
                .remediation("serum_iron", "Iron-rich diet")
                .remediation("dietary_iron_adequate", "Vitamin C to enhance iron absorption")
                .remediation("heavy_menstrual_bleeding", "Gynecological evaluation of menstrual bleeding")
                .lifestyleRule(LifestyleRule.when(r -> !r.flag("dietary_iron_adequate"), "Iron-rich diet"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("hemoglobin") < 12, "Regular blood tests"))
                .analysis(new AnemiaAnalysis())
                .build();
    }

    static DomainDefinition thyroidDisorder() {
        return DomainDefinition.builder()
                .name("thyroid_disorder")
                .displayName("Thyroid Disorder Predictor")
                .description("Thyroid dysfunction risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.25))
                .field(FieldSpec.choice("gender", "Gender", "female", "male").weight(0.15))
                .field(FieldSpec.flag("family_history_thyroid", "Family history of thyroid disease").weight(0.30))
                .field(FieldSpec.flag("autoimmune_disease", "Autoimmune disease history").weight(0.25))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.25)
                        .term("gender", v -> v == 0 ? 0.2 : 0.1)
                        .flag("family_history_thyroid", 0.3)
                        .flag("autoimmune_disease", 0.25)
                        .build())
                .remediation("family_history_thyroid", "Regular thyroid function tests")
                .remediation("autoimmune_disease", "Thyroid antibody testing")
                .remediation("age", "Monitor for symptoms")
                .lifestyleRule(LifestyleRule.when(r -> true, "Adequate iodine intake"))
                .analysis(new ThyroidAnalysis())
                .build();
    }

    static DomainDefinition cancerRecurrence() {
        return DomainDefinition.builder()
                .name("cancer_recurrence")
                .displayName("Cancer Recurrence Predictor")
                .description("Cancer recurrence risk assessment for survivors")
                .field(FieldSpec.integer("original_cancer_stage", "Original cancer stage (1-4)", 4).weight(0.40))
                .field(FieldSpec.integer("months_since_treatment", "Months since treatment ended", 48).protect().weight(0.25))
                .field(FieldSpec.flag("complete_response", "Complete response to treatment").protect().weight(0.25))
                .field(FieldSpec.flag("elevated_tumor_markers", "Elevated tumor markers").weight(0.10))
                .scoring(ScoringRules.builder()
                        .term("original_cancer_stage", v -> (v - 1) / 3 * 0.4)
                        .below("months_since_treatment", 24, 24, 0.25)
                        .term("complete_response", v -> v != 0 ? 0 : 0.25)
                        .flag("elevated_tumor_markers", 0.1)
                        .build())
                .explanation("original_cancer_stage", "Stage {value} at diagnosis - advanced stages carry higher recurrence rates")
                .remediation("original_cancer_stage", "Surveillance imaging as scheduled")
                .remediation("elevated_tumor_markers", "Report new symptoms promptly")
                .remediation("months_since_treatment", "Regular oncology follow-up")
                .lifestyleRule(LifestyleRule.when(r -> true, "Healthy lifestyle maintenance"))
                .build();
    }
}
