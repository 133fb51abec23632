package tech.noetzold.risk_assessment_api.domain;

import tech.noetzold.risk_assessment_api.domain.analysis.IcuMortalityAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.PostSurgeryAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.SepsisAnalysis;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.service.scoring.ScoringRules;

import java.util.List;

public final class ConditionDomains {

    private ConditionDomains() {
    }

    public static List<DomainDefinition> all() {
        return List.of(sepsis(), hospitalReadmission(), icuMortality(), postSurgeryComplication(), pregnancyComplication());
    }

    static DomainDefinition sepsis() {
        return DomainDefinition.builder()
                .name("sepsis")
                .displayName("Sepsis Risk Predictor")
                .description("Early sepsis detection and risk assessment")
                .field(FieldSpec.decimal("temperature", "Body temperature (°F)", 110).weight(0.25))
                .field(FieldSpec.decimal("heart_rate", "Heart rate (beats per minute)", 180).weight(0.25))
                .field(FieldSpec.decimal("respiratory_rate", "Respiratory rate (breaths per minute)", 40).weight(0.25))
                .field(FieldSpec.decimal("white_blood_cells", "White blood cell count (cells/μL)", 20000).weight(0.25))
                .scoring(ScoringRules.builder()
                        .term("temperature", v -> v > 100.4 || v < 96.8 ? 0.25 : 0)
                        .term("heart_rate", v -> v > 90 ? 0.25 : 0)
                        .term("respiratory_rate", v -> v > 20 ? 0.25 : 0)
                        .term("white_blood_cells", v -> v > 12000 || v < 4000 ? 0.25 : 0)
                        .build())
                .explanation("temperature", "Temperature {value}°F - fever above 100.4°F or below 96.8°F is a SIRS criterion")
                .explanation("heart_rate", "Heart rate {value} bpm - tachycardia above 90 bpm is a SIRS criterion")
                .explanation("respiratory_rate", "Respiratory rate {value}/min - above 20 breaths per minute is a SIRS criterion")
                .explanation("white_blood_cells", "WBC {value} cells/μL - counts above 12000 or below 4000 are a SIRS criterion")
                .remediation("temperature", "Monitor vital signs closely")
                .remediation("heart_rate", "Immediate medical evaluation if high risk")
                .remediation("respiratory_rate", "Oxygen saturation check and respiratory assessment")
                .remediation("white_blood_cells", "Blood culture if indicated")
                .lifestyleRule(LifestyleRule.when(r -> r.number("white_blood_cells") > 12000, "Consider antibiotic therapy"))
                .analysis(new SepsisAnalysis())
                .build();
    }

    static DomainDefinition hospitalReadmission() {
        return DomainDefinition.builder()
                .name("hospital_readmission")
                .displayName("Hospital Readmission Predictor")
                .description("30-day hospital readmission risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.25))
                .field(FieldSpec.integer("length_of_stay", "Length of hospital stay (days)", 30).weight(0.20))
                .field(FieldSpec.integer("num_diagnoses", "Number of diagnoses", 20).weight(0.25))
                .field(FieldSpec.integer("num_medications", "Number of medications", 50).weight(0.15))
                .field(FieldSpec.choice("discharge_disposition", "Discharge disposition",
                        "home", "home health", "skilled nursing", "rehabilitation", "other").weight(0.10))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.3)
                        .capped("length_of_stay", 30, 0.2)
                        .capped("num_diagnoses", 20, 0.25)
                        .capped("num_medications", 50, 0.15)
                        .flag("discharge_disposition", 0.1)
                        .build())
                .explanation("num_medications", "{value} medications - polypharmacy raises the risk of adverse events after discharge")
                .remediation("num_medications", "Medication reconciliation")
                .remediation("num_diagnoses", "Comprehensive discharge planning")
                .remediation("discharge_disposition", "Follow-up appointment scheduling")
                .remediation("length_of_stay", "Patient education on warning signs")
                .lifestyleRule(LifestyleRule.when(r -> true, "Follow-up appointment scheduling"))
                .build();
    }

    static DomainDefinition icuMortality() {
        return DomainDefinition.builder()
                .name("icu_mortality")
                .displayName("ICU Mortality Predictor")
                .description("ICU mortality risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.25))
                .field(FieldSpec.integer("apache_score", "APACHE II score", 50).clamp().weight(0.35))
                .field(FieldSpec.flag("mechanical_ventilation", "Mechanical ventilation").weight(0.20))
                .field(FieldSpec.flag("sepsis", "Sepsis present").weight(0.10))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.3)
                        .capped("apache_score", 50, 0.4)
                        .flag("mechanical_ventilation", 0.2)
                        .flag("sepsis", 0.1)
                        .build())
                .explanation("apache_score", "APACHE II score {value} - higher scores reflect greater physiological derangement")
                .remediation("apache_score", "Intensive monitoring")
                .remediation("mechanical_ventilation", "Optimize organ support")
                .remediation("sepsis", "Infection control measures")
                .lifestyleRule(LifestyleRule.when(r -> true, "Family communication"))
                .analysis(new IcuMortalityAnalysis())
                .build();
    }

    static DomainDefinition postSurgeryComplication() {
        return DomainDefinition.builder()
                .name("post_surgery_complication")
                .displayName("Post-Surgery Complication Predictor")
                .description("Post-operative complication risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.25))
                .field(FieldSpec.integer("surgery_duration", "Surgery duration (minutes)", 600).weight(0.25))
                .field(FieldSpec.integer("asa_score", "ASA physical status (1-6)", 6).weight(0.30))
                .field(FieldSpec.flag("emergency_surgery", "Emergency surgery").weight(0.20))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.25)
                        .capped("surgery_duration", 600, 0.25)
                        .term("asa_score", v -> (v - 1) / 5 * 0.3)
                        .flag("emergency_surgery", 0.2)
                        .build())
                .explanation("asa_score", "ASA class {value} - higher classes reflect more severe systemic disease")
                .remediation("asa_score", "Close post-operative monitoring")
                .remediation("surgery_duration", "Early mobilization")
                .remediation("emergency_surgery", "Infection prevention")
                .lifestyleRule(LifestyleRule.when(r -> true, "Pain management"))
                .analysis(new PostSurgeryAnalysis())
                .build();
    }

    static DomainDefinition pregnancyComplication() {
        return DomainDefinition.builder()
                .name("pregnancy_complication")
                .displayName("Pregnancy Complication Predictor")
                .description("Pregnancy and delivery complication risk assessment")
                .field(FieldSpec.integer("maternal_age", "Maternal age in years", 50).weight(0.20))
                .field(FieldSpec.integer("gestational_age", "Gestational age (weeks)", 42).weight(0.30))
                .field(FieldSpec.flag("previous_complications", "Previous pregnancy complications").weight(0.25))
                .field(FieldSpec.flag("multiple_pregnancy", "Multiple pregnancy (twins or more)").weight(0.25))
                .scoring(ScoringRules.builder()
                        .term("maternal_age", v -> v < 18 || v > 35 ? 0.2 : 0)
                        .term("gestational_age", v -> v < 37 ? 0.3 : 0)
                        .flag("previous_complications", 0.25)
                        .flag("multiple_pregnancy", 0.25)
                        .build())
                .explanation("gestational_age", "Gestational age {value} weeks - delivery before 37 weeks is preterm")
                .remediation("gestational_age", "Fetal monitoring")
                .remediation("previous_complications", "Regular prenatal care")
                .remediation("multiple_pregnancy", "Delivery planning")
                .remediation("maternal_age", "Nutritional counseling")
                .lifestyleRule(LifestyleRule.when(r -> true, "Regular prenatal care"))
                .build();
    }
}
