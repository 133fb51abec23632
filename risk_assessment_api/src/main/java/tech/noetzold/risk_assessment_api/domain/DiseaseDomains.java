package tech.noetzold.risk_assessment_api.domain;

import tech.noetzold.risk_assessment_api.domain.analysis.AlzheimerAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.CancerDetectionAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.DiabetesAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.LiverDiseaseAnalysis;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.service.scoring.ScoringRules;

import java.util.List;

public final class DiseaseDomains {

    private DiseaseDomains() {
    }

    public static List<DomainDefinition> all() {
        return List.of(cancerDetection(), kidneyDisease(), liverDisease(), alzheimer(), parkinson(), diabetes());
    }

    static DomainDefinition cancerDetection() {
        return DomainDefinition.builder()
                .name("cancer_detection")
                .displayName("Cancer Detection Predictor")
                .description("General cancer risk screening from age, family history, smoking, and symptoms")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.25))
                .field(FieldSpec.flag("family_history", "Family history of cancer").weight(0.20))
                .field(FieldSpec.integer("smoking_years", "Years of smoking", 50).weight(0.25))
                .field(FieldSpec.integer("symptoms_count", "Number of warning symptoms present", 10).weight(0.25))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.3)
                        .flag("family_history", 0.2)
                        .capped("smoking_years", 50, 0.25)
                        .capped("symptoms_count", 10, 0.25)
                        .build())
                .explanation("smoking_years", "{value} years of smoking - cumulative tobacco exposure is the largest preventable cancer risk")
                .explanation("symptoms_count", "{value} warning symptoms reported - persistent symptoms warrant diagnostic work-up")
                .remediation("smoking_years", "Smoking cessation and low-dose CT screening if eligible")
                .remediation("symptoms_count", "Prompt evaluation of persistent symptoms by a physician")
                .remediation("family_history", "Genetic counseling and earlier screening schedule")
                .lifestyleRule(LifestyleRule.when(r -> r.number("smoking_years") > 0, "Stop smoking and avoid second-hand smoke"))
                .lifestyleRule(LifestyleRule.when(r -> r.flag("family_history"), "Discuss age-appropriate cancer screening with your doctor"))
                .analysis(new CancerDetectionAnalysis())
                .build();
    }

    static DomainDefinition kidneyDisease() {
        return DomainDefinition.builder()
                .name("kidney_disease")
                .displayName("Kidney Disease Predictor")
                .description("Chronic kidney disease risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.20))
                .field(FieldSpec.decimal("blood_pressure", "Blood pressure (mmHg)", 200).weight(0.25))
                .field(FieldSpec.decimal("specific_gravity", "Urine specific gravity", 1.040).weight(0.15))
                .field(FieldSpec.ordinal("albumin", "Urine albumin level (0-5)", 5).weight(0.25))
                .field(FieldSpec.ordinal("sugar", "Urine sugar level (0-5)", 5).weight(0.15))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.25)
                        .capped("blood_pressure", 200, 0.3)
                        .term("specific_gravity", v -> Math.abs(v - 1.020) * 10)
                        .term("albumin", v -> v * 0.2)
                        .term("sugar", v -> v * 0.15)
                        .build())
                .explanation("albumin", "Urine albumin level {value} - protein leakage is an early marker of kidney damage")
                .explanation("blood_pressure", "Blood pressure {value} mmHg - hypertension damages the renal filtration units")
                .remediation("albumin", "Kidney function tests (eGFR, urine albumin-creatinine ratio) and ACE inhibitor review")
                .remediation("blood_pressure", "Maintain healthy blood pressure")
                .remediation("sugar", "Glucose control and diabetes screening")
                .lifestyleRule(LifestyleRule.when(r -> true, "Regular kidney function monitoring"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("blood_pressure") > 130, "Limit sodium intake"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Stay hydrated"))
                .build();
    }

    static DomainDefinition liverDisease() {
        return DomainDefinition.builder()
                .name("liver_disease")
                .displayName("Liver Disease Predictor")
                .description("Liver disease risk assessment based on clinical markers")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.15))
                .field(FieldSpec.decimal("bilirubin", "Total bilirubin (mg/dL)", 10).weight(0.25))
                .field(FieldSpec.decimal("alkaline_phosphotase", "Alkaline phosphatase (IU/L)", 500).weight(0.20))
                .field(FieldSpec.decimal("alamine_aminotransferase", "Alanine aminotransferase (IU/L)", 200).weight(0.25))
                .field(FieldSpec.integer("alcohol_consumption", "Alcoholic drinks per week", 20).weight(0.15))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.2)
                        .capped("bilirubin", 10, 0.25)
                        .capped("alkaline_phosphotase", 500, 0.2)
                        .capped("alamine_aminotransferase", 200, 0.25)
                        .capped("alcohol_consumption", 10, 0.1)
                        .build())
                .explanation("bilirubin", "Bilirubin {value} mg/dL - elevated levels indicate impaired liver processing")
                .explanation("alamine_aminotransferase", "ALT {value} IU/L - raised ALT signals liver cell injury")
                .remediation("alcohol_consumption", "Limit alcohol consumption")
                .remediation("alamine_aminotransferase", "Repeat liver function tests and hepatology review")
                .remediation("bilirubin", "Evaluation for biliary obstruction or hepatitis")
                .lifestyleRule(LifestyleRule.when(r -> true, "Regular liver function tests"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("alcohol_consumption") > 7, "Limit alcohol consumption"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Avoid hepatotoxic medications"))
                .analysis(new LiverDiseaseAnalysis())
                .build();
    }

    static DomainDefinition alzheimer() {
        return DomainDefinition.builder()
                .name("alzheimer")
                .displayName("Alzheimer's Disease Predictor")
                .description("Early Alzheimer's disease risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.35))
                .field(FieldSpec.flag("family_history", "Family history of Alzheimer's disease").weight(0.25))
                .field(FieldSpec.integer("education_years", "Years of formal education", 20).protect().weight(0.15))
                .field(FieldSpec.integer("cognitive_score", "Cognitive screening score (MMSE, 0-30)", 30).clamp().protect().weight(0.20))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.4)
                        .flag("family_history", 0.25)
                        .below("education_years", 16, 16, 0.15)
                        .below("cognitive_score", 30, 30, 0.2)
                        .build())
                .explanation("cognitive_score", "Cognitive score {value}/30 - scores below 24 suggest cognitive impairment")
                .remediation("cognitive_score", "Formal neuropsychological assessment and regular cognitive assessments")
                .remediation("education_years", "Mental stimulation activities")
                .lifestyleRule(LifestyleRule.when(r -> true, "Mental stimulation activities"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("age") >= 60, "Social engagement"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Healthy diet (Mediterranean style)"))
                .analysis(new AlzheimerAnalysis())
                .build();
    }

    static DomainDefinition parkinson() {
        return DomainDefinition.builder()
                .name("parkinson")
                .displayName("Parkinson's Disease Predictor")
                .description("Parkinson's disease risk assessment based on motor symptoms")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.25))
                .field(FieldSpec.ordinal("tremor_score", "Tremor severity (0-4)", 4).weight(0.25))
                .field(FieldSpec.ordinal("rigidity_score", "Rigidity severity (0-4)", 4).weight(0.25))
                .field(FieldSpec.ordinal("bradykinesia_score", "Bradykinesia severity (0-4)", 4).weight(0.25))
                .field(FieldSpec.flag("postural_instability", "Postural instability").weight(0.10))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.3)
                        .term("tremor_score", v -> v / 10)
                        .term("rigidity_score", v -> v / 10)
                        .term("bradykinesia_score", v -> v / 10)
                        .flag("postural_instability", 0.1)
                        .build())
                .remediation("tremor_score", "Regular neurological evaluation")
                .remediation("rigidity_score", "Physical therapy")
                .remediation("bradykinesia_score", "Regular neurological evaluation and movement assessment")
                .remediation("postural_instability", "Balance training and fall prevention measures")
                .lifestyleRule(LifestyleRule.when(r -> true, "Regular exercise"))
                .lifestyleRule(LifestyleRule.when(r -> r.flag("postural_instability"), "Remove fall hazards at home"))
                .build();
    }

    static DomainDefinition diabetes() {
        return DomainDefinition.builder()
                .name("diabetes")
                .displayName("Diabetes Risk Predictor")
                .description("Predicts Type 2 diabetes risk using glucose levels, BMI, family history, and lifestyle factors")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.15))
                .field(FieldSpec.choice("gender", "Gender", "Female", "Male").weight(0.02))
                .field(FieldSpec.decimal("bmi", "Body Mass Index (kg/m²)", 50).weight(0.20))
                .field(FieldSpec.decimal("glucose_level", "Fasting blood glucose level (mg/dL)", 200).weight(0.30))
                .field(FieldSpec.decimal("blood_pressure", "Diastolic blood pressure (mmHg)", 120).weight(0.10))
                .field(FieldSpec.decimal("insulin_level", "Serum insulin level (μU/mL)", 240).weight(0.15))
                .field(FieldSpec.flag("family_history_diabetes", "Family history of diabetes").weight(0.20))
                .field(FieldSpec.decimal("physical_activity", "Physical activity hours per week", 10).protect().weight(0.10))
                .field(FieldSpec.integer("pregnancies", "Number of pregnancies", 10).weight(0.05).defaultingTo(0))
                .field(FieldSpec.decimal("skin_thickness", "Triceps skin fold thickness (mm)", 60).weight(0.05).defaultingTo(20.0))
                .field(FieldSpec.decimal("diabetes_pedigree_function", "Diabetes pedigree function (0.0-2.5)", 2.5)
                        .weight(0.10).defaultingTo(0.5))
                .scoring(ScoringRules.builder()
                        .term("age", v -> v >= 45 ? 0.2 : v >= 35 ? 0.1 : 0)
                        .term("bmi", v -> v >= 30 ? 0.25 : v >= 25 ? 0.15 : 0)
                        .term("glucose_level", v -> v >= 126 ? 0.4 : v >= 100 ? 0.2 : 0)
                        .term("blood_pressure", v -> v >= 90 ? 0.1 : 0)
                        .term("insulin_level", v -> v > 120 ? 0.15 : 0)
                        .flag("family_history_diabetes", 0.2)
                        .term("pregnancies", v -> v > 0 ? Math.min(v * 0.05, 0.15) : 0)
                        .term("diabetes_pedigree_function", v -> Math.min(v * 0.3, 0.2))
                        .term("physical_activity", v -> v < 2 ? 0.1 : v >= 5 ? -0.05 : 0)
                        .build())
                .explanation("glucose_level", "Fasting glucose {value} mg/dL - 100-125 is pre-diabetic, 126 or above is in the diabetic range")
                .explanation("bmi", "BMI {value} - excess body fat increases insulin resistance")
                .explanation("insulin_level", "Insulin {value} μU/mL - high fasting insulin indicates insulin resistance")
                .remediation("glucose_level", "HbA1c test and glucose monitoring with your physician")
                .remediation("bmi", "Maintain healthy weight through diet and exercise")
                .remediation("family_history_diabetes", "Regular screening due to family history")
                .remediation("physical_activity", "Increase physical activity to at least 150 minutes per week")
                .lifestyleRule(LifestyleRule.when(r -> r.number("glucose_level") >= 100, "Monitor blood glucose levels regularly"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("bmi") >= 25, "Maintain healthy weight through diet and exercise"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("physical_activity") < 3, "Increase physical activity to at least 150 minutes per week"))
                .lifestyleRule(LifestyleRule.when(r -> r.flag("family_history_diabetes"), "Regular screening due to family history"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Follow a balanced, low-sugar diet"))
                .radarAxis(RadarAxis.of("Glucose", r -> r.number("glucose_level") / 200 * 100, 45))
                .radarAxis(RadarAxis.of("BMI", r -> r.number("bmi") / 40 * 100, 55))
                .radarAxis(RadarAxis.of("Insulin", r -> r.number("insulin_level") / 240 * 100, 35))
                .radarAxis(RadarAxis.of("Blood Pressure", r -> r.number("blood_pressure") / 120 * 100, 65))
                .radarAxis(RadarAxis.of("Inactivity", r -> Math.max(0, 5 - r.number("physical_activity")) / 5 * 100, 0))
                .analysis(new DiabetesAnalysis())
                .build();
    }
}
