package tech.noetzold.risk_assessment_api.domain;

import tech.noetzold.risk_assessment_api.domain.analysis.CholesterolAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.HeartDiseaseAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.HypertensionAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.StrokeAnalysis;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.service.scoring.ScoringRules;

import java.util.List;

public final class CardiovascularDomains {

    private CardiovascularDomains() {
    }

    public static List<DomainDefinition> all() {
        return List.of(heartDisease(), heartDiseaseClinical(), strokeRisk(), hypertension(), cholesterolRisk());
    }

    static DomainDefinition heartDisease() {
        return DomainDefinition.builder()
                .name("heart_disease")
                .displayName("Heart Disease Risk Predictor")
                .description("Predicts cardiovascular disease risk based on clinical parameters")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.25))
                .field(FieldSpec.decimal("cholesterol", "Total cholesterol level (mg/dL)", 400).weight(0.20))
                .field(FieldSpec.decimal("systolic_bp", "Systolic blood pressure (mmHg)", 200).weight(0.20))
                .field(FieldSpec.flag("smoking", "Current smoking status").weight(0.20))
                .field(FieldSpec.flag("diabetes", "Diabetes diagnosis").weight(0.15))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.3)
                        .capped("cholesterol", 400, 0.25)
                        .capped("systolic_bp", 200, 0.2)
                        .flag("smoking", 0.15)
                        .flag("diabetes", 0.1)
                        .build())
                .explanation("age", "Age {value} years - cardiovascular risk increases exponentially with age due to arterial stiffening")
                .explanation("cholesterol", "Cholesterol {value} mg/dL - elevated levels promote atherosclerotic plaque formation")
                .explanation("systolic_bp", "Systolic BP {value} mmHg - high pressure damages arterial walls and accelerates atherosclerosis")
                .explanation("smoking", "Smoking damages endothelium, increases inflammation, and promotes blood clotting")
                .explanation("diabetes", "Diabetes accelerates atherosclerosis through glycation and inflammatory processes")
                .remediation("age", "Enhanced cardiovascular monitoring, regular exercise, and preventive medications as appropriate")
                .remediation("cholesterol", "Statin therapy consideration, dietary changes (reduce saturated fat), and regular lipid monitoring")
                .remediation("systolic_bp", "ACE inhibitor/ARB therapy, DASH diet, sodium restriction, and regular BP monitoring")
                .remediation("smoking", "URGENT: Smoking cessation program, nicotine replacement therapy, and behavioral counseling")
                .remediation("diabetes", "Optimal glycemic control (HbA1c <7%), metformin therapy, and cardiovascular risk reduction")
                .lifestyleRule(LifestyleRule.when(r -> r.number("cholesterol") > 240, "Consider cholesterol-lowering medication"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("systolic_bp") > 140, "Monitor blood pressure regularly"))
                .lifestyleRule(LifestyleRule.when(r -> r.flag("smoking"), "Quit smoking immediately"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Regular exercise and healthy diet"))
                .radarAxis(RadarAxis.of("Age Risk", r -> r.number("age") / 80 * 100, 30))
                .radarAxis(RadarAxis.of("Cholesterol", r -> Math.max(0, r.number("cholesterol") - 150) / 200 * 100, 25))
                .radarAxis(RadarAxis.of("Blood Pressure", r -> Math.max(0, r.number("systolic_bp") - 90) / 100 * 100, 20))
                .radarAxis(RadarAxis.of("Smoking Risk", r -> r.flag("smoking") ? 100 : 0, 0))
                .radarAxis(RadarAxis.of("Diabetes Risk", r -> r.flag("diabetes") ? 100 : 0, 0))
                .analysis(new HeartDiseaseAnalysis())
                .build();
    }

    // No authored formula: scored by the fallback estimator.
    static DomainDefinition heartDiseaseClinical() {
        return DomainDefinition.builder()
                .name("heart_disease_clinical")
                .displayName("Clinical Heart Disease Predictor")
                .description("Predicts risk of heart attack, arrhythmia, or heart failure from stress test and ECG findings")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.15))
                .field(FieldSpec.choice("sex", "Sex", "Female", "Male").weight(0.05))
                .field(FieldSpec.choice("chest_pain_type", "Chest pain type",
                        "Typical angina", "Atypical angina", "Non-anginal pain", "Asymptomatic").weight(0.15))
                .field(FieldSpec.decimal("resting_bp", "Resting blood pressure (mm Hg)", 200).weight(0.15))
                .field(FieldSpec.decimal("cholesterol", "Serum cholesterol (mg/dl)", 400).weight(0.15))
                .field(FieldSpec.flag("fasting_blood_sugar", "Fasting blood sugar > 120 mg/dl").weight(0.10))
                .field(FieldSpec.choice("resting_ecg", "Resting ECG results",
                        "Normal", "ST-T wave abnormality", "Left ventricular hypertrophy").weight(0.10))
                .field(FieldSpec.decimal("max_heart_rate", "Maximum heart rate achieved", 220).protect().weight(0.10))
                .field(FieldSpec.flag("exercise_angina", "Exercise induced angina").weight(0.20))
                .field(FieldSpec.decimal("st_depression", "ST depression induced by exercise relative to rest", 5).weight(0.15))
                .field(FieldSpec.choice("st_slope", "Slope of peak exercise ST segment",
                        "Upsloping", "Flat", "Downsloping").weight(0.10))
                .field(FieldSpec.flag("smoking", "Smoking status").weight(0.20))
                .field(FieldSpec.flag("family_history", "Family history of heart disease").weight(0.15))
                .remediation("smoking", "URGENT: Smoking cessation program, nicotine replacement therapy, and behavioral counseling")
                .remediation("exercise_angina", "Cardiology referral for stress imaging and anti-anginal therapy review")
                .remediation("st_depression", "Further ischemia evaluation with a cardiologist")
                .lifestyleRule(LifestyleRule.when(r -> r.flag("smoking"), "Quit smoking immediately"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("cholesterol") > 240, "Consider cholesterol-lowering medication"))
                .build();
    }

    static DomainDefinition strokeRisk() {
        return DomainDefinition.builder()
                .name("stroke_risk")
                .displayName("Stroke Risk Predictor")
                .description("Analyzes blood pressure, cholesterol, lifestyle, and family history to predict stroke risk")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.25))
                .field(FieldSpec.choice("gender", "Gender", "Female", "Male").weight(0.05))
                .field(FieldSpec.flag("hypertension", "Hypertension").weight(0.25))
                .field(FieldSpec.flag("heart_disease", "Heart disease").weight(0.20))
                .field(FieldSpec.flag("ever_married", "Ever married").weight(0.02))
                .field(FieldSpec.choice("work_type", "Work type",
                        "Private", "Self-employed", "Government", "Children", "Never worked").weight(0.02))
                .field(FieldSpec.choice("residence_type", "Residence type", "Rural", "Urban").weight(0.02))
                .field(FieldSpec.decimal("avg_glucose_level", "Average glucose level (mg/dL)", 300).weight(0.15))
                .field(FieldSpec.decimal("bmi", "Body Mass Index", 50).weight(0.10))
                .field(FieldSpec.choice("smoking_status", "Smoking status",
                        "Never smoked", "Formerly smoked", "Smokes", "Unknown").weight(0.15))
                .field(FieldSpec.choice("alcohol_consumption", "Alcohol consumption",
                        "Never", "Occasional", "Moderate", "Heavy").weight(0.10))
                .field(FieldSpec.choice("physical_activity", "Physical activity level",
                        "Sedentary", "Light", "Moderate", "Vigorous").protect().weight(0.08))
                .field(FieldSpec.flag("family_history_stroke", "Family history of stroke").weight(0.10))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.35)
                        .flag("hypertension", 0.25)
                        .flag("heart_disease", 0.2)
                        .capped("avg_glucose_level", 300, 0.15)
                        .above("bmi", 25, 50, 0.1)
                        .levels("smoking_status", 0, 0.05, 0.15, 0.1)
                        .levels("alcohol_consumption", 0, 0.02, 0.05, 0.12)
                        .levels("physical_activity", 0.08, 0.04, 0.02, 0)
                        .flag("family_history_stroke", 0.1)
                        .flag("gender", 0.02)
                        .term("ever_married", v -> v == 0 ? 0.01 : 0)
                        .term("work_type", v -> v == 4 ? 0.01 : 0)
                        .build())
                .explanation("hypertension", "Hypertension is the leading modifiable cause of stroke")
                .explanation("avg_glucose_level", "Average glucose {value} mg/dL - hyperglycemia damages cerebral vessels")
                .explanation("smoking_status", "Smoking status '{value}' - tobacco doubles ischemic stroke risk")
                .remediation("hypertension", "Blood pressure control to below 130/80 mmHg with medication and sodium restriction")
                .remediation("heart_disease", "Cardiology follow-up and anticoagulation review for atrial fibrillation")
                .remediation("smoking_status", "Smoking cessation program and nicotine replacement therapy")
                .remediation("avg_glucose_level", "Glucose control through diet, exercise, and medication review")
                .lifestyleRule(LifestyleRule.when(r -> r.level("smoking_status") == 2, "Quit smoking to halve stroke risk within 2-5 years"))
                .lifestyleRule(LifestyleRule.when(r -> r.level("alcohol_consumption") >= 2, "Limit alcohol to at most one drink per day"))
                .lifestyleRule(LifestyleRule.when(r -> r.level("physical_activity") <= 1, "Increase physical activity to 150 minutes of moderate exercise weekly"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("bmi") >= 30, "Weight reduction through diet and exercise"))
                .analysis(new StrokeAnalysis())
                .build();
    }

    static DomainDefinition hypertension() {
        return DomainDefinition.builder()
                .name("hypertension")
                .displayName("Hypertension Risk Predictor")
                .description("High blood pressure risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.20))
                .field(FieldSpec.decimal("systolic_bp", "Systolic blood pressure (mmHg)", 200).weight(0.30))
                .field(FieldSpec.decimal("diastolic_bp", "Diastolic blood pressure (mmHg)", 120).weight(0.20))
                .field(FieldSpec.decimal("sodium_intake_mg", "Daily sodium intake (mg)", 5000).weight(0.15))
                .field(FieldSpec.flag("family_history", "Family history of hypertension").weight(0.10))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.25)
                        .above("systolic_bp", 120, 60, 0.3)
                        .above("diastolic_bp", 80, 40, 0.2)
                        .above("sodium_intake_mg", 2300, 2000, 0.15)
                        .flag("family_history", 0.1)
                        .build())
                .explanation("systolic_bp", "Systolic BP {value} mmHg - sustained pressure above 120 mmHg strains the arteries")
                .explanation("diastolic_bp", "Diastolic BP {value} mmHg - elevated resting pressure increases vascular load")
                .explanation("sodium_intake_mg", "Sodium intake {value} mg/day - excess sodium raises blood volume and pressure")
                .remediation("systolic_bp", "Home blood pressure monitoring and medication review with your physician")
                .remediation("diastolic_bp", "DASH diet, regular aerobic exercise, and blood pressure follow-up")
                .remediation("sodium_intake_mg", "Reduce sodium intake (<2300mg/day)")
                .lifestyleRule(LifestyleRule.when(r -> r.number("sodium_intake_mg") > 2300, "Reduce sodium intake (<2300mg/day)"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("systolic_bp") >= 130, "Limit alcohol consumption"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("systolic_bp") >= 130, "Stress management"))
                .radarAxis(RadarAxis.of("Systolic", r -> Math.max(0, r.number("systolic_bp") - 90) / 90 * 100, 33))
                .radarAxis(RadarAxis.of("Diastolic", r -> Math.max(0, r.number("diastolic_bp") - 60) / 60 * 100, 33))
                .radarAxis(RadarAxis.of("Sodium", r -> r.number("sodium_intake_mg") / 5000 * 100, 46))
                .radarAxis(RadarAxis.of("Age", r -> r.number("age"), 50))
                .analysis(new HypertensionAnalysis())
                .build();
    }

    static DomainDefinition cholesterolRisk() {
        return DomainDefinition.builder()
                .name("cholesterol_risk")
                .displayName("Cholesterol Risk Predictor")
                .description("High cholesterol risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.15))
                .field(FieldSpec.decimal("total_cholesterol", "Total cholesterol (mg/dL)", 400).weight(0.25))
                .field(FieldSpec.decimal("hdl_cholesterol", "HDL cholesterol (mg/dL)", 100).protect().weight(0.20))
                .field(FieldSpec.decimal("ldl_cholesterol", "LDL cholesterol (mg/dL)", 300).weight(0.25))
                .field(FieldSpec.decimal("triglycerides", "Triglycerides (mg/dL)", 500).weight(0.10))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.2)
                        .above("total_cholesterol", 200, 200, 0.25)
                        .below("hdl_cholesterol", 50, 50, 0.2)
                        .above("ldl_cholesterol", 100, 100, 0.25)
                        .above("triglycerides", 150, 300, 0.1)
                        .build())
                .explanation("ldl_cholesterol", "LDL {value} mg/dL - LDL particles drive arterial plaque build-up")
                .explanation("hdl_cholesterol", "HDL {value} mg/dL - HDL removes cholesterol from the arteries; low levels reduce protection")
                .remediation("ldl_cholesterol", "Consider statin therapy if indicated")
                .remediation("total_cholesterol", "Heart-healthy diet (low saturated fat)")
                .remediation("hdl_cholesterol", "Regular aerobic activity to raise HDL")
                .remediation("triglycerides", "Limit refined carbohydrates and alcohol")
                .lifestyleRule(LifestyleRule.when(r -> r.number("total_cholesterol") > 200, "Heart-healthy diet (low saturated fat)"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("hdl_cholesterol") < 40, "Regular physical activity"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("ldl_cholesterol") > 160, "Consider statin therapy if indicated"))
                .radarAxis(RadarAxis.of("Total", r -> r.number("total_cholesterol") / 300 * 100, 66))
                .radarAxis(RadarAxis.of("LDL", r -> r.number("ldl_cholesterol") / 200 * 100, 50))
                .radarAxis(RadarAxis.of("HDL deficit", r -> Math.max(0, 60 - r.number("hdl_cholesterol")) / 60 * 100, 0))
                .radarAxis(RadarAxis.of("Triglycerides", r -> r.number("triglycerides") / 300 * 100, 50))
                .analysis(new CholesterolAnalysis())
                .build();
    }
}
