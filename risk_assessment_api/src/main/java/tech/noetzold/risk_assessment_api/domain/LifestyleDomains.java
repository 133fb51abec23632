package tech.noetzold.risk_assessment_api.domain;

import tech.noetzold.risk_assessment_api.domain.analysis.MentalHealthAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.ObesityAnalysis;
import tech.noetzold.risk_assessment_api.domain.analysis.SleepApneaAnalysis;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.service.scoring.ScoringRules;

import java.util.List;

public final class LifestyleDomains {

    private LifestyleDomains() {
    }

    public static List<DomainDefinition> all() {
        return List.of(obesityRisk(), mentalHealth(), sleepApnea());
    }

    static DomainDefinition obesityRisk() {
        return DomainDefinition.builder()
                .name("obesity_risk")
                .displayName("Obesity Risk Predictor")
                .description("Obesity risk assessment based on lifestyle factors")
                .field(FieldSpec.decimal("bmi", "Body Mass Index", 50).weight(0.40))
                .field(FieldSpec.choice("activity_level", "Physical activity level",
                        "Sedentary", "Light", "Moderate", "Active", "Very Active").protect().weight(0.25))
                .field(FieldSpec.decimal("sedentary_hours", "Hours spent sedentary per day", 24).weight(0.15))
                .field(FieldSpec.integer("daily_calories", "Average daily calorie intake", 4400).weight(0.20).defaultingTo(2000))
                .field(FieldSpec.flag("family_history_obesity", "Family history of obesity").weight(0.15).defaultingTo(false))
                .scoring(ScoringRules.builder()
                        .above("bmi", 25, 25, 0.4)
                        .below("activity_level", 3, 3, 0.25)
                        .above("sedentary_hours", 8, 8, 0.15)
                        .above("daily_calories", 2200, 1000, 0.2)
                        .flag("family_history_obesity", 0.15)
                        .build())
                .explanation("bmi", "BMI {value} - values of 25 or above indicate overweight, 30 or above obesity")
                .explanation("activity_level", "Activity level '{value}' - regular activity is the main lever for energy balance")
                .explanation("sedentary_hours", "{value} sedentary hours per day - prolonged sitting lowers energy expenditure")
                .explanation("daily_calories", "{value} kcal per day - intake above needs leads to gradual weight gain")
                .remediation("bmi", "Balanced diet with portion control")
                .remediation("activity_level", "Regular physical activity (150 min/week)")
                .remediation("sedentary_hours", "Break up sitting time with short walks every hour")
                .remediation("daily_calories", "Weight monitoring and calorie awareness")
                .remediation("family_history_obesity", "Behavioral counseling if needed")
                .lifestyleRule(LifestyleRule.when(r -> r.number("bmi") >= 25, "Balanced diet with portion control"))
                .lifestyleRule(LifestyleRule.when(r -> r.level("activity_level") < 3, "Regular physical activity (150 min/week)"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("sedentary_hours") > 8, "Reduce daily sitting time"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("bmi") >= 30, "Weight monitoring"))
                .radarAxis(RadarAxis.of("BMI", r -> r.number("bmi") / 40 * 100, 55))
                .radarAxis(RadarAxis.of("Inactivity", r -> (4 - r.level("activity_level")) / 4.0 * 100, 25))
                .radarAxis(RadarAxis.of("Sedentary Time", r -> r.number("sedentary_hours") / 16 * 100, 50))
                .radarAxis(RadarAxis.of("Calories", r -> r.number("daily_calories") / 4000 * 100, 55))
                .analysis(new ObesityAnalysis())
                .build();
    }

    static DomainDefinition mentalHealth() {
        return DomainDefinition.builder()
                .name("mental_health")
                .displayName("Mental Health Risk Predictor")
                .description("Depression and anxiety risk assessment")
                .field(FieldSpec.integer("stress_level", "Stress level (1-10)", 10).weight(0.30))
                .field(FieldSpec.decimal("sleep_hours", "Average sleep hours per night", 16).protect().weight(0.25))
                .field(FieldSpec.integer("social_support_score", "Social support (1-10)", 10).protect().weight(0.25))
                .field(FieldSpec.integer("recent_life_events", "Major life events in the past year", 10).weight(0.20))
                .scoring(ScoringRules.builder()
                        .term("stress_level", v -> (v - 1) / 9 * 0.3)
                        .term("sleep_hours", v -> Math.abs(v - 8) / 8 * 0.25)
                        .term("social_support_score", v -> (10 - v) / 9 * 0.25)
                        .term("recent_life_events", v -> Math.min(v / 5, 1) * 0.2)
                        .build())
                .explanation("stress_level", "Stress level {value}/10 - chronic stress is a primary trigger for anxiety and depression")
                .explanation("sleep_hours", "{value} hours of sleep - both short and long sleep are linked to mood disorders")
                .explanation("social_support_score", "Social support {value}/10 - strong relationships buffer against depression")
                .remediation("stress_level", "Stress management techniques")
                .remediation("sleep_hours", "Regular sleep schedule (7-9 hours)")
                .remediation("social_support_score", "Social connection and support")
                .remediation("recent_life_events", "Professional counseling if needed")
                .lifestyleRule(LifestyleRule.when(r -> r.number("stress_level") >= 7, "Stress management techniques"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("sleep_hours") < 7 || r.number("sleep_hours") > 9, "Regular sleep schedule (7-9 hours)"))
                .lifestyleRule(LifestyleRule.when(r -> r.number("social_support_score") <= 4, "Social connection and support"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Regular exercise and mindfulness"))
                .radarAxis(RadarAxis.of("Stress", r -> r.number("stress_level") * 10, 40))
                .radarAxis(RadarAxis.of("Sleep Deviation", r -> Math.abs(r.number("sleep_hours") - 8) / 4 * 100, 25))
                .radarAxis(RadarAxis.of("Isolation", r -> (10 - r.number("social_support_score")) * 10, 30))
                .radarAxis(RadarAxis.of("Life Events", r -> r.number("recent_life_events") / 5 * 100, 20))
                .analysis(new MentalHealthAnalysis())
                .build();
    }

    static DomainDefinition sleepApnea() {
        return DomainDefinition.builder()
                .name("sleep_apnea")
                .displayName("Sleep Apnea Risk Predictor")
                .description("Obstructive sleep apnea risk assessment")
                .field(FieldSpec.integer("age", "Age in years", 100).weight(0.20))
                .field(FieldSpec.decimal("bmi", "Body Mass Index", 50).weight(0.30))
                .field(FieldSpec.decimal("neck_circumference", "Neck circumference (inches)", 32).weight(0.20))
                .field(FieldSpec.flag("loud_snoring", "Loud snoring").weight(0.15))
                .field(FieldSpec.flag("daytime_sleepiness", "Excessive daytime sleepiness").weight(0.15))
                .scoring(ScoringRules.builder()
                        .capped("age", 100, 0.2)
                        .above("bmi", 25, 25, 0.3)
                        .above("neck_circumference", 16, 6, 0.2)
                        .flag("loud_snoring", 0.15)
                        .flag("daytime_sleepiness", 0.15)
                        .build())
                .explanation("neck_circumference", "Neck circumference {value} in - above 16 inches narrows the upper airway")
                .explanation("loud_snoring", "Loud snoring indicates partial airway obstruction during sleep")
                .remediation("bmi", "Weight management if overweight")
                .remediation("loud_snoring", "Sleep study evaluation")
                .remediation("daytime_sleepiness", "Sleep study evaluation")
                .remediation("neck_circumference", "ENT evaluation of the upper airway")
                .lifestyleRule(LifestyleRule.when(r -> r.number("bmi") >= 25, "Weight management if overweight"))
                .lifestyleRule(LifestyleRule.when(r -> r.flag("loud_snoring"), "Avoid alcohol before bedtime"))
                .lifestyleRule(LifestyleRule.when(r -> true, "Sleep hygiene practices"))
                .analysis(new SleepApneaAnalysis())
                .build();
    }
}
