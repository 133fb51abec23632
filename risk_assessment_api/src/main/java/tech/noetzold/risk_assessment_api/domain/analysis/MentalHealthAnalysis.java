package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MentalHealthAnalysis extends ClinicalAnalysis {

    @Override
    public List<ContributingFactor> contributingFactors(TypedRecord r) {
        List<ContributingFactor> factors = new ArrayList<>();
        double stress = r.number("stress_level");
        double sleep = r.number("sleep_hours");

        if (stress >= 7) {
            factors.add(finding(r, "stress_level", "High stress level", stress >= 9 ? Severity.SEVERE : Severity.MODERATE,
                    "Stress level " + r.display("stress_level") + "/10 is high", "Stress management techniques"));
        }
        if (sleep < 6) {
            factors.add(finding(r, "sleep_hours", "Insufficient sleep", Severity.MODERATE,
                    "Insufficient sleep (<6 hours)", "Regular sleep schedule (7-9 hours)"));
        } else if (sleep > 9) {
            factors.add(finding(r, "sleep_hours", "Excessive sleep", Severity.MILD,
                    "Excessive sleep (>9 hours)", "Regular sleep schedule (7-9 hours)"));
        }
        if (r.number("social_support_score") <= 3) {
            factors.add(finding(r, "social_support_score", "Poor social support", Severity.MODERATE,
                    "Poor social support", "Social connection and support"));
        }
        if (r.number("recent_life_events") >= 3) {
            factors.add(finding(r, "recent_life_events", "Multiple recent life events", Severity.MODERATE,
                    r.display("recent_life_events") + " major life events in the past year", "Professional counseling if needed"));
        }
        return factors;
    }

    @Override
    public Map<String, Object> healthMetrics(TypedRecord r) {
        double sleep = r.number("sleep_hours");
        Map<String, Object> sleepQuality = new LinkedHashMap<>();
        sleepQuality.put("hours_per_night", r.get("sleep_hours"));
        sleepQuality.put("sleep_adequacy", sleepAdequacy(sleep));
        sleepQuality.put("sleep_impact", sleep < 6 || sleep > 9 ? "Negative" : "Positive");

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("stress_assessment", metric(r.get("stress_level"), "overall_stress", stressBand(r.number("stress_level"))));
        metrics.put("sleep_quality", sleepQuality);
        metrics.put("social_wellbeing", metric(r.get("social_support_score"), "social_risk",
                r.number("social_support_score") <= 3 ? "High" : "Low"));
        return metrics;
    }

    @Override
    public String lifestyleImpact(TypedRecord r) {
        double sleep = r.number("sleep_hours");
        String sleepNote = sleep < 7 || sleep > 9
                ? "Bringing sleep into the 7-9 hour range is likely to improve mood and resilience."
                : "Sleep duration is supportive of mental health.";
        String coping = r.number("social_support_score") >= 6
                ? "Good social support provides coping resources."
                : "Limited social support leaves fewer coping resources; reaching out to friends, family, or support groups helps.";
        return "Current stress is " + stressBand(r.number("stress_level")).toLowerCase() + ". " + sleepNote + " " + coping;
    }

    static String sleepAdequacy(double hours) {
        if (hours < 6) return "Insufficient";
        if (hours > 9) return "Excessive";
        if (hours >= 7 && hours <= 8) return "Optimal";
        return "Adequate";
    }

    private static String stressBand(double stress) {
        if (stress >= 9) return "Extreme";
        if (stress >= 7) return "High";
        if (stress >= 4) return "Moderate";
        return "Mild";
    }
}
