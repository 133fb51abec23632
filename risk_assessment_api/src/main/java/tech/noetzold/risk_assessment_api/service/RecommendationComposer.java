package tech.noetzold.risk_assessment_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.risk_assessment_api.domain.DomainDefinition;
import tech.noetzold.risk_assessment_api.domain.LifestyleRule;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.RiskLevel;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// order: level advice, factor remediation, lifestyle notes
@Component
public class RecommendationComposer {

    public static final int MAX_RECOMMENDATIONS = 15;
    public static final int REMEDIATED_FACTORS = 5;
    static final double LIFESTYLE_SCORE_THRESHOLD = 0.5;

    private static final Map<RiskLevel, List<String>> GENERIC_ADVICE = new EnumMap<>(Map.of(
            RiskLevel.LOW, List.of(
                    "Maintain your current healthy lifestyle",
                    "Continue regular check-ups with your healthcare provider",
                    "Stay physically active and eat a balanced diet",
                    "Keep track of relevant health metrics at least once a year"),
            RiskLevel.MODERATE, List.of(
                    "Consider lifestyle modifications to reduce risk",
                    "Schedule more frequent health screenings",
                    "Consult with your healthcare provider about prevention strategies",
                    "Monitor relevant health metrics regularly"),
            RiskLevel.HIGH, List.of(
                    "Seek immediate consultation with a healthcare professional",
                    "Consider comprehensive health screening",
                    "Implement significant lifestyle changes",
                    "Follow up with specialist if recommended"),
            RiskLevel.VERY_HIGH, List.of(
                    "Urgent medical consultation recommended",
                    "Comprehensive diagnostic testing may be needed",
                    "Consider immediate lifestyle interventions",
                    "Follow all medical advice strictly")
    ));

    private static final List<String> ELEVATED_SCORE_LIFESTYLE = List.of(
            "Implement a heart-healthy diet rich in fruits and vegetables",
            "Establish a regular exercise routine (150 minutes/week moderate activity)",
            "Practice stress management techniques like meditation or yoga");

    private static final List<String> MONITORING = List.of(
            "Schedule regular follow-up appointments with your healthcare provider",
            "Monitor key health metrics daily or weekly as advised",
            "Keep a health diary to track symptoms and improvements");

    public List<String> compose(RiskLevel level, List<ContributingFactor> factors, List<String> lifestyleNotes) {
        Set<String> out = new LinkedHashSet<>(GENERIC_ADVICE.get(level));
        factors.stream()
                .limit(REMEDIATED_FACTORS)
                .map(ContributingFactor::remediation)
                .filter(r -> r != null && !r.isBlank())
                .forEach(out::add);
        out.addAll(lifestyleNotes);
        return out.stream().limit(MAX_RECOMMENDATIONS).toList();
    }

    public List<String> lifestyleNotes(DomainDefinition domain, TypedRecord typed, double score, RiskLevel level) {
        List<String> notes = new ArrayList<>();
        for (LifestyleRule rule : domain.getLifestyleRules()) {
            if (rule.appliesTo(typed)) {
                notes.add(rule.advice());
            }
        }
        if (score > LIFESTYLE_SCORE_THRESHOLD) {
            notes.addAll(ELEVATED_SCORE_LIFESTYLE);
        }
        if (level.isElevated()) {
            notes.addAll(MONITORING);
        }
        return notes;
    }

    static List<String> genericAdvice(RiskLevel level) {
        return GENERIC_ADVICE.get(level);
    }
}
