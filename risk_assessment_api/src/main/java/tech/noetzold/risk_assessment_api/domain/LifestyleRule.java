package tech.noetzold.risk_assessment_api.domain;

import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.function.Predicate;

public record LifestyleRule(Predicate<TypedRecord> condition, String advice) {

    public static LifestyleRule when(Predicate<TypedRecord> condition, String advice) {
        return new LifestyleRule(condition, advice);
    }

    public boolean appliesTo(TypedRecord record) {
        return condition.test(record);
    }
}
