package tech.noetzold.risk_assessment_api.domain;

import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.function.ToDoubleFunction;

public record RadarAxis(String label, ToDoubleFunction<TypedRecord> value, double normalRange) {

    public static RadarAxis of(String label, ToDoubleFunction<TypedRecord> value, double normalRange) {
        return new RadarAxis(label, value, normalRange);
    }

    public double valueFor(TypedRecord record) {
        return Math.max(0.0, Math.min(100.0, value.applyAsDouble(record)));
    }
}
