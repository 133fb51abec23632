package tech.noetzold.risk_assessment_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    MILD("mild", "#22c55e"),
    MODERATE("moderate", "#eab308"),
    SEVERE("severe", "#f97316"),
    CRITICAL("critical", "#ef4444");

    public static final double MODERATE_FROM = 0.2;
    public static final double SEVERE_FROM = 0.5;
    public static final double CRITICAL_FROM = 0.8;

    private final String label;
    private final String color;

    Severity(String label, String color) {
        this.label = label;
        this.color = color;
    }

    public static Severity of(double contribution) {
        if (contribution < MODERATE_FROM) return MILD;
        if (contribution < SEVERE_FROM) return MODERATE;
        if (contribution < CRITICAL_FROM) return SEVERE;
        return CRITICAL;
    }

    public double floor() {
        return switch (this) {
            case MILD -> 0.0;
            case MODERATE -> MODERATE_FROM;
            case SEVERE -> SEVERE_FROM;
            case CRITICAL -> CRITICAL_FROM;
        };
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String color() {
        return color;
    }
}
