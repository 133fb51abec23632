package tech.noetzold.risk_assessment_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

// declaration order is the severity order
public enum RiskLevel {
    LOW("Low"),
    MODERATE("Moderate"),
    HIGH("High"),
    VERY_HIGH("Very High");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isElevated() {
        return this == HIGH || this == VERY_HIGH;
    }
}
