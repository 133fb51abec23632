package tech.noetzold.risk_assessment_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FieldType {
    INTEGER("int"),
    FLOAT("float"),
    BOOLEAN("bool"),
    STRING("str"),
    ORDINAL("ordinal");

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
