package tech.noetzold.risk_assessment_api.exception;

import tech.noetzold.risk_assessment_api.model.FieldType;

public class TypeCoercionException extends AssessmentException {

    private final String field;
    private final FieldType expectedType;
    private final transient Object actualValue;

    public TypeCoercionException(String field, FieldType expectedType, Object actualValue) {
        super("Field " + field + " must be of type " + expectedType.wireName() + " but was '" + actualValue + "'");
        this.field = field;
        this.expectedType = expectedType;
        this.actualValue = actualValue;
    }

    @Override
    public String code() {
        return "TYPE_COERCION";
    }

    @Override
    public String field() {
        return field;
    }

    public FieldType expectedType() {
        return expectedType;
    }

    public Object actualValue() {
        return actualValue;
    }
}
