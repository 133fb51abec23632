package tech.noetzold.risk_assessment_api.exception;

public class MissingFieldException extends AssessmentException {

    private final String field;

    public MissingFieldException(String field) {
        super("Missing required field: " + field);
        this.field = field;
    }

    @Override
    public String code() {
        return "MISSING_FIELD";
    }

    @Override
    public String field() {
        return field;
    }
}
