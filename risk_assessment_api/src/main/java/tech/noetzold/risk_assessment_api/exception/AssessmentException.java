package tech.noetzold.risk_assessment_api.exception;

/**
 * Root of the assessment error taxonomy. {@link #code()} is the stable identifier
 * exposed to API clients.
 */
public abstract class AssessmentException extends RuntimeException {

    protected AssessmentException(String message) {
        super(message);
    }

    protected AssessmentException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();

    /** Offending input field, when the error concerns one. */
    public String field() {
        return null;
    }
}
