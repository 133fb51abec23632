package tech.noetzold.risk_assessment_api.exception;

public class ScoringConfigurationException extends AssessmentException {

    public ScoringConfigurationException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "SCORING_CONFIGURATION";
    }
}
