package tech.noetzold.risk_assessment_api.exception;

public class AnalysisUnsupportedException extends AssessmentException {

    public AnalysisUnsupportedException(String domain) {
        super("Predictor '" + domain + "' does not support enhanced analysis");
    }

    @Override
    public String code() {
        return "ANALYSIS_UNSUPPORTED";
    }
}
