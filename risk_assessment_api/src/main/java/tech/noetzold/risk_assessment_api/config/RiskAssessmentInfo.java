package tech.noetzold.risk_assessment_api.config;

public final class RiskAssessmentInfo {

    public static final String SERVICE_NAME = "Health Risk Assessment API";
    public static final String VERSION = "1.0.0";

    private RiskAssessmentInfo() {
    }
}
