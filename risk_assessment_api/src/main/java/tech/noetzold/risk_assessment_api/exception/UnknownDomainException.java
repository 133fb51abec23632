package tech.noetzold.risk_assessment_api.exception;

import java.util.Collection;

public class UnknownDomainException extends AssessmentException {

    private final String domain;

    public UnknownDomainException(String domain, Collection<String> available) {
        super("Predictor '" + domain + "' not found. Available predictors: " + available);
        this.domain = domain;
    }

    @Override
    public String code() {
        return "UNKNOWN_DOMAIN";
    }

    public String domain() {
        return domain;
    }
}
