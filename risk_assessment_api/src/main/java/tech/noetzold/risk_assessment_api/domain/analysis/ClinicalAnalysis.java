package tech.noetzold.risk_assessment_api.domain.analysis;

import tech.noetzold.risk_assessment_api.domain.FactorAnalysis;
import tech.noetzold.risk_assessment_api.model.ContributingFactor;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.model.Severity;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.LinkedHashMap;
import java.util.Map;

abstract class ClinicalAnalysis implements FactorAnalysis {

    private static final double SEVERITY_OFFSET = 0.15;

    // contribution sits inside the severity bucket
    protected ContributingFactor finding(TypedRecord record, String field, String label,
                                         Severity severity, String description, String remediation) {
        FieldSpec spec = record.schema().field(field)
                .orElseThrow(() -> new IllegalArgumentException("unknown field " + field));
        Object value = record.get(field);
        return new ContributingFactor(field, label, value, spec.normalize(value),
                severity.floor() + SEVERITY_OFFSET, severity, description, remediation);
    }

    protected static Map<String, Object> metric(Object value, String key, String category) {
        Map<String, Object> metric = new LinkedHashMap<>();
        metric.put("value", value);
        metric.put(key, category);
        return metric;
    }

    protected static String band(double value, double moderateAbove, double highAbove,
                                 String low, String moderate, String high) {
        if (value > highAbove) return high;
        if (value > moderateAbove) return moderate;
        return low;
    }
}
