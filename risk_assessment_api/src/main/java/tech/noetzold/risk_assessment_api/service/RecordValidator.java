package tech.noetzold.risk_assessment_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.risk_assessment_api.exception.MissingFieldException;
import tech.noetzold.risk_assessment_api.exception.TypeCoercionException;
import tech.noetzold.risk_assessment_api.model.FeatureVector;
import tech.noetzold.risk_assessment_api.model.FieldSpec;
import tech.noetzold.risk_assessment_api.model.FieldType;
import tech.noetzold.risk_assessment_api.model.SchemaEntry;
import tech.noetzold.risk_assessment_api.model.TypedRecord;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class RecordValidator {

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y", "1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "n", "0");

    public FeatureVector validateAndNormalize(Map<String, Object> raw, SchemaEntry schema) {
        return normalize(coerce(raw, schema));
    }

    public TypedRecord coerce(Map<String, Object> raw, SchemaEntry schema) {
        Map<String, Object> source = raw != null ? raw : Map.of();
        Map<String, Object> typed = new LinkedHashMap<>();
        Set<String> provided = new HashSet<>();

        for (FieldSpec spec : schema.fields()) {
            Object value = source.get(spec.name());
            if (value == null) {
                if (!spec.hasDefault()) {
                    throw new MissingFieldException(spec.name());
                }
                typed.put(spec.name(), coerceValue(spec, spec.defaultValue()));
                continue;
            }
            typed.put(spec.name(), coerceValue(spec, value));
            if (!(value instanceof String s && s.isBlank())) {
                provided.add(spec.name());
            }
        }
        return new TypedRecord(schema, typed, provided);
    }

    public FeatureVector normalize(TypedRecord typed) {
        List<FieldSpec> specs = typed.schema().fields();
        double[] normalized = new double[specs.size()];
        double[] clinical = new double[specs.size()];
        for (int i = 0; i < specs.size(); i++) {
            FieldSpec spec = specs.get(i);
            Object value = typed.get(spec.name());
            normalized[i] = spec.normalize(value);
            clinical[i] = spec.clinicalValue(value);
        }
        return new FeatureVector(typed.schema().names(), normalized, clinical);
    }

    Object coerceValue(FieldSpec spec, Object value) {
        return switch (spec.type()) {
            case INTEGER -> toInteger(spec, value);
            case FLOAT -> toFloat(spec, value);
            case BOOLEAN -> toBoolean(spec, value);
            case ORDINAL -> toLevel(spec, value);
            case STRING -> String.valueOf(value);
        };
    }

    private Integer toInteger(FieldSpec spec, Object value) {
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        double d = toFiniteDouble(spec, value, FieldType.INTEGER);
        if (d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) {
            throw new TypeCoercionException(spec.name(), FieldType.INTEGER, value);
        }
        return (int) d;
    }

    private Double toFloat(FieldSpec spec, Object value) {
        if (value instanceof Boolean) {
            throw new TypeCoercionException(spec.name(), FieldType.FLOAT, value);
        }
        return toFiniteDouble(spec, value, FieldType.FLOAT);
    }

    private Boolean toBoolean(FieldSpec spec, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == 0.0) return false;
            if (d == 1.0) return true;
        } else if (value instanceof String s) {
            String word = s.trim().toLowerCase(Locale.ROOT);
            if (TRUE_WORDS.contains(word)) return true;
            if (FALSE_WORDS.contains(word)) return false;
        }
        throw new TypeCoercionException(spec.name(), FieldType.BOOLEAN, value);
    }

    private Integer toLevel(FieldSpec spec, Object value) {
        if (value instanceof String s) {
            String label = s.trim();
            List<String> labels = spec.labels();
            for (int i = 0; i < labels.size(); i++) {
                if (labels.get(i).equalsIgnoreCase(label)) {
                    return i;
                }
            }
        }
        if (value instanceof Boolean) {
            throw new TypeCoercionException(spec.name(), FieldType.ORDINAL, value);
        }
        double d = toFiniteDouble(spec, value, FieldType.ORDINAL);
        if (d != Math.rint(d) || d < 0 || d > spec.maxLevel()) {
            throw new TypeCoercionException(spec.name(), FieldType.ORDINAL, value);
        }
        return (int) d;
    }

    private double toFiniteDouble(FieldSpec spec, Object value, FieldType expected) {
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new TypeCoercionException(spec.name(), expected, value);
            }
        } else {
            throw new TypeCoercionException(spec.name(), expected, value);
        }
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new TypeCoercionException(spec.name(), expected, value);
        }
        return d;
    }
}
