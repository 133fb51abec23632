package tech.noetzold.risk_assessment_api.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * One input field of a domain schema. Unclamped numeric fields may normalize above 1.0.
 * A protective field lowers risk as its value rises.
 */
public record FieldSpec(
        String name,
        FieldType type,
        String description,
        Double weight,
        Double scale,
        boolean clamped,
        boolean protective,
        List<String> labels,
        Integer maxLevel,
        Object defaultValue
) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("field name is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("field type is required for " + name);
        }
        if (type.isNumeric() && (scale == null || scale <= 0.0)) {
            throw new IllegalArgumentException("numeric field " + name + " needs a positive scale");
        }
        if (type == FieldType.ORDINAL && (maxLevel == null || maxLevel < 1)) {
            throw new IllegalArgumentException("ordinal field " + name + " needs at least two levels");
        }
        labels = labels == null ? List.of() : List.copyOf(labels);
        description = description == null ? name : description;
    }

    public static FieldSpec integer(String name, String description, double scale) {
        return new FieldSpec(name, FieldType.INTEGER, description, null, scale, false, false, List.of(), null, null);
    }

    public static FieldSpec decimal(String name, String description, double scale) {
        return new FieldSpec(name, FieldType.FLOAT, description, null, scale, false, false, List.of(), null, null);
    }

    public static FieldSpec flag(String name, String description) {
        return new FieldSpec(name, FieldType.BOOLEAN, description, null, null, false, false, List.of(), null, null);
    }

    public static FieldSpec ordinal(String name, String description, int maxLevel) {
        return new FieldSpec(name, FieldType.ORDINAL, description, null, null, false, false, List.of(), maxLevel, null);
    }

    public static FieldSpec choice(String name, String description, String... labels) {
        return new FieldSpec(name, FieldType.ORDINAL, description, null, null, false, false, List.of(labels),
                labels.length - 1, null);
    }

    public static FieldSpec text(String name, String description) {
        return new FieldSpec(name, FieldType.STRING, description, null, null, false, false, List.of(), null, null);
    }

    public FieldSpec weight(double weight) {
        return new FieldSpec(name, type, description, weight, scale, clamped, protective, labels, maxLevel, defaultValue);
    }

    public FieldSpec clamp() {
        return new FieldSpec(name, type, description, weight, scale, true, protective, labels, maxLevel, defaultValue);
    }

    public FieldSpec protect() {
        return new FieldSpec(name, type, description, weight, scale, clamped, true, labels, maxLevel, defaultValue);
    }

    public FieldSpec defaultingTo(Object value) {
        return new FieldSpec(name, type, description, weight, scale, clamped, protective, labels, maxLevel, value);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean raisesRisk(double normalized) {
        return protective ? normalized < 0.5 : normalized > 0.5;
    }

    // booleans read as 1/0, ordinals as their level
    public double clinicalValue(Object typed) {
        return switch (type) {
            case INTEGER, FLOAT, ORDINAL -> ((Number) typed).doubleValue();
            case BOOLEAN -> Boolean.TRUE.equals(typed) ? 1.0 : 0.0;
            case STRING -> 0.0;
        };
    }

    public double normalize(Object typed) {
        double normalized = switch (type) {
            case INTEGER, FLOAT -> ((Number) typed).doubleValue() / scale;
            case BOOLEAN -> Boolean.TRUE.equals(typed) ? 1.0 : 0.0;
            case ORDINAL -> ((Number) typed).doubleValue() / maxLevel;
            // free text carries no magnitude
            case STRING -> 0.5;
        };
        return clamped ? Math.max(0.0, Math.min(1.0, normalized)) : normalized;
    }

    public String display(Object typed) {
        if (typed == null) return "";
        if (type == FieldType.ORDINAL && !labels.isEmpty()) {
            return labels.get(((Number) typed).intValue());
        }
        if (typed instanceof Double d) {
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (typed instanceof Boolean b) {
            return b ? "yes" : "no";
        }
        return String.valueOf(typed);
    }
}
