package tech.noetzold.risk_assessment_api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class TypedRecord {

    private final SchemaEntry schema;
    private final Map<String, Object> values;
    private final Set<String> provided;

    public TypedRecord(SchemaEntry schema, Map<String, Object> values, Set<String> provided) {
        for (String name : schema.names()) {
            if (!values.containsKey(name)) {
                throw new IllegalArgumentException("typed record lacks schema field " + name);
            }
        }
        this.schema = schema;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.provided = Set.copyOf(provided);
    }

    public SchemaEntry schema() {
        return schema;
    }

    public Map<String, Object> values() {
        return values;
    }

    public Object get(String name) {
        requireField(name);
        return values.get(name);
    }

    public double number(String name) {
        return spec(name).clinicalValue(get(name));
    }

    public boolean flag(String name) {
        return number(name) != 0.0;
    }

    public int level(String name) {
        return (int) number(name);
    }

    public String text(String name) {
        Object value = get(name);
        FieldSpec spec = spec(name);
        return spec.type() == FieldType.ORDINAL ? spec.display(value) : String.valueOf(value);
    }

    public String display(String name) {
        return spec(name).display(get(name));
    }

    public boolean isProvided(String name) {
        return provided.contains(name);
    }

    public int providedCount() {
        return provided.size();
    }

    private FieldSpec spec(String name) {
        return schema.field(name)
                .orElseThrow(() -> new IllegalArgumentException("unknown field " + name));
    }

    private void requireField(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("unknown field " + name);
        }
    }
}
