package tech.noetzold.risk_assessment_api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// declaration order is the feature vector order
public final class SchemaEntry {

    private final Map<String, FieldSpec> fields;
    private final List<String> names;

    public SchemaEntry(List<FieldSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("schema needs at least one field");
        }
        Map<String, FieldSpec> ordered = new LinkedHashMap<>();
        for (FieldSpec spec : specs) {
            if (ordered.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("duplicate field " + spec.name());
            }
        }
        this.fields = Collections.unmodifiableMap(ordered);
        this.names = List.copyOf(ordered.keySet());
    }

    public List<FieldSpec> fields() {
        return List.copyOf(fields.values());
    }

    public List<String> names() {
        return names;
    }

    public Optional<FieldSpec> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public int size() {
        return names.size();
    }

    public Map<String, String> types() {
        Map<String, String> types = new LinkedHashMap<>();
        fields.forEach((name, spec) -> types.put(name, spec.type().wireName()));
        return types;
    }

    public Map<String, String> descriptions() {
        Map<String, String> descriptions = new LinkedHashMap<>();
        fields.forEach((name, spec) -> descriptions.put(name, spec.description()));
        return descriptions;
    }
}
