package tech.noetzold.risk_assessment_api.model;

import java.util.Arrays;
import java.util.List;

public final class FeatureVector {

    private final List<String> names;
    private final double[] normalized;
    private final double[] clinical;

    public FeatureVector(List<String> names, double[] normalized, double[] clinical) {
        if (names.size() != normalized.length || names.size() != clinical.length) {
            throw new IllegalArgumentException("feature names and values differ in length");
        }
        this.names = List.copyOf(names);
        this.normalized = normalized.clone();
        this.clinical = clinical.clone();
    }

    public int size() {
        return names.size();
    }

    public List<String> names() {
        return names;
    }

    public boolean has(String name) {
        return names.contains(name);
    }

    public double normalized(int index) {
        return normalized[index];
    }

    public double clinical(String name) {
        return clinical[require(name)];
    }

    public double[] toArray() {
        return normalized.clone();
    }

    private int require(String name) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("no feature " + name);
        }
        return index;
    }

    @Override
    public String toString() {
        return "FeatureVector" + names + Arrays.toString(normalized);
    }
}
