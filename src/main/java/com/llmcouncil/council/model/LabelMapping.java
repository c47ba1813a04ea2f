package com.llmcouncil.council.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bijection between anonymous labels and council models for one turn. Insertion order is the
 * label order ({@code Response A} first).
 */
public final class LabelMapping {

    private static final LabelMapping EMPTY = new LabelMapping(Map.of());

    private final Map<String, String> labelToModel;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public LabelMapping(Map<String, String> labelToModel) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (labelToModel != null) {
            labelToModel.forEach((label, model) -> {
                if (copy.containsValue(model)) {
                    throw new IllegalArgumentException("Model " + model + " mapped to more than one label");
                }
                copy.put(label, model);
            });
        }
        this.labelToModel = Collections.unmodifiableMap(copy);
    }

    public static LabelMapping empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, String> asMap() {
        return labelToModel;
    }

    @Nullable
    public String modelFor(String label) {
        return labelToModel.get(label);
    }

    public boolean containsLabel(String label) {
        return labelToModel.containsKey(label);
    }

    public List<String> labels() {
        return List.copyOf(labelToModel.keySet());
    }

    public int size() {
        return labelToModel.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof LabelMapping other && labelToModel.equals(other.labelToModel);
    }

    @Override
    public int hashCode() {
        return labelToModel.hashCode();
    }

    @Override
    public String toString() {
        return labelToModel.toString();
    }
}
