package com.flowhouse.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A queryable flow dimension: its column-level name, a human label for forms
 * and a short label used when naming series columns.
 */
public class FieldDescriptor {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("label")
    private final String label;

    @JsonProperty("short_label")
    private final String shortLabel;

    public FieldDescriptor(String name, String label, String shortLabel) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.shortLabel = Objects.requireNonNull(shortLabel, "shortLabel must not be null");
    }

    public String getName() {
        return name;
    }

    public String getLabel() {
        return label;
    }

    public String getShortLabel() {
        return shortLabel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldDescriptor)) {
            return false;
        }
        FieldDescriptor that = (FieldDescriptor) o;
        return name.equals(that.name) && label.equals(that.label) && shortLabel.equals(that.shortLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, label, shortLabel);
    }

    @Override
    public String toString() {
        return "FieldDescriptor{name='" + name + "', label='" + label + "', shortLabel='" + shortLabel + "'}";
    }
}
