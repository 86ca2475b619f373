package com.flowhouse.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A flow field together with the selectable options derived from it: the field
 * itself first, then one option per attribute of its bound dictionary.
 */
public class FieldGroup {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("label")
    private final String label;

    @JsonProperty("fields")
    private final List<Option> fields = new ArrayList<>();

    public FieldGroup(String name, String label) {
        this.name = name;
        this.label = label;
    }

    public String getName() {
        return name;
    }

    public String getLabel() {
        return label;
    }

    public List<Option> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public void addOption(String optionName, String optionLabel) {
        fields.add(new Option(optionName, optionLabel));
    }

    /**
     * One selectable breakdown or filter field.
     */
    public static class Option {

        @JsonProperty("name")
        private final String name;

        @JsonProperty("label")
        private final String label;

        public Option(String name, String label) {
            this.name = name;
            this.label = label;
        }

        public String getName() {
            return name;
        }

        public String getLabel() {
            return label;
        }
    }
}
