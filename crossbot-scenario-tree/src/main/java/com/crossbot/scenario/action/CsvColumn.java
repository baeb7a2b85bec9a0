package com.crossbot.scenario.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** One column of a CSV export: header label, value type and default value. */
public final class CsvColumn {

    private final String label;
    private final String type;
    private final String defaultValue;

    @JsonCreator
    public CsvColumn(
            @JsonProperty("label") String label,
            @JsonProperty("type") String type,
            @JsonProperty("defaultValue") String defaultValue) {
        this.label = label;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String getLabel() {
        return label;
    }

    public String getType() {
        return type;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CsvColumn)) return false;
        CsvColumn that = (CsvColumn) o;
        return Objects.equals(label, that.label) && Objects.equals(type, that.type)
                && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, type, defaultValue);
    }
}
