package com.crossbot.graph.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Column definition of a CSV export node. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RawCsvItem {

    private final String title;
    private final String type;
    private final String value;

    @JsonCreator
    public RawCsvItem(
            @JsonProperty("csv_title") String title,
            @JsonProperty("csv_type") String type,
            @JsonProperty("csv_value") String value) {
        this.title = title;
        this.type = type;
        this.value = value;
    }

    public String getTitle() {
        return title;
    }

    public String getType() {
        return type;
    }

    public String getValue() {
        return value;
    }
}
