package com.crossbot.scenario.action;

import com.crossbot.scenario.tree.ScenarioAction;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Form shown to the user; {@code fields} are the memory slots the form fills. */
public final class FormConfig implements ActionConfig {

    private final String formId;
    private final List<String> fields;

    @JsonCreator
    public FormConfig(
            @JsonProperty("formId") String formId,
            @JsonProperty("fields") List<String> fields) {
        this.formId = formId;
        this.fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public String getFormId() {
        return formId;
    }

    public List<String> getFields() {
        return fields;
    }

    @Override
    public ScenarioAction action() {
        return ScenarioAction.FORM;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FormConfig)) return false;
        FormConfig that = (FormConfig) o;
        return Objects.equals(formId, that.formId) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(formId, fields);
    }
}
