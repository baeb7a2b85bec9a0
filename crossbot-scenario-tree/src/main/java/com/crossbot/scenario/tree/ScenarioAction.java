package com.crossbot.scenario.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Side effect or control transfer declared by a compiled node. JSON uses the enum name;
 * unknown or missing values deserialize as {@link #NONE}.
 */
public enum ScenarioAction {
    /** Opens an external URL. */
    LINK,
    /** Hands the conversation over to a human operator. */
    HANDOVER,
    /** Shows a form and collects its fields. */
    FORM,
    /** Returns to the scenario start. */
    RESTART,
    /** Continues at another node referenced by name. */
    JUMP,
    MAIL,
    CSV,
    /** Marks an abandonment point; the conversation ends here. */
    DROP_OFF,
    NONE;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static ScenarioAction fromValue(String value) {
        if (value == null || value.isBlank()) return NONE;
        String normalized = value.trim().toUpperCase();
        for (ScenarioAction a : values()) {
            if (a.name().equals(normalized)) return a;
        }
        return NONE;
    }
}
