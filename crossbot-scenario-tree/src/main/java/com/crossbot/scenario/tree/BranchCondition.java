package com.crossbot.scenario.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Condition under which a node is reached after its parent's action finished, as opposed to being
 * selected by the user. Only nodes with {@link #NONE} are offered as options.
 */
public enum BranchCondition {
    NONE,
    /** Parent action succeeded (e.g. operator accepted the hand-off). */
    ON_SUCCESS,
    /** Parent action failed (e.g. no operator available). */
    ON_FAILURE,
    /** Reached after any outcome. */
    UNCONDITIONAL,
    /** Reached after the parent form was submitted. */
    AFTER_FORM_SUBMIT;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static BranchCondition fromValue(String value) {
        if (value == null || value.isBlank()) return NONE;
        String normalized = value.trim().toUpperCase();
        for (BranchCondition c : values()) {
            if (c.name().equals(normalized)) return c;
        }
        return NONE;
    }

    /** Whether the node is only reachable through an action outcome and must not be shown as an option. */
    public boolean isOutcomeOnly() {
        return this == ON_SUCCESS || this == ON_FAILURE;
    }
}
