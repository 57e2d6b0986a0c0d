package com.repofactor.orchestrator.agent.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Kind of change the analysis plans for a file. */
public enum ChangeType {
    MODIFY,
    CREATE,
    DELETE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing values fall back to MODIFY. */
    @JsonCreator
    public static ChangeType fromWireName(String value) {
        if (value == null) return MODIFY;
        for (ChangeType t : values()) {
            if (t.name().equalsIgnoreCase(value.strip())) return t;
        }
        return MODIFY;
    }
}
