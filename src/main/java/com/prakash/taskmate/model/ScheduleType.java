package com.prakash.taskmate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Selects the placement window for a scheduling run.
 */
public enum ScheduleType {
    /** Ends at the profile's configured end of the working day. */
    WORK_RELATED("work-related"),
    /** A fixed window of six hours starting from now. */
    PERSONAL("personal");

    private final String label;

    ScheduleType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts "work-related", "WORK_RELATED", "Work-related" and the like.
     * Unknown or missing values select the personal window.
     */
    @JsonCreator
    public static ScheduleType fromLabel(String value) {
        if (value == null) {
            return PERSONAL;
        }
        String normalized = value.trim().replace('_', '-');
        for (ScheduleType type : values()) {
            if (type.label.equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return PERSONAL;
    }
}
