package com.prakash.taskmate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    /**
     * Lenient lookup used for parser and AI output. Anything that is not
     * low/medium/high (any case) falls back to MEDIUM.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TaskPriority fromLabel(Object value) {
        if (value != null) {
            String label = value.toString().trim();
            for (TaskPriority priority : values()) {
                if (priority.name().equalsIgnoreCase(label)) {
                    return priority;
                }
            }
        }
        return MEDIUM;
    }
}
