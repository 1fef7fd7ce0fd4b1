package com.prakash.taskmate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

// Energy a task demands, or the user's energy during a part of the day
public enum EnergyLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EnergyLevel fromLabel(Object value) {
        if (value != null) {
            String label = value.toString().trim();
            for (EnergyLevel level : values()) {
                if (level.name().equalsIgnoreCase(label)) {
                    return level;
                }
            }
        }
        return MEDIUM;
    }
}
