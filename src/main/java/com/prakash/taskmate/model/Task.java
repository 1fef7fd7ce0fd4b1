package com.prakash.taskmate.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;

/**
 * A task as handed to the scheduler. Values are already normalised:
 * the description is non-blank and the duration lies in [5, 240].
 */
@Value
@Builder(toBuilder = true)
public class Task {

    String description;
    TaskPriority priority;
    EnergyLevel energy;
    int durationMinutes;
    LocalTime deadline; // Time of day the task must finish by, null when there is none

    public boolean hasDeadline() {
        return deadline != null;
    }
}
