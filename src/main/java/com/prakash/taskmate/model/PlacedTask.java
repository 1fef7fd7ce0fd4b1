package com.prakash.taskmate.model;

import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

@Value
public class PlacedTask {

    String description;
    LocalDateTime start;
    LocalDateTime end;

    public long getDurationMinutes() {
        return Duration.between(start, end).toMinutes();
    }
}
