package com.prakash.taskmate.scheduling;

import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Half-open busy range [start, end).
 */
@Value
public class TimeInterval implements Comparable<TimeInterval> {

    LocalDateTime start;
    LocalDateTime end;

    @Override
    public int compareTo(TimeInterval other) {
        return this.start.compareTo(other.start);
    }

    /**
     * Touching ranges do not overlap.
     */
    public boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return !(otherEnd.compareTo(start) <= 0 || otherStart.compareTo(end) >= 0);
    }

    public boolean contains(LocalDateTime time) {
        return !time.isBefore(start) && time.isBefore(end);
    }

    public long getDurationMinutes() {
        return Duration.between(start, end).toMinutes();
    }
}
