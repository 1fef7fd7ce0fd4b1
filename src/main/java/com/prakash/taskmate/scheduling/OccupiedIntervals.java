package com.prakash.taskmate.scheduling;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Busy ranges of a single scheduling run: every committed slot plus the
 * forced break that trails it. After {@link #merge()} the ranges are sorted
 * by start and pairwise disjoint, with touching ranges fused.
 */
public class OccupiedIntervals {

    public static final Duration FORCED_BREAK = Duration.ofMinutes(5);

    private List<TimeInterval> intervals = new ArrayList<>();

    /**
     * True iff [start, end) is non-empty, lies inside the window and overlaps
     * no occupied range.
     */
    public boolean fits(LocalDateTime start, LocalDateTime end,
                        LocalDateTime windowStart, LocalDateTime windowEnd) {
        if (start.isBefore(windowStart) || end.isAfter(windowEnd) || !start.isBefore(end)) {
            return false;
        }
        return isFree(start, end);
    }

    /**
     * Overlap test only, no window bounds.
     */
    public boolean isFree(LocalDateTime start, LocalDateTime end) {
        for (TimeInterval interval : intervals) {
            if (interval.overlaps(start, end)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Commits a slot and its break, regardless of any configured break length.
     */
    public void addWithBreak(LocalDateTime start, LocalDateTime end) {
        intervals.add(new TimeInterval(start, end));
        intervals.add(new TimeInterval(end, end.plus(FORCED_BREAK)));
    }

    public OccupiedIntervals merge() {
        if (intervals.isEmpty()) {
            return this;
        }
        List<TimeInterval> sorted = new ArrayList<>(intervals);
        Collections.sort(sorted);

        List<TimeInterval> merged = new ArrayList<>();
        TimeInterval current = sorted.get(0);
        for (TimeInterval next : sorted.subList(1, sorted.size())) {
            if (!next.getStart().isAfter(current.getEnd())) {
                LocalDateTime end = next.getEnd().isAfter(current.getEnd()) ? next.getEnd() : current.getEnd();
                current = new TimeInterval(current.getStart(), end);
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        intervals = merged;
        return this;
    }

    /**
     * Moves {@code cursor} past the range containing it, if any. Expects the
     * merged form.
     */
    public LocalDateTime skipOccupied(LocalDateTime cursor) {
        LocalDateTime result = cursor;
        for (TimeInterval interval : intervals) {
            if (interval.contains(result)) {
                result = interval.getEnd();
            }
        }
        return result;
    }

    public List<TimeInterval> asList() {
        return Collections.unmodifiableList(intervals);
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }
}
