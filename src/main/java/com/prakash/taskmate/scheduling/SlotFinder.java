package com.prakash.taskmate.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Grid-stepped slot search against an {@link OccupiedIntervals} set.
 * A candidate is accepted only when the slot fits the window and its
 * trailing forced break is also clear of other busy ranges.
 */
public final class SlotFinder {

    private static final Logger log = LoggerFactory.getLogger(SlotFinder.class);

    /** Twelve hours of quarter-hour steps, plus the starting position. */
    static final int MAX_STEPS = 12 * 4 + 1;

    private SlotFinder() {
    }

    /**
     * Latest slot of {@code durationMinutes} that ends at or before
     * {@code deadline} and starts at or after {@code windowStart}.
     *
     * @param deadline    due time, already clipped to the window end
     * @param occupied    busy ranges, merged
     * @param windowStart earliest permitted start
     * @return the slot, or empty when no candidate fits within the search bound
     */
    public static Optional<TimeInterval> findBackward(LocalDateTime deadline, int durationMinutes,
                                                      OccupiedIntervals occupied, LocalDateTime windowStart) {
        Duration duration = Duration.ofMinutes(durationMinutes);
        LocalDateTime candidateEnd = TimeGrid.roundDown(deadline);
        for (int step = 0; step < MAX_STEPS; step++) {
            LocalDateTime candidateStart = TimeGrid.roundUp(candidateEnd.minus(duration));
            candidateEnd = candidateStart.plus(duration);
            if (accepts(candidateStart, candidateEnd, occupied, windowStart, deadline)) {
                log.debug("Backward slot {} - {} found for deadline {} after {} steps", candidateStart, candidateEnd, deadline, step);
                return Optional.of(new TimeInterval(candidateStart, candidateEnd));
            }
            candidateEnd = candidateEnd.minusMinutes(TimeGrid.STEP_MINUTES);
            if (!candidateEnd.isAfter(windowStart)) {
                break;
            }
        }
        return Optional.empty();
    }

    /**
     * Earliest slot of {@code durationMinutes} starting at or after
     * {@code cursor} (rounded up to the grid) and ending by {@code windowEnd}.
     */
    public static Optional<TimeInterval> findForward(LocalDateTime cursor, int durationMinutes,
                                                     OccupiedIntervals occupied,
                                                     LocalDateTime windowStart, LocalDateTime windowEnd) {
        Duration duration = Duration.ofMinutes(durationMinutes);
        LocalDateTime candidateStart = TimeGrid.roundUp(cursor.isAfter(windowStart) ? cursor : windowStart);
        for (int step = 0; step < MAX_STEPS; step++) {
            LocalDateTime candidateEnd = candidateStart.plus(duration);
            if (accepts(candidateStart, candidateEnd, occupied, windowStart, windowEnd)) {
                log.debug("Forward slot {} - {} found after {} steps", candidateStart, candidateEnd, step);
                return Optional.of(new TimeInterval(candidateStart, candidateEnd));
            }
            candidateStart = candidateStart.plusMinutes(TimeGrid.STEP_MINUTES);
            if (candidateStart.plus(duration).isAfter(windowEnd)) {
                break;
            }
        }
        return Optional.empty();
    }

    private static boolean accepts(LocalDateTime start, LocalDateTime end, OccupiedIntervals occupied,
                                   LocalDateTime windowStart, LocalDateTime windowEnd) {
        return occupied.fits(start, end, windowStart, windowEnd)
                && occupied.isFree(end, end.plus(OccupiedIntervals.FORCED_BREAK));
    }
}
