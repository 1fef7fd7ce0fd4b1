package com.prakash.taskmate.scheduling;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Quarter-hour grid to which every slot boundary is snapped.
 * Both roundings drop seconds first and are idempotent.
 */
public final class TimeGrid {

    public static final int STEP_MINUTES = 15;

    private static final int[] GRID_MINUTES = {0, 15, 30, 45};

    private TimeGrid() {
    }

    /**
     * Snaps to the smallest grid mark at or after {@code time}, rolling into
     * the next hour past :45.
     */
    public static LocalDateTime roundUp(LocalDateTime time) {
        LocalDateTime truncated = time.truncatedTo(ChronoUnit.MINUTES);
        int minute = truncated.getMinute();
        for (int mark : GRID_MINUTES) {
            if (minute <= mark) {
                return truncated.withMinute(mark);
            }
        }
        return truncated.plusHours(1).withMinute(GRID_MINUTES[0]);
    }

    /**
     * Snaps to the greatest grid mark at or before {@code time}.
     */
    public static LocalDateTime roundDown(LocalDateTime time) {
        LocalDateTime truncated = time.truncatedTo(ChronoUnit.MINUTES);
        int minute = truncated.getMinute();
        for (int i = GRID_MINUTES.length - 1; i >= 0; i--) {
            if (GRID_MINUTES[i] <= minute) {
                return truncated.withMinute(GRID_MINUTES[i]);
            }
        }
        return truncated.minusHours(1).withMinute(GRID_MINUTES[GRID_MINUTES.length - 1]);
    }

    public static boolean isOnGrid(LocalDateTime time) {
        return roundDown(time).equals(time);
    }
}
