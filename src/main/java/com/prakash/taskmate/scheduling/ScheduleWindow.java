package com.prakash.taskmate.scheduling;

import com.prakash.taskmate.model.ScheduleType;
import com.prakash.taskmate.model.UserProfile;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Feasible placement region of one scheduling run.
 */
@Value
public class ScheduleWindow {

    public static final Duration PERSONAL_WINDOW = Duration.ofHours(6);

    LocalDateTime startFrom;
    LocalDateTime end;

    /**
     * Starts at {@code now} rounded up to the grid. A work-related window ends
     * at today's end of the working day, a personal one six hours after the
     * start.
     *
     * @return empty when a work-related window would end at or before its start
     */
    public static Optional<ScheduleWindow> resolve(LocalDateTime now, ScheduleType type, UserProfile profile) {
        LocalDateTime startFrom = TimeGrid.roundUp(now);
        if (type == ScheduleType.WORK_RELATED) {
            UserProfile effective = profile != null ? profile : UserProfile.defaultProfile();
            LocalDateTime workdayEnd = LocalDateTime.of(now.toLocalDate(), effective.workdayEnd());
            if (!workdayEnd.isAfter(startFrom)) {
                return Optional.empty();
            }
            return Optional.of(new ScheduleWindow(startFrom, workdayEnd));
        }
        return Optional.of(new ScheduleWindow(startFrom, startFrom.plus(PERSONAL_WINDOW)));
    }

    public boolean contains(LocalDateTime start, LocalDateTime end) {
        return !start.isBefore(startFrom) && !end.isAfter(this.end);
    }
}
