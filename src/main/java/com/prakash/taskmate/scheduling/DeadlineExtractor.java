package com.prakash.taskmate.scheduling;

import com.prakash.taskmate.model.Task;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves the absolute due time of a task: the structured deadline first,
 * then a phrase such as "by 8:30 pm" in the description. The result is
 * clipped to the window end.
 */
public final class DeadlineExtractor {

    private static final Pattern CLOCK_TIME = Pattern.compile("^\\d{2}:\\d{2}$");

    private DeadlineExtractor() {
    }

    public static Optional<LocalDateTime> extract(Task task, LocalDate day, LocalDateTime windowEnd) {
        Optional<LocalTime> timeOfDay = Optional.ofNullable(task.getDeadline());
        if (timeOfDay.isEmpty()) {
            timeOfDay = DeadlinePhrase.find(task.getDescription());
        }
        return timeOfDay
                .map(time -> LocalDateTime.of(day, time))
                .map(deadline -> deadline.isAfter(windowEnd) ? windowEnd : deadline);
    }

    /**
     * Parses a strict 24-hour {@code HH:MM} value. Anything else, including
     * out-of-range values such as "25:00", yields empty.
     */
    public static Optional<LocalTime> parseClockTime(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (!CLOCK_TIME.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalTime.parse(trimmed));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
