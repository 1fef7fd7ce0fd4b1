package com.prakash.taskmate.scheduling;

import java.time.LocalTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phrase shapes recognised as a deadline inside a task description.
 * Matching is case-insensitive and tolerates missing spaces ("by9pm").
 * <ul>
 *   <li>{@code before 9 pm}, {@code by 11am}</li>
 *   <li>{@code by 8:30 pm}, {@code before 10 : 15 AM}</li>
 * </ul>
 */
public enum DeadlinePhrase {

    HOUR_MINUTE_MERIDIEM("\\b(?:before|by)\\s*(?<hour>\\d{1,2})\\s*:\\s*(?<minute>\\d{2})\\s*(?<meridiem>am|pm)\\b", true),
    HOUR_MERIDIEM("\\b(?:before|by)\\s*(?<hour>\\d{1,2})\\s*(?<meridiem>am|pm)\\b", false);

    private final Pattern pattern;
    private final boolean withMinutes;

    DeadlinePhrase(String regex, boolean withMinutes) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.withMinutes = withMinutes;
    }

    /**
     * Finds the leftmost deadline phrase in {@code text} across all shapes.
     */
    public static Optional<LocalTime> find(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher earliest = null;
        DeadlinePhrase earliestPhrase = null;
        for (DeadlinePhrase phrase : values()) {
            Matcher matcher = phrase.pattern.matcher(text);
            if (matcher.find() && (earliest == null || matcher.start() < earliest.start())) {
                earliest = matcher;
                earliestPhrase = phrase;
            }
        }
        return earliest == null ? Optional.empty() : earliestPhrase.toTime(earliest);
    }

    private Optional<LocalTime> toTime(Matcher matcher) {
        int hour = Integer.parseInt(matcher.group("hour"));
        int minute = withMinutes ? Integer.parseInt(matcher.group("minute")) : 0;
        if (hour < 1 || hour > 12 || minute > 59) {
            return Optional.empty();
        }
        if (hour == 12) {
            hour = 0;
        }
        if (matcher.group("meridiem").equalsIgnoreCase("pm")) {
            hour += 12;
        }
        return Optional.of(LocalTime.of(hour, minute));
    }
}
