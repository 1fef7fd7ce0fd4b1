package com.prakash.taskmate.service;

import com.prakash.taskmate.dto.AiReorderedTask;
import com.prakash.taskmate.dto.TaskRequest;
import com.prakash.taskmate.model.EnergyLevel;
import com.prakash.taskmate.model.Task;
import com.prakash.taskmate.model.TaskPriority;
import com.prakash.taskmate.scheduling.DeadlineExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Re-validates tasks coming from outside the scheduler, whether from the
 * upstream parser or from the reordering model. Invalid values are coerced,
 * never rejected; only tasks without a description are skipped.
 */
@Component
public class TaskNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TaskNormalizer.class);

    public static final int MIN_DURATION_MINUTES = 5;
    public static final int MAX_DURATION_MINUTES = 240;
    public static final int DEFAULT_DURATION_MINUTES = 30;

    public List<Task> normalizeRequests(List<TaskRequest> requests) {
        List<Task> tasks = new ArrayList<>();
        if (CollectionUtils.isEmpty(requests)) {
            return tasks;
        }
        for (TaskRequest request : requests) {
            if (request == null) {
                continue;
            }
            normalize(request.getDescription(), request.getPriority(), request.getEnergy(),
                    request.getDuration(), request.getDeadline())
                    .ifPresent(tasks::add);
        }
        log.debug("Normalized {} of {} incoming tasks.", tasks.size(), requests.size());
        return tasks;
    }

    /**
     * The model does not return deadlines, so reordered tasks never carry one.
     */
    public List<Task> normalizeReordered(List<AiReorderedTask> items) {
        List<Task> tasks = new ArrayList<>();
        if (CollectionUtils.isEmpty(items)) {
            return tasks;
        }
        for (AiReorderedTask item : items) {
            if (item == null) {
                continue;
            }
            normalize(item.getDescription(), item.getPriority(), item.getEnergy(), item.getDuration(), null)
                    .ifPresent(tasks::add);
        }
        return tasks;
    }

    public Optional<Task> normalize(String description, String priority, String energy,
                                    Object duration, String deadline) {
        String trimmed = description == null ? "" : description.trim();
        if (trimmed.isEmpty()) {
            log.debug("Skipping task without a description.");
            return Optional.empty();
        }
        LocalTime deadlineTime = DeadlineExtractor.parseClockTime(deadline).orElse(null);
        if (deadline != null && !deadline.isBlank() && deadlineTime == null) {
            log.debug("Ignoring malformed deadline '{}' for task '{}'.", deadline, trimmed);
        }
        return Optional.of(Task.builder()
                .description(trimmed)
                .priority(TaskPriority.fromLabel(priority))
                .energy(EnergyLevel.fromLabel(energy))
                .durationMinutes(coerceDuration(duration))
                .deadline(deadlineTime)
                .build());
    }

    /**
     * Minutes from an integer, a numeric string or a label
     * (short=15, medium=30, long=60), clamped to [5, 240]. Anything else is 30.
     */
    public static int coerceDuration(Object value) {
        int minutes;
        if (value == null) {
            minutes = DEFAULT_DURATION_MINUTES;
        } else if (value instanceof Number) {
            minutes = ((Number) value).intValue();
        } else {
            String label = value.toString().trim().toLowerCase(Locale.ROOT);
            switch (label) {
                case "short":
                    minutes = 15;
                    break;
                case "medium":
                    minutes = 30;
                    break;
                case "long":
                    minutes = 60;
                    break;
                default:
                    minutes = parseMinutes(label);
            }
        }
        return Math.max(MIN_DURATION_MINUTES, Math.min(minutes, MAX_DURATION_MINUTES));
    }

    private static int parseMinutes(String label) {
        try {
            return Integer.parseInt(label);
        } catch (NumberFormatException e) {
            log.debug("Unrecognised duration '{}', using {} minutes.", label, DEFAULT_DURATION_MINUTES);
            return DEFAULT_DURATION_MINUTES;
        }
    }
}
