package com.prakash.taskmate.service;

import com.prakash.taskmate.model.PlacedTask;
import com.prakash.taskmate.model.ScheduleType;
import com.prakash.taskmate.model.Task;
import com.prakash.taskmate.model.UserProfile;
import com.prakash.taskmate.scheduling.DeadlineExtractor;
import com.prakash.taskmate.scheduling.OccupiedIntervals;
import com.prakash.taskmate.scheduling.ScheduleWindow;
import com.prakash.taskmate.scheduling.SlotFinder;
import com.prakash.taskmate.scheduling.TimeInterval;
import com.prakash.taskmate.service.agent.ReorderResult;
import com.prakash.taskmate.service.agent.TaskReorderer;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Packs one day's tasks into a conflict-free timeline.
 * <p>
 * Deadline tasks are placed first, earliest deadline first, each in the
 * latest slot that still finishes on time. The remaining tasks then fill
 * forward from the start of the window in list order. Every slot is followed
 * by a forced five minute break. Tasks that cannot be placed are dropped and
 * logged; nothing here throws for bad input or an unavailable model.
 * </p>
 */
@Service
public class SmartScheduler {

    private static final Logger log = LoggerFactory.getLogger(SmartScheduler.class);

    private final TaskReorderer taskReorderer;

    @Autowired
    public SmartScheduler(TaskReorderer taskReorderer) {
        this.taskReorderer = taskReorderer;
    }

    /**
     * @param tasks        normalised tasks, in the caller's order
     * @param profile      user profile; only the end of the working day is used here
     * @param scheduleType selects the placement window
     * @param now          current time of the run
     * @return placed tasks sorted by start; empty when nothing could be scheduled
     */
    public List<PlacedTask> schedule(List<Task> tasks, UserProfile profile, ScheduleType scheduleType, LocalDateTime now) {
        if (CollectionUtils.isEmpty(tasks)) {
            log.info("No tasks to schedule.");
            return Collections.emptyList();
        }

        // 1. Window
        Optional<ScheduleWindow> resolved = ScheduleWindow.resolve(now, scheduleType, profile);
        if (resolved.isEmpty()) {
            log.info("No schedule possible: the {} window has already closed at {}.", scheduleType.getLabel(), now);
            return Collections.emptyList();
        }
        ScheduleWindow window = resolved.get();
        log.info("Scheduling {} tasks in window {} - {} ({}).", tasks.size(), window.getStartFrom(), window.getEnd(), scheduleType.getLabel());

        // 2. Optional reorder
        List<Task> ordered = reorder(tasks, profile, scheduleType);

        // 3. Partition
        List<DeadlineTask> deadlineTasks = new ArrayList<>();
        List<Task> normalTasks = new ArrayList<>();
        for (Task task : ordered) {
            Optional<LocalDateTime> deadline = DeadlineExtractor.extract(task, now.toLocalDate(), window.getEnd());
            if (deadline.isPresent()) {
                deadlineTasks.add(new DeadlineTask(task, deadline.get()));
            } else {
                normalTasks.add(task);
            }
        }
        log.debug("Partitioned tasks: {} with deadlines, {} without.", deadlineTasks.size(), normalTasks.size());

        OccupiedIntervals occupied = new OccupiedIntervals();
        List<PlacedTask> placed = new ArrayList<>();

        // 4. Backward phase, tightest deadline first
        deadlineTasks.sort(Comparator.comparing(DeadlineTask::getDeadline));
        for (DeadlineTask deadlineTask : deadlineTasks) {
            Task task = deadlineTask.getTask();
            Optional<TimeInterval> slot = SlotFinder.findBackward(deadlineTask.getDeadline(), task.getDurationMinutes(),
                    occupied.merge(), window.getStartFrom());
            if (slot.isEmpty()) {
                log.warn("Dropping task '{}': no slot before deadline {}.", task.getDescription(), deadlineTask.getDeadline());
                continue;
            }
            commit(task, slot.get(), occupied, placed);
        }

        // 5. Forward phase
        occupied.merge();
        LocalDateTime cursor = occupied.skipOccupied(window.getStartFrom());
        for (int i = 0; i < normalTasks.size(); i++) {
            Task task = normalTasks.get(i);
            if (!cursor.isBefore(window.getEnd())) {
                logDropped(normalTasks.subList(i, normalTasks.size()), "window exhausted");
                break;
            }
            Optional<TimeInterval> slot = SlotFinder.findForward(cursor, task.getDurationMinutes(), occupied,
                    window.getStartFrom(), window.getEnd());
            if (slot.isEmpty()) {
                logDropped(normalTasks.subList(i, normalTasks.size()), "window exhausted");
                break;
            }
            commit(task, slot.get(), occupied, placed);
            occupied.merge();
            cursor = slot.get().getEnd().plus(OccupiedIntervals.FORCED_BREAK);
        }

        // 6. Chronological order
        placed.sort(Comparator.comparing(PlacedTask::getStart));
        log.info("Scheduled {} of {} tasks.", placed.size(), tasks.size());
        return placed;
    }

    private List<Task> reorder(List<Task> tasks, UserProfile profile, ScheduleType scheduleType) {
        ReorderResult result;
        try {
            result = taskReorderer.reorder(tasks, profile, scheduleType);
        } catch (RuntimeException e) {
            log.warn("Reorder collaborator threw, keeping original order: {}", e.getMessage(), e);
            return tasks;
        }
        if (result == null || !result.isSuccess() || result.getTasks().isEmpty()) {
            log.warn("Reorder unavailable, keeping original order: {}",
                    result != null ? result.getFailureReason() : "no result");
            return tasks;
        }
        log.debug("Using reordered task list of {} tasks.", result.getTasks().size());
        return restoreDeadlines(result.getTasks(), tasks);
    }

    /**
     * Deadlines do not survive the round trip through the model, so each
     * reordered task takes back the deadline of the original task with the
     * same description.
     */
    private List<Task> restoreDeadlines(List<Task> reordered, List<Task> originals) {
        Map<String, Task> byDescription = new HashMap<>();
        for (Task original : originals) {
            byDescription.putIfAbsent(key(original), original);
        }
        List<Task> restored = new ArrayList<>(reordered.size());
        for (Task task : reordered) {
            Task original = byDescription.get(key(task));
            if (!task.hasDeadline() && original != null && original.hasDeadline()) {
                restored.add(task.toBuilder().deadline(original.getDeadline()).build());
            } else {
                restored.add(task);
            }
        }
        return restored;
    }

    private static String key(Task task) {
        return task.getDescription().trim().toLowerCase(Locale.ROOT);
    }

    private static void commit(Task task, TimeInterval slot, OccupiedIntervals occupied, List<PlacedTask> placed) {
        occupied.addWithBreak(slot.getStart(), slot.getEnd());
        placed.add(new PlacedTask(task.getDescription(), slot.getStart(), slot.getEnd()));
        log.debug("Placed '{}' at {} - {}.", task.getDescription(), slot.getStart(), slot.getEnd());
    }

    private static void logDropped(List<Task> dropped, String reason) {
        for (Task task : dropped) {
            log.warn("Dropping task '{}': {}.", task.getDescription(), reason);
        }
    }

    @Value
    private static class DeadlineTask {
        Task task;
        LocalDateTime deadline;
    }
}
