package com.prakash.taskmate.service;

import com.prakash.taskmate.model.EnergyLevel;
import com.prakash.taskmate.model.PlacedTask;
import com.prakash.taskmate.model.ScheduleType;
import com.prakash.taskmate.model.Task;
import com.prakash.taskmate.model.TaskPriority;
import com.prakash.taskmate.model.UserProfile;
import com.prakash.taskmate.scheduling.OccupiedIntervals;
import com.prakash.taskmate.scheduling.TimeGrid;
import com.prakash.taskmate.service.agent.ReorderResult;
import com.prakash.taskmate.service.agent.TaskReorderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SmartSchedulerTest {

    private TaskReorderer taskReorderer;
    private SmartScheduler smartScheduler;
    private UserProfile profile;

    private static LocalDateTime at(int hour, int minute) {
        return LocalDateTime.of(2025, 6, 2, hour, minute);
    }

    private static Task task(String description, int minutes) {
        return task(description, minutes, null);
    }

    private static Task task(String description, int minutes, LocalTime deadline) {
        return Task.builder()
                .description(description)
                .priority(TaskPriority.MEDIUM)
                .energy(EnergyLevel.MEDIUM)
                .durationMinutes(minutes)
                .deadline(deadline)
                .build();
    }

    @BeforeEach
    void setup() {
        taskReorderer = mock(TaskReorderer.class);
        when(taskReorderer.reorder(anyList(), any(), any())).thenReturn(ReorderResult.failure("disabled in test"));
        smartScheduler = new SmartScheduler(taskReorderer);
        profile = UserProfile.builder()
                .workHours(new UserProfile.WorkHours("09:00", "17:00"))
                .breakDurationMin(15)
                .build();
    }

    @Test
    void personalTasksFillForwardSeparatedByBreaks() {
        List<PlacedTask> placed = smartScheduler.schedule(
                List.of(task("Write notes", 30), task("Groceries", 45)), profile, ScheduleType.PERSONAL, at(9, 0));

        assertThat(placed).containsExactly(
                new PlacedTask("Write notes", at(9, 0), at(9, 30)),
                new PlacedTask("Groceries", at(9, 45), at(10, 30)));
    }

    @Test
    void deadlineTaskIsPlacedRightBeforeItsDeadline() {
        List<PlacedTask> placed = smartScheduler.schedule(
                List.of(task("Prepare slides", 30, LocalTime.of(10, 0))), profile, ScheduleType.PERSONAL, at(9, 0));

        assertThat(placed).containsExactly(new PlacedTask("Prepare slides", at(9, 30), at(10, 0)));
    }

    @Test
    void earliestDeadlineClaimsItsSlotFirst() {
        List<Task> tasks = List.of(
                task("Review PR", 30, LocalTime.of(10, 0)),
                task("Call plumber", 15, LocalTime.of(9, 30)));

        List<PlacedTask> placed = smartScheduler.schedule(tasks, profile, ScheduleType.PERSONAL, at(8, 0));

        assertThat(placed).containsExactly(
                new PlacedTask("Review PR", at(8, 30), at(9, 0)),
                new PlacedTask("Call plumber", at(9, 15), at(9, 30)));
        assertNoOverlapIncludingBreaks(placed);
    }

    @Test
    void taskLongerThanRemainingWindowIsDroppedWithTheRest() {
        List<Task> tasks = List.of(task("Reply emails", 15), task("Write report", 60), task("Tidy desk", 10));

        List<PlacedTask> placed = smartScheduler.schedule(tasks, profile, ScheduleType.WORK_RELATED, at(16, 20));

        assertThat(placed).containsExactly(new PlacedTask("Reply emails", at(16, 30), at(16, 45)));
    }

    @Test
    void closedWorkdayYieldsEmptySchedule() {
        List<Task> tasks = List.of(task("Reply emails", 15));

        assertThat(smartScheduler.schedule(tasks, profile, ScheduleType.WORK_RELATED, at(17, 0))).isEmpty();
        assertThat(smartScheduler.schedule(tasks, profile, ScheduleType.WORK_RELATED, at(16, 50))).isEmpty();
        verifyNoInteractions(taskReorderer);
    }

    @Test
    void emptyTaskListYieldsEmptySchedule() {
        assertThat(smartScheduler.schedule(List.of(), profile, ScheduleType.PERSONAL, at(9, 0))).isEmpty();
    }

    @Test
    void workWindowDefaultsToFivePmWithoutProfile() {
        List<PlacedTask> placed = smartScheduler.schedule(
                List.of(task("Wrap up", 30, LocalTime.of(23, 0))), null, ScheduleType.WORK_RELATED, at(14, 0));

        assertThat(placed).containsExactly(new PlacedTask("Wrap up", at(16, 30), at(17, 0)));
    }

    @Test
    void deadlinePhraseInDescriptionIsHonoured() {
        List<PlacedTask> placed = smartScheduler.schedule(
                List.of(task("Dinner before 11 am", 30)), profile, ScheduleType.PERSONAL, at(9, 0));

        assertThat(placed).containsExactly(new PlacedTask("Dinner before 11 am", at(10, 30), at(11, 0)));
    }

    @Test
    void deadlineBeyondWindowIsClippedToWindowEnd() {
        List<PlacedTask> placed = smartScheduler.schedule(
                List.of(task("Laundry", 30, LocalTime.of(20, 0))), profile, ScheduleType.PERSONAL, at(9, 0));

        assertThat(placed).containsExactly(new PlacedTask("Laundry", at(14, 30), at(15, 0)));
    }

    @Test
    void unplaceableDeadlineTaskIsDroppedButOthersContinue() {
        List<Task> tasks = List.of(task("Impossible", 60, LocalTime.of(9, 30)), task("Stretch", 15));

        List<PlacedTask> placed = smartScheduler.schedule(tasks, profile, ScheduleType.PERSONAL, at(9, 0));

        assertThat(placed).containsExactly(new PlacedTask("Stretch", at(9, 0), at(9, 15)));
    }

    @Test
    void forwardCursorSkipsDeadlineSlotAtWindowStart() {
        List<Task> tasks = List.of(task("Standup notes", 15), task("Send invoice", 30, LocalTime.of(9, 30)));

        List<PlacedTask> placed = smartScheduler.schedule(tasks, profile, ScheduleType.PERSONAL, at(9, 0));

        assertThat(placed).containsExactly(
                new PlacedTask("Send invoice", at(9, 0), at(9, 30)),
                new PlacedTask("Standup notes", at(9, 45), at(10, 0)));
    }

    @Test
    void reorderedListIsUsedAndDeadlinesAreRestored() {
        Task errands = task("Errands", 30);
        Task lunch = task("Lunch with Sam", 30, LocalTime.of(12, 0));
        when(taskReorderer.reorder(anyList(), any(), any())).thenReturn(ReorderResult.success(List.of(
                task("lunch with sam", 30), task("Deep work", 60), errands)));

        List<PlacedTask> placed = smartScheduler.schedule(List.of(errands, lunch), profile, ScheduleType.PERSONAL, at(9, 0));

        assertThat(placed).containsExactly(
                new PlacedTask("Deep work", at(9, 0), at(10, 0)),
                new PlacedTask("Errands", at(10, 15), at(10, 45)),
                new PlacedTask("lunch with sam", at(11, 30), at(12, 0)));
    }

    @Test
    void reorderFailureKeepsOriginalOrder() {
        when(taskReorderer.reorder(anyList(), any(), any())).thenThrow(new IllegalStateException("model offline"));

        List<PlacedTask> placed = smartScheduler.schedule(
                List.of(task("First", 15), task("Second", 15)), profile, ScheduleType.PERSONAL, at(9, 0));

        assertThat(placed).extracting(PlacedTask::getDescription).containsExactly("First", "Second");
    }

    @Test
    void mixedDayRespectsEveryPlacementProperty() {
        Map<String, LocalTime> deadlines = Map.of(
                "Pick up parcel", LocalTime.of(11, 0),
                "Pay rent", LocalTime.of(10, 0),
                "Call dentist", LocalTime.of(13, 5));
        List<Task> tasks = List.of(
                task("Deep work", 90),
                task("Pick up parcel", 20, deadlines.get("Pick up parcel")),
                task("Read", 45),
                task("Pay rent", 10, deadlines.get("Pay rent")),
                task("Workout", 60),
                task("Call dentist", 15, deadlines.get("Call dentist")),
                task("Plan week", 25));
        Map<String, Integer> durations = Map.of(
                "Deep work", 90, "Pick up parcel", 20, "Read", 45, "Pay rent", 10,
                "Workout", 60, "Call dentist", 15, "Plan week", 25);
        LocalDateTime now = at(9, 7);
        LocalDateTime windowStart = at(9, 15);
        LocalDateTime windowEnd = at(15, 15);

        List<PlacedTask> placed = smartScheduler.schedule(tasks, profile, ScheduleType.PERSONAL, now);

        assertThat(placed).extracting(PlacedTask::getDescription).contains("Pay rent", "Pick up parcel", "Call dentist");
        assertThat(placed).isSortedAccordingTo((a, b) -> a.getStart().compareTo(b.getStart()));
        assertNoOverlapIncludingBreaks(placed);
        for (PlacedTask p : placed) {
            assertThat(p.getDurationMinutes()).isEqualTo(durations.get(p.getDescription()).longValue());
            assertThat(p.getStart()).isAfterOrEqualTo(windowStart);
            assertThat(p.getEnd()).isBeforeOrEqualTo(windowEnd);
            assertThat(TimeGrid.isOnGrid(p.getStart())).isTrue();
            LocalTime deadline = deadlines.get(p.getDescription());
            if (deadline != null) {
                assertThat(p.getEnd().toLocalTime()).isBeforeOrEqualTo(deadline);
            }
        }
    }

    private static void assertNoOverlapIncludingBreaks(List<PlacedTask> placed) {
        Duration brk = OccupiedIntervals.FORCED_BREAK;
        for (int i = 0; i < placed.size(); i++) {
            for (int j = i + 1; j < placed.size(); j++) {
                PlacedTask a = placed.get(i);
                PlacedTask b = placed.get(j);
                boolean disjoint = !a.getEnd().plus(brk).isAfter(b.getStart()) || !b.getEnd().plus(brk).isAfter(a.getStart());
                assertThat(disjoint).as("%s and %s overlap", a, b).isTrue();
            }
        }
    }
}
