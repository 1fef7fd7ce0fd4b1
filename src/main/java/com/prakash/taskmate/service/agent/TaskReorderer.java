package com.prakash.taskmate.service.agent;

import com.prakash.taskmate.model.ScheduleType;
import com.prakash.taskmate.model.Task;
import com.prakash.taskmate.model.UserProfile;

import java.util.List;

/**
 * Suggests a better order for a day's tasks. Implementations report failure
 * through the result instead of throwing.
 */
public interface TaskReorderer {

    ReorderResult reorder(List<Task> tasks, UserProfile profile, ScheduleType scheduleType);
}
