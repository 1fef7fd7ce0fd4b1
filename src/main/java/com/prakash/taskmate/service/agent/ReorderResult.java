package com.prakash.taskmate.service.agent;

import com.prakash.taskmate.model.Task;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

@Getter
@ToString
public final class ReorderResult {

    private final boolean success;
    private final List<Task> tasks;
    private final String failureReason;

    private ReorderResult(boolean success, List<Task> tasks, String failureReason) {
        this.success = success;
        this.tasks = tasks;
        this.failureReason = failureReason;
    }

    public static ReorderResult success(List<Task> tasks) {
        return new ReorderResult(true, List.copyOf(tasks), null);
    }

    public static ReorderResult failure(String reason) {
        return new ReorderResult(false, Collections.emptyList(), reason);
    }
}
