package com.prakash.taskmate.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A task as produced by the upstream parser. Fields are loosely typed on
 * purpose: duration may be minutes or a label ("short", "medium", "long")
 * and everything is re-validated before scheduling.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskRequest {

    private String description;
    private String priority;
    private String energy;
    private Object duration;
    private String deadline; // "HH:MM", 24-hour
}
