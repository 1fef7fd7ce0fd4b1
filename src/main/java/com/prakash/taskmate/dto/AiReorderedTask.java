package com.prakash.taskmate.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// One entry of the reordered task array returned by the model
@Data
@NoArgsConstructor // Required for BeanOutputConverter
@AllArgsConstructor
public class AiReorderedTask {
    // Field names must match the schema named in the reorder prompt
    private String description;
    private String priority;
    private String energy;
    private Object duration; // Minutes; models sometimes answer with a string
}
