package com.prakash.taskmate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prakash.taskmate.model.UserProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleRequest {

    // "work-related" or "personal"; anything else is treated as personal
    @JsonProperty("schedule_type")
    private String scheduleType;

    // Stored profile to use when no inline profile is given
    @JsonProperty("user_id")
    private String userId;

    @Valid
    private UserProfile profile;

    @NotNull(message = "tasks is required")
    private List<TaskRequest> tasks;
}
