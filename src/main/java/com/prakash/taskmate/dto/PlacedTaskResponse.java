package com.prakash.taskmate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prakash.taskmate.model.PlacedTask;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlacedTaskResponse {

    // 12-hour clock without a leading zero, e.g. "9:05 AM"
    private static final DateTimeFormatter DISPLAY_FORMATTER = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private String description;

    @JsonProperty("start_time")
    private String startTime;

    @JsonProperty("end_time")
    private String endTime;

    public static PlacedTaskResponse fromModel(PlacedTask placedTask) {
        if (placedTask == null) {
            return null;
        }
        return PlacedTaskResponse.builder()
                .description(placedTask.getDescription())
                .startTime(format(placedTask.getStart()))
                .endTime(format(placedTask.getEnd()))
                .build();
    }

    public static String format(LocalDateTime time) {
        return time.format(DISPLAY_FORMATTER);
    }
}
