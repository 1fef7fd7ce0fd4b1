package com.prakash.taskmate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalTime;

/**
 * A user's scheduling preferences. Only the end of the working day feeds the
 * packing algorithm; the rest is forwarded to the reordering prompt.
 */
@Document(collection = "profiles")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfile {

    public static final String DEFAULT_WORK_START = "09:00";
    public static final String DEFAULT_WORK_END = "17:00";

    @Id
    @JsonProperty("user_id")
    private String userId;

    @Valid
    @NotNull(message = "work_hours is required")
    @JsonProperty("work_hours")
    private WorkHours workHours;

    @Min(value = 5, message = "break_duration_min must be at least 5")
    @Max(value = 60, message = "break_duration_min cannot exceed 60")
    @JsonProperty("break_duration_min")
    private Integer breakDurationMin;

    @Valid
    @JsonProperty("energy_levels")
    private EnergyLevels energyLevels;

    /**
     * Profile used when the caller supplies none: 09:00-17:00, 15 minute
     * breaks, energy tapering from morning to evening.
     */
    public static UserProfile defaultProfile() {
        return UserProfile.builder()
                .workHours(new WorkHours(DEFAULT_WORK_START, DEFAULT_WORK_END))
                .breakDurationMin(15)
                .energyLevels(new EnergyLevels(EnergyLevel.HIGH, EnergyLevel.MEDIUM, EnergyLevel.LOW))
                .build();
    }

    /**
     * End of the working day as a time of day. Missing or malformed values
     * fall back to 17:00.
     */
    public LocalTime workdayEnd() {
        String end = workHours != null ? workHours.getEnd() : null;
        if (end == null || !end.matches(WorkHours.HH_MM)) {
            return LocalTime.parse(DEFAULT_WORK_END);
        }
        return LocalTime.parse(end);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WorkHours {

        static final String HH_MM = "^([01]\\d|2[0-3]):[0-5]\\d$";

        @Pattern(regexp = HH_MM, message = "work_hours.start must be HH:MM")
        private String start;

        @Pattern(regexp = HH_MM, message = "work_hours.end must be HH:MM")
        private String end;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EnergyLevels {
        private EnergyLevel morning;
        private EnergyLevel afternoon;
        private EnergyLevel evening;
    }
}
