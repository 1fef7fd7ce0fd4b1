package com.prakash.taskmate.controller;

import com.prakash.taskmate.dto.PlacedTaskResponse;
import com.prakash.taskmate.dto.ScheduleRequest;
import com.prakash.taskmate.exception.ProfileNotFoundException;
import com.prakash.taskmate.model.PlacedTask;
import com.prakash.taskmate.model.ScheduleType;
import com.prakash.taskmate.model.Task;
import com.prakash.taskmate.model.UserProfile;
import com.prakash.taskmate.service.SmartScheduler;
import com.prakash.taskmate.service.TaskNormalizer;
import com.prakash.taskmate.service.UserProfileService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/schedules")
public class ScheduleController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleController.class);

    private final SmartScheduler smartScheduler;
    private final TaskNormalizer taskNormalizer;
    private final UserProfileService userProfileService;
    private final Clock clock;

    @Autowired
    public ScheduleController(SmartScheduler smartScheduler,
                              TaskNormalizer taskNormalizer,
                              UserProfileService userProfileService,
                              Clock clock) {
        this.smartScheduler = smartScheduler;
        this.taskNormalizer = taskNormalizer;
        this.userProfileService = userProfileService;
        this.clock = clock;
    }

    /**
     * Builds today's schedule from the submitted tasks.
     * An empty list means nothing could be scheduled, e.g. the working day is over.
     *
     * @param request schedule type, tasks and either an inline profile or a user id
     * @return placed tasks in chronological order
     */
    @PostMapping
    public ResponseEntity<List<PlacedTaskResponse>> createSchedule(@Valid @RequestBody ScheduleRequest request) {
        ScheduleType scheduleType = ScheduleType.fromLabel(request.getScheduleType());
        log.info("Received request to schedule {} tasks ({}).", request.getTasks().size(), scheduleType.getLabel());
        try {
            UserProfile profile = userProfileService.resolveProfile(request.getProfile(), request.getUserId());
            List<Task> tasks = taskNormalizer.normalizeRequests(request.getTasks());
            List<PlacedTask> placed = smartScheduler.schedule(tasks, profile, scheduleType, LocalDateTime.now(clock));
            List<PlacedTaskResponse> responseDtos = placed.stream()
                    .map(PlacedTaskResponse::fromModel)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(responseDtos);
        } catch (ProfileNotFoundException e) {
            log.warn("Cannot build schedule: {}", e.getMessage());
            throw e; // 404 via @ResponseStatus
        } catch (Exception e) {
            log.error("Error building schedule: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }
}
