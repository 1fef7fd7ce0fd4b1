package com.prakash.taskmate.service.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prakash.taskmate.config.ReorderConfig;
import com.prakash.taskmate.dto.AiReorderedTask;
import com.prakash.taskmate.model.ScheduleType;
import com.prakash.taskmate.model.Task;
import com.prakash.taskmate.model.UserProfile;
import com.prakash.taskmate.service.TaskNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the chat model to reorder the day's tasks for productivity and energy
 * alignment. Every failure (disabled, timeout, all models failing, malformed
 * output) is returned as a failed {@link ReorderResult}.
 */
@Service
public class TaskReorderingAgent implements TaskReorderer {

    private static final Logger log = LoggerFactory.getLogger(TaskReorderingAgent.class);

    private final ChatModel chatModel;
    private final ReorderConfig reorderConfig;
    private final TaskNormalizer taskNormalizer;
    private final ObjectMapper objectMapper;

    private final String reorderPromptTemplate = """
            You are an expert day planner.
            Reorder tasks to maximize productivity, respecting durations where reasonable.
            Prefer high-energy tasks during the user's higher energy periods.
            Return ONLY a JSON array of tasks with the SAME schema (description, priority, energy, duration).
            Keep every description exactly as given.

            Scheduling context:
            {payload}

            {format}
            """;

    @Autowired
    public TaskReorderingAgent(ChatModel chatModel,
                               ReorderConfig reorderConfig,
                               TaskNormalizer taskNormalizer,
                               ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.reorderConfig = reorderConfig;
        this.taskNormalizer = taskNormalizer;
        this.objectMapper = objectMapper;
    }

    @Override
    public ReorderResult reorder(List<Task> tasks, UserProfile profile, ScheduleType scheduleType) {
        if (!reorderConfig.isEnabled()) {
            return ReorderResult.failure("Reordering is disabled");
        }
        if (CollectionUtils.isEmpty(tasks)) {
            return ReorderResult.failure("No tasks to reorder");
        }
        log.info("Requesting AI reorder for {} tasks ({} schedule).", tasks.size(), scheduleType.getLabel());

        try {
            BeanOutputConverter<List<AiReorderedTask>> outputConverter =
                    new BeanOutputConverter<>(new ParameterizedTypeReference<List<AiReorderedTask>>() {});
            Map<String, Object> variables = Map.of(
                    "payload", buildPayload(tasks, profile, scheduleType),
                    "format", outputConverter.getFormat()
            );

            String rawResponse = Mono.fromCallable(() -> callWithFallbacks(variables))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(reorderConfig.getTimeout())
                    .block();
            log.debug("Received raw AI response for reorder: \n{}", rawResponse);

            List<AiReorderedTask> items = outputConverter.convert(rawResponse);
            List<Task> reordered = taskNormalizer.normalizeReordered(items);
            if (reordered.isEmpty()) {
                return ReorderResult.failure("Model response contained no valid tasks");
            }
            log.info("Successfully parsed AI reorder: {} tasks.", reordered.size());
            return ReorderResult.success(reordered);
        } catch (Exception e) {
            log.warn("AI reorder failed: {}", e.getMessage(), e);
            return ReorderResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Tries the primary model, then each fallback in order. The first answer wins.
     */
    private String callWithFallbacks(Map<String, Object> variables) {
        List<String> models = new ArrayList<>(reorderConfig.candidateModels());
        if (models.isEmpty()) {
            models.add(null); // chat model default
        }
        PromptTemplate promptTemplate = new PromptTemplate(reorderPromptTemplate);
        RuntimeException lastFailure = null;
        for (String model : models) {
            try {
                ChatOptions.Builder options = ChatOptions.builder().temperature(reorderConfig.getTemperature());
                if (model != null) {
                    options.model(model);
                }
                Prompt prompt = promptTemplate.create(variables, options.build());
                log.debug("Sending reorder prompt to model {}: \n{}", model, prompt.getContents());

                ChatResponse chatResponse = chatModel.call(prompt);
                if (chatResponse == null || chatResponse.getResult() == null) {
                    throw new IllegalStateException("Empty response from model " + model);
                }
                return chatResponse.getResult().getOutput().getText();
            } catch (RuntimeException e) {
                log.warn("Reorder call with model {} failed: {}", model, e.getMessage());
                lastFailure = e;
            }
        }
        throw new IllegalStateException("All reorder models failed", lastFailure);
    }

    private String buildPayload(List<Task> tasks, UserProfile profile, ScheduleType scheduleType)
            throws JsonProcessingException {
        UserProfile effective = profile != null ? profile : UserProfile.defaultProfile();

        Map<String, Object> profileView = new LinkedHashMap<>();
        profileView.put("work_hours", effective.getWorkHours());
        profileView.put("break_duration_min", effective.getBreakDurationMin());
        profileView.put("energy_levels", effective.getEnergyLevels());

        List<Map<String, Object>> taskViews = new ArrayList<>();
        for (Task task : tasks) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("description", task.getDescription());
            view.put("priority", task.getPriority().label());
            view.put("energy", task.getEnergy().label());
            view.put("duration", task.getDurationMinutes());
            view.put("deadline", task.hasDeadline() ? task.getDeadline().toString() : null);
            taskViews.add(view);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("schedule_type", scheduleType.getLabel());
        payload.put("profile", profileView);
        payload.put("tasks", taskViews);
        return objectMapper.writeValueAsString(payload);
    }
}
