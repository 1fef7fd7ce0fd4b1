package com.prakash.taskmate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the optional AI reordering step, bound to the property prefix
 * <strong>taskmate.reorder</strong>.
 *
 * Example configuration in <code>application.properties</code>:
 * <pre>
 * taskmate.reorder.model=llama3.1:8b
 * taskmate.reorder.fallback-models=llama3.2:3b,gemma3:4b
 * taskmate.reorder.timeout=PT20S
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "taskmate.reorder")
public class ReorderConfig {

    /**
     * When false the scheduler always keeps the caller's task order.
     */
    private boolean enabled = true;

    /**
     * Model tried first. Blank means the chat model's own default.
     */
    private String model;

    /**
     * Substitute models tried in order when the previous one fails.
     */
    private List<String> fallbackModels = new ArrayList<>();

    /**
     * Upper bound for the whole reorder round trip, fallbacks included.
     */
    private Duration timeout = Duration.ofSeconds(20);

    private Double temperature = 0.2;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public List<String> getFallbackModels() {
        return fallbackModels;
    }

    public void setFallbackModels(List<String> fallbackModels) {
        this.fallbackModels = fallbackModels;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }

    /**
     * Primary model followed by the fallbacks, blanks and duplicates removed.
     */
    public List<String> candidateModels() {
        List<String> candidates = new ArrayList<>();
        if (model != null && !model.isBlank()) {
            candidates.add(model.trim());
        }
        if (fallbackModels != null) {
            for (String fallback : fallbackModels) {
                if (fallback != null && !fallback.isBlank() && !candidates.contains(fallback.trim())) {
                    candidates.add(fallback.trim());
                }
            }
        }
        return candidates;
    }
}
