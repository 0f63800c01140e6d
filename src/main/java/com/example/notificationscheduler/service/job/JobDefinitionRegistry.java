package com.example.notificationscheduler.service.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects all {@link ScheduledJobDefinition} beans, keyed by job name.
 * <p>
 * Two beans claiming the same name is a wiring error and fails startup.
 */
@Slf4j
@Component
public class JobDefinitionRegistry {

    private final Map<String, ScheduledJobDefinition> definitions = new LinkedHashMap<>();

    public JobDefinitionRegistry(List<ScheduledJobDefinition> definitionBeans) {
        for (var definition : definitionBeans) {
            var name = definition.getJobName();
            var existing = definitions.putIfAbsent(name, definition);
            if (existing != null) {
                throw new IllegalStateException(String.format("Job name %s is claimed by both %s and %s",
                        name, existing.getClass().getSimpleName(), definition.getClass().getSimpleName()));
            }
            log.info("Discovered job definition {}: {}", name, definition.getClass().getSimpleName());
        }
    }

    /**
     * All definitions in discovery order
     */
    public List<ScheduledJobDefinition> getDefinitions() {
        return List.copyOf(definitions.values());
    }

    public int getDefinitionCount() {
        return definitions.size();
    }
}
