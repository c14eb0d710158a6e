package io.tenantq.core;

import io.tenantq.TaskHandler;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Handlers by task type, fixed at construction.
 */
public class TaskHandlerRegistry {

    private final Map<String, TaskHandler<?>> handlersByType;

    public TaskHandlerRegistry(List<TaskHandler<?>> handlers) {
        handlers.forEach(h -> {
            if (h.taskType() == null || h.taskType().isBlank()) {
                throw new IllegalStateException("TaskHandler " + h.getClass().getName() + " has a blank task type");
            }
            if (h.payloadClass() == null) {
                throw new IllegalStateException("TaskHandler for " + h.taskType() + " has no payload class");
            }
        });
        this.handlersByType = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        TaskHandler::taskType,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate TaskHandler task type: " + a.taskType());
                        }
                ));
    }

    public Optional<TaskHandler<?>> find(String taskType) {
        return Optional.ofNullable(handlersByType.get(taskType));
    }

    public boolean contains(String taskType) {
        return handlersByType.containsKey(taskType);
    }

    public Set<String> taskTypes() {
        return handlersByType.keySet();
    }
}
