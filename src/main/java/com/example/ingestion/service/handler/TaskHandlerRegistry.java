package com.example.ingestion.service.handler;

import com.example.ingestion.domain.enums.TaskType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry for task handlers.
 * <p>
 * Built once at startup from all TaskHandler beans and never modified afterwards.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
    private final List<TaskHandler> handlerBeans;

    public TaskHandlerRegistry(List<TaskHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var type = handler.getTaskType();
            if (handlers.containsKey(type)) {
                throw new IllegalStateException(String.format("Duplicate handler for task type %s: %s and %s",
                        type, handler.getClass().getSimpleName(), handlers.get(type).getClass().getSimpleName()));
            }
            handlers.put(type, handler);
            log.info("Registered handler for task type {}: {}", type.getCode(), handler.getClass().getSimpleName());
        }

        for (var type : TaskType.values()) {
            if (!handlers.containsKey(type)) {
                log.warn("No handler registered for task type: {}", type.getCode());
            }
        }
    }

    /**
     * Get handler for a task type
     *
     * @param taskType The task type
     * @return Optional containing the handler if found
     */
    public Optional<TaskHandler> getHandler(TaskType taskType) {
        return Optional.ofNullable(handlers.get(taskType));
    }

    /**
     * Handler for a raw wire tag; empty for unknown tags and types without a handler
     */
    public Optional<TaskHandler> getHandler(String typeCode) {
        return TaskType.findByCode(typeCode).flatMap(this::getHandler);
    }

    /**
     * Get all registered task types
     */
    public Set<TaskType> getRegisteredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
