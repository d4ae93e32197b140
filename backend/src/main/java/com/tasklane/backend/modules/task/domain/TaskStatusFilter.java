package com.tasklane.backend.modules.task.domain;

import java.util.Locale;

public enum TaskStatusFilter {
    ALL,
    PENDING,
    COMPLETED;

    public static TaskStatusFilter parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        return TaskStatusFilter.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
