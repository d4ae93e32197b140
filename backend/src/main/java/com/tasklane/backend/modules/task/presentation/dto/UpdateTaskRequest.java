package com.tasklane.backend.modules.task.presentation.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update; omitted or {@code null} fields keep their current value.
 */
public record UpdateTaskRequest(
        @Pattern(regexp = "(?s).*\\S.*", message = "title must not be blank")
        @Size(max = 200, message = "title must be at most 200 characters")
        String title,
        @Size(max = 1000, message = "description must be at most 1000 characters")
        String description
) {
}
