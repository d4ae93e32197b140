package com.tasklane.backend.modules.task.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTaskRequest(
        @NotBlank(message = "title is required")
        @Size(max = 200, message = "title must be at most 200 characters")
        String title,
        @Size(max = 1000, message = "description must be at most 1000 characters")
        String description
) {
}
