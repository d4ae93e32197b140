package com.tasklane.backend.modules.task.presentation.dto;

import java.util.List;

/**
 * One page of the caller's tasks. {@code matching} counts the tasks that pass the status
 * filter; {@code total}, {@code completed} and {@code pending} count all of the caller's
 * tasks regardless of the filter.
 */
public record TaskListResponse(
        List<TaskResponse> items,
        int page,
        int size,
        long matching,
        long total,
        long completed,
        long pending
) {
}
