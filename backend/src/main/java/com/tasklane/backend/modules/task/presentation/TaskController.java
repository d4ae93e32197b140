package com.tasklane.backend.modules.task.presentation;

import java.util.UUID;

import com.tasklane.backend.global.security.CallerIdentity;
import com.tasklane.backend.modules.task.application.TaskService;
import com.tasklane.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.tasklane.backend.modules.task.presentation.dto.TaskListResponse;
import com.tasklane.backend.modules.task.presentation.dto.TaskResponse;
import com.tasklane.backend.modules.task.presentation.dto.UpdateTaskRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Operation(summary = "List my tasks", description = "Newest first, optionally filtered by status.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "One page of the caller's tasks"),
            @ApiResponse(responseCode = "422", description = "Invalid paging or status parameter")
    })
    @GetMapping
    public ResponseEntity<TaskListResponse> list(
            @AuthenticationPrincipal CallerIdentity caller,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(taskService.list(caller, status, page, size));
    }

    @Operation(summary = "Create a task", description = "The task is owned by the caller.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Task created"),
            @ApiResponse(responseCode = "422", description = "Invalid title or description")
    })
    @PostMapping
    public ResponseEntity<TaskResponse> create(
            @AuthenticationPrincipal CallerIdentity caller,
            @Valid @RequestBody CreateTaskRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(taskService.create(caller, request));
    }

    @Operation(summary = "Get a task")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task found"),
            @ApiResponse(responseCode = "403", description = "Task belongs to another account"),
            @ApiResponse(responseCode = "404", description = "Task not found")
    })
    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> get(
            @AuthenticationPrincipal CallerIdentity caller,
            @PathVariable UUID taskId
    ) {
        return ResponseEntity.ok(taskService.get(caller, taskId));
    }

    @Operation(summary = "Update a task", description = "Only the fields present in the body change.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task updated"),
            @ApiResponse(responseCode = "403", description = "Task belongs to another account"),
            @ApiResponse(responseCode = "404", description = "Task not found"),
            @ApiResponse(responseCode = "422", description = "Invalid title or description")
    })
    @PutMapping("/{taskId}")
    public ResponseEntity<TaskResponse> update(
            @AuthenticationPrincipal CallerIdentity caller,
            @PathVariable UUID taskId,
            @Valid @RequestBody UpdateTaskRequest request
    ) {
        return ResponseEntity.ok(taskService.update(caller, taskId, request));
    }

    @Operation(summary = "Delete a task")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Task deleted"),
            @ApiResponse(responseCode = "403", description = "Task belongs to another account"),
            @ApiResponse(responseCode = "404", description = "Task not found")
    })
    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> delete(
            @AuthenticationPrincipal CallerIdentity caller,
            @PathVariable UUID taskId
    ) {
        taskService.delete(caller, taskId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Toggle completion", description = "Flips the completed flag and maintains completedAt.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task toggled"),
            @ApiResponse(responseCode = "403", description = "Task belongs to another account"),
            @ApiResponse(responseCode = "404", description = "Task not found")
    })
    @PatchMapping("/{taskId}/toggle")
    public ResponseEntity<TaskResponse> toggle(
            @AuthenticationPrincipal CallerIdentity caller,
            @PathVariable UUID taskId
    ) {
        return ResponseEntity.ok(taskService.toggle(caller, taskId));
    }
}
