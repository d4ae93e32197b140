package com.tasklane.backend.modules.task.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.tasklane.backend.global.error.ProblemException;
import com.tasklane.backend.global.security.CallerIdentity;
import com.tasklane.backend.global.security.OwnershipEnforcer;
import com.tasklane.backend.modules.auth.domain.Account;
import com.tasklane.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.tasklane.backend.modules.task.domain.Task;
import com.tasklane.backend.modules.task.domain.TaskStatusFilter;
import com.tasklane.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.tasklane.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.tasklane.backend.modules.task.presentation.dto.TaskDtoMapper;
import com.tasklane.backend.modules.task.presentation.dto.TaskListResponse;
import com.tasklane.backend.modules.task.presentation.dto.TaskResponse;
import com.tasklane.backend.modules.task.presentation.dto.UpdateTaskRequest;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TaskService {

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final TaskRepository taskRepository;
    private final AccountRepository accountRepository;
    private final OwnershipEnforcer ownershipEnforcer;
    private final Clock clock;

    public TaskService(
            TaskRepository taskRepository,
            AccountRepository accountRepository,
            OwnershipEnforcer ownershipEnforcer,
            Clock clock
    ) {
        this.taskRepository = taskRepository;
        this.accountRepository = accountRepository;
        this.ownershipEnforcer = ownershipEnforcer;
        this.clock = clock;
    }

    public TaskResponse create(CallerIdentity caller, CreateTaskRequest request) {
        UUID ownerId = ownershipEnforcer.ownerScope(caller);
        if (!accountRepository.existsById(ownerId)) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "ACCOUNT_NOT_FOUND",
                    "The authenticated account no longer exists");
        }
        Account owner = accountRepository.getReferenceById(ownerId);
        Task task = taskRepository.saveAndFlush(new Task(owner, request.title(), request.description()));
        return TaskDtoMapper.toResponse(task);
    }

    @Transactional(readOnly = true)
    public TaskListResponse list(CallerIdentity caller, String status, Integer page, Integer size) {
        UUID ownerId = ownershipEnforcer.ownerScope(caller);
        TaskStatusFilter filter = parseStatus(status);
        int pageSize = resolveSize(size);
        PageRequest pageRequest = PageRequest.of(resolvePage(page, pageSize), pageSize, NEWEST_FIRST);

        Page<Task> result = switch (filter) {
            case ALL -> taskRepository.findPageByOwnerId(ownerId, pageRequest);
            case PENDING -> taskRepository.findPageByOwnerIdAndCompleted(ownerId, false, pageRequest);
            case COMPLETED -> taskRepository.findPageByOwnerIdAndCompleted(ownerId, true, pageRequest);
        };

        long total = taskRepository.countByOwnerId(ownerId);
        long completed = taskRepository.countByOwnerIdAndCompleted(ownerId, true);

        return new TaskListResponse(
                result.getContent().stream().map(TaskDtoMapper::toResponse).toList(),
                pageRequest.getPageNumber(),
                pageRequest.getPageSize(),
                result.getTotalElements(),
                total,
                completed,
                total - completed
        );
    }

    @Transactional(readOnly = true)
    public TaskResponse get(CallerIdentity caller, UUID taskId) {
        Task task = taskRepository.findById(taskId).orElseThrow(TaskService::taskNotFound);
        ownershipEnforcer.authorize(caller, task);
        return TaskDtoMapper.toResponse(task);
    }

    public TaskResponse update(CallerIdentity caller, UUID taskId, UpdateTaskRequest request) {
        Task task = loadForUpdate(caller, taskId);
        task.edit(request.title(), request.description());
        return TaskDtoMapper.toResponse(taskRepository.saveAndFlush(task));
    }

    public TaskResponse toggle(CallerIdentity caller, UUID taskId) {
        Task task = loadForUpdate(caller, taskId);
        task.toggle(OffsetDateTime.now(clock));
        return TaskDtoMapper.toResponse(taskRepository.saveAndFlush(task));
    }

    public void delete(CallerIdentity caller, UUID taskId) {
        Task task = loadForUpdate(caller, taskId);
        taskRepository.delete(task);
    }

    private Task loadForUpdate(CallerIdentity caller, UUID taskId) {
        Task task = taskRepository.findByIdForUpdate(taskId).orElseThrow(TaskService::taskNotFound);
        ownershipEnforcer.authorize(caller, task);
        return task;
    }

    private static TaskStatusFilter parseStatus(String status) {
        try {
            return TaskStatusFilter.parse(status);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error",
                    "status: must be one of all, pending, completed");
        }
    }

    private static int resolvePage(Integer page, int pageSize) {
        if (page == null) {
            return 0;
        }
        if (page < 0) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error", "page: must be 0 or greater");
        }
        // the row offset handed to the query is an int
        if ((long) page * pageSize > Integer.MAX_VALUE) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error", "page: too large for page size");
        }
        return page;
    }

    private static int resolveSize(Integer size) {
        if (size == null) {
            return DEFAULT_PAGE_SIZE;
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error",
                    "size: must be between 1 and " + MAX_PAGE_SIZE);
        }
        return size;
    }

    private static ProblemException taskNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND", "Task not found");
    }
}
