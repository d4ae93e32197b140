package com.tasklane.backend.modules.task.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tasklane.backend.global.error.ProblemException;
import com.tasklane.backend.global.security.CallerIdentity;
import com.tasklane.backend.global.security.OwnershipEnforcer;
import com.tasklane.backend.global.security.OwnershipViolationException;
import com.tasklane.backend.global.security.TestCallerIdentities;
import com.tasklane.backend.modules.auth.domain.Account;
import com.tasklane.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.tasklane.backend.modules.task.domain.Task;
import com.tasklane.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.tasklane.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.tasklane.backend.modules.task.presentation.dto.TaskListResponse;
import com.tasklane.backend.modules.task.presentation.dto.TaskResponse;
import com.tasklane.backend.modules.task.presentation.dto.UpdateTaskRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TaskServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private AccountRepository accountRepository;

    private TaskService taskService;
    private Account owner;
    private CallerIdentity ownerCaller;
    private CallerIdentity strangerCaller;

    @BeforeEach
    void setUp() {
        taskService = new TaskService(taskRepository, accountRepository, new OwnershipEnforcer(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        owner = account("owner@example.com");
        ownerCaller = TestCallerIdentities.of(owner.getId());
        strangerCaller = TestCallerIdentities.random();
    }

    @Test
    void createStampsCallerAsOwner() {
        when(accountRepository.existsById(owner.getId())).thenReturn(true);
        when(accountRepository.getReferenceById(owner.getId())).thenReturn(owner);
        when(taskRepository.saveAndFlush(any(Task.class))).thenAnswer(invocation -> withId(invocation.getArgument(0)));

        TaskResponse response = taskService.create(ownerCaller, new CreateTaskRequest(" Write report ", "quarterly"));

        ArgumentCaptor<Task> saved = ArgumentCaptor.forClass(Task.class);
        verify(taskRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getOwnerId()).isEqualTo(owner.getId());
        assertThat(response.ownerId()).isEqualTo(owner.getId());
        assertThat(response.title()).isEqualTo("Write report");
        assertThat(response.completed()).isFalse();
    }

    @Test
    void createFailsWhenAccountNoLongerExists() {
        when(accountRepository.existsById(owner.getId())).thenReturn(false);

        assertThatThrownBy(() -> taskService.create(ownerCaller, new CreateTaskRequest("title", null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.UNAUTHORIZED));
        verify(taskRepository, never()).saveAndFlush(any());
    }

    @Test
    void getReturnsOwnTask() {
        Task task = withId(new Task(owner, "Mine", null));
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

        assertThat(taskService.get(ownerCaller, task.getId()).id()).isEqualTo(task.getId());
    }

    @Test
    void getOfForeignTaskIsForbidden() {
        Task task = withId(new Task(owner, "Mine", null));
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

        assertThatThrownBy(() -> taskService.get(strangerCaller, task.getId()))
                .isInstanceOf(OwnershipViolationException.class);
    }

    @Test
    void unknownTaskIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(taskRepository.findByIdForUpdate(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> taskService.toggle(ownerCaller, missing))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("TASK_NOT_FOUND");
                });
    }

    @Test
    void foreignTaskIsNeitherUpdatedToggledNorDeleted() {
        Task task = withId(new Task(owner, "Mine", "original"));
        when(taskRepository.findByIdForUpdate(task.getId())).thenReturn(Optional.of(task));

        assertThatThrownBy(() -> taskService.update(strangerCaller, task.getId(), new UpdateTaskRequest("hijacked", null)))
                .isInstanceOf(OwnershipViolationException.class);
        assertThatThrownBy(() -> taskService.toggle(strangerCaller, task.getId()))
                .isInstanceOf(OwnershipViolationException.class);
        assertThatThrownBy(() -> taskService.delete(strangerCaller, task.getId()))
                .isInstanceOf(OwnershipViolationException.class);

        assertThat(task.getTitle()).isEqualTo("Mine");
        assertThat(task.isCompleted()).isFalse();
        verify(taskRepository, never()).saveAndFlush(any());
        verify(taskRepository, never()).delete(any());
    }

    @Test
    void toggleUsesInjectedClock() {
        Task task = withId(new Task(owner, "Mine", null));
        when(taskRepository.findByIdForUpdate(task.getId())).thenReturn(Optional.of(task));
        when(taskRepository.saveAndFlush(task)).thenReturn(task);

        TaskResponse response = taskService.toggle(ownerCaller, task.getId());

        assertThat(response.completed()).isTrue();
        assertThat(response.completedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void listIsScopedToCallerAndReportsCounts() {
        Task task = withId(new Task(owner, "Mine", null));
        when(taskRepository.findPageByOwnerIdAndCompleted(eq(owner.getId()), eq(false), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(task)));
        when(taskRepository.countByOwnerId(owner.getId())).thenReturn(3L);
        when(taskRepository.countByOwnerIdAndCompleted(owner.getId(), true)).thenReturn(2L);

        TaskListResponse response = taskService.list(ownerCaller, "pending", null, null);

        assertThat(response.items()).extracting(TaskResponse::id).containsExactly(task.getId());
        assertThat(response.size()).isEqualTo(TaskService.DEFAULT_PAGE_SIZE);
        assertThat(response.total()).isEqualTo(3L);
        assertThat(response.completed()).isEqualTo(2L);
        assertThat(response.pending()).isEqualTo(1L);
        verify(taskRepository, never()).findPageByOwnerId(any(), any());
    }

    @Test
    void listRejectsInvalidPagingAndStatus() {
        assertThatThrownBy(() -> taskService.list(ownerCaller, null, null, TaskService.MAX_PAGE_SIZE + 1))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY));
        assertThatThrownBy(() -> taskService.list(ownerCaller, null, -1, null))
                .isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> taskService.list(ownerCaller, "archived", null, null))
                .isInstanceOf(ProblemException.class);
        verify(taskRepository, never()).findPageByOwnerIdAndCompleted(any(), anyBoolean(), any());
    }

    private static Account account(String email) {
        Account account = new Account(email, "$2a$10$" + "b".repeat(53));
        ReflectionTestUtils.setField(account, "id", UUID.randomUUID());
        return account;
    }

    private static Task withId(Task task) {
        ReflectionTestUtils.setField(task, "id", UUID.randomUUID());
        return task;
    }
}
