package com.tasklane.backend.modules.task.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.tasklane.backend.modules.task.domain.Task;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Every multi-row query takes an owner id. Callers of the single-row lookups must run
 * the result through the ownership check before using it.
 */
public interface TaskRepository extends Repository<Task, UUID> {

    Task save(Task task);

    Task saveAndFlush(Task task);

    void delete(Task task);

    Optional<Task> findById(UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from Task t where t.id = :id")
    Optional<Task> findByIdForUpdate(@Param("id") UUID id);

    @Query(value = "select t from Task t where t.owner.id = :ownerId",
            countQuery = "select count(t) from Task t where t.owner.id = :ownerId")
    Page<Task> findPageByOwnerId(@Param("ownerId") UUID ownerId, Pageable pageable);

    @Query(value = "select t from Task t where t.owner.id = :ownerId and t.completed = :completed",
            countQuery = "select count(t) from Task t where t.owner.id = :ownerId and t.completed = :completed")
    Page<Task> findPageByOwnerIdAndCompleted(@Param("ownerId") UUID ownerId,
                                             @Param("completed") boolean completed,
                                             Pageable pageable);

    @Query("select count(t) from Task t where t.owner.id = :ownerId")
    long countByOwnerId(@Param("ownerId") UUID ownerId);

    @Query("select count(t) from Task t where t.owner.id = :ownerId and t.completed = :completed")
    long countByOwnerIdAndCompleted(@Param("ownerId") UUID ownerId, @Param("completed") boolean completed);
}
