package com.tasklane.backend.modules.task.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.tasklane.backend.global.jpa.AuditedEntity;
import com.tasklane.backend.global.security.OwnedResource;
import com.tasklane.backend.modules.auth.domain.Account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A to-do item. The owner is fixed at construction and never written again.
 */
@Entity
@Table(name = "task")
public class Task extends AuditedEntity implements OwnedResource {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, updatable = false)
    private Account owner;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "completed", nullable = false)
    private boolean completed;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    protected Task() {
    }

    public Task(Account owner, String title, String description) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.title = normalizeTitle(title);
        this.description = normalizeDescription(description);
    }

    /**
     * Applies a partial edit; {@code null} leaves a field as it is.
     */
    public void edit(String newTitle, String newDescription) {
        if (newTitle != null) {
            this.title = normalizeTitle(newTitle);
        }
        if (newDescription != null) {
            this.description = normalizeDescription(newDescription);
        }
    }

    public void toggle(OffsetDateTime now) {
        this.completed = !completed;
        this.completedAt = completed ? now : null;
    }

    private static String normalizeTitle(String rawTitle) {
        String trimmed = Objects.requireNonNull(rawTitle, "title").trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        return trimmed;
    }

    private static String normalizeDescription(String rawDescription) {
        if (rawDescription == null) {
            return null;
        }
        String trimmed = rawDescription.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public UUID getId() {
        return id;
    }

    @Override
    public UUID getOwnerId() {
        return owner.getId();
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public boolean isCompleted() {
        return completed;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }
}
