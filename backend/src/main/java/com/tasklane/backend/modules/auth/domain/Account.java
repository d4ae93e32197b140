package com.tasklane.backend.modules.auth.domain;

import java.util.Locale;
import java.util.UUID;

import com.tasklane.backend.global.jpa.AuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A registered account. The login handle is stored lower-cased, which makes the
 * unique constraint on it case-insensitive.
 */
@Entity
@Table(name = "account")
public class Account extends AuditedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "login_handle", nullable = false, unique = true, updatable = false, length = 320)
    private String loginHandle;

    @Column(name = "password_digest", nullable = false, length = 100)
    private String passwordDigest;

    protected Account() {
    }

    public Account(String loginHandle, String passwordDigest) {
        this.loginHandle = normalizeHandle(loginHandle);
        this.passwordDigest = passwordDigest;
    }

    public static String normalizeHandle(String rawHandle) {
        return rawHandle == null ? null : rawHandle.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public UUID getId() {
        return id;
    }

    public String getLoginHandle() {
        return loginHandle;
    }

    public String getPasswordDigest() {
        return passwordDigest;
    }

    @Override
    public String toString() {
        return "Account[id=" + id + ", loginHandle=" + loginHandle + "]";
    }
}
