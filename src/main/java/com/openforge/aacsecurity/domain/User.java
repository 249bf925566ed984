package com.openforge.aacsecurity.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Account record read by the login, token and authorization paths.
 *
 * {@code role} and {@code active} are only written by administrator-initiated
 * operations; self-service endpoints never touch them.
 */
@Getter
@Setter
@Entity
@Table(name = "users")
public class User extends BaseEntity {

    @Column(nullable = false, length = 100, unique = true)
    private String username;

    @Column(nullable = true, length = 128, unique = true)
    private String email;

    @Column(name = "password_hash", length = 255)
    private String passwordHash;

    @Column(name = "display_name", length = 128)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private UserRole role = UserRole.STUDENT;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "last_login_time")
    private Instant lastLoginTime;
}
