package com.kernelworx.fundraiserservice.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * One-time code that grants a share on redemption.
 * Always inserted, never merged, so a colliding code fails instead of
 * overwriting the existing invite.
 */
@Entity
@Table(name = "invites", indexes = @Index(name = "idx_invites_profile", columnList = "profile_id"))
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Invite implements Persistable<String> {

    @Id
    @ToString.Include
    @Column(name = "invite_code", length = 32)
    private String inviteCode;

    @ToString.Include
    @Column(name = "profile_id", nullable = false)
    private String profileId;

    @Column(name = "owner_account_id", nullable = false)
    private String ownerAccountId;

    @Convert(converter = PermissionSetConverter.class)
    @Column(nullable = false)
    private Set<Permission> permissions = EnumSet.noneOf(Permission.class);

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(nullable = false)
    private boolean used;

    @Column(name = "used_by")
    private String usedBy;

    @Column(name = "used_at")
    private Instant usedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean newEntity = true;

    @Override
    public String getId() {
        return inviteCode;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
