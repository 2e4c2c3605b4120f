package com.kernelworx.fundraiserservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Grant of permissions on one profile to one account. At most one per pair.
 */
@Entity
@Table(name = "shares", indexes = @Index(name = "idx_shares_target", columnList = "target_account_id"))
@IdClass(ShareId.class)
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Share {

    @Id
    @ToString.Include
    @Column(name = "profile_id")
    private String profileId;

    @Id
    @ToString.Include
    @Column(name = "target_account_id")
    private String targetAccountId;

    @ToString.Include
    @Convert(converter = PermissionSetConverter.class)
    @Column(nullable = false)
    private Set<Permission> permissions = EnumSet.noneOf(Permission.class);

    @Column(name = "owner_account_id", nullable = false)
    private String ownerAccountId;

    @Column(name = "created_by_account_id")
    private String createdByAccountId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;
}
