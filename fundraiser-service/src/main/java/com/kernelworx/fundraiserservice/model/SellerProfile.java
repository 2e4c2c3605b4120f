package com.kernelworx.fundraiserservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "seller_profiles", indexes = @Index(name = "idx_profiles_owner", columnList = "owner_account_id"))
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class SellerProfile {

    @Id
    @ToString.Include
    @Column(name = "profile_id")
    private String profileId;

    @ToString.Include
    @Column(name = "owner_account_id", nullable = false)
    private String ownerAccountId;

    @Column(nullable = false)
    private String sellerName;

    private String unitType;
    private String unitNumber;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;
}
