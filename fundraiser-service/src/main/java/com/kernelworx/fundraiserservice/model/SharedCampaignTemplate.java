package com.kernelworx.fundraiserservice.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Campaign preset published by a unit leader under a short code. Sellers of
 * the same unit find it through {@code unitCampaignKey}.
 */
@Entity
@Table(name = "shared_campaigns", indexes = {
        @Index(name = "idx_shared_campaigns_unit_key", columnList = "unit_campaign_key"),
        @Index(name = "idx_shared_campaigns_creator", columnList = "created_by")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class SharedCampaignTemplate implements Persistable<String> {

    @Id
    @ToString.Include
    @Column(name = "shared_campaign_code", length = 64)
    private String sharedCampaignCode;

    @Column(name = "catalog_id", nullable = false)
    private String catalogId;

    @Column(nullable = false)
    private String campaignName;

    @Column(nullable = false)
    private Integer campaignYear;

    private LocalDate startDate;
    private LocalDate endDate;

    @Column(nullable = false)
    private String unitType;

    @Column(nullable = false)
    private String unitNumber;

    @Column(nullable = false)
    private String city;

    @Column(nullable = false)
    private String state;

    @Column(name = "unit_campaign_key", nullable = false)
    private String unitCampaignKey;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    private String createdByName;

    @Column(length = 300)
    private String creatorMessage;

    @Column(length = 1000)
    private String description;

    // null is treated as active
    @Column(name = "is_active")
    private Boolean isActive = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean newEntity = true;

    @Override
    public String getId() {
        return sharedCampaignCode;
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

    public boolean isActiveOrUnset() {
        return isActive == null || isActive;
    }
}
