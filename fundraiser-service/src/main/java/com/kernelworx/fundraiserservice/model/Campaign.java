package com.kernelworx.fundraiserservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A sales season of one seller profile. Order count and revenue are not
 * stored here; they are summed from the orders on every read.
 */
@Entity
@Table(name = "campaigns", indexes = {
        @Index(name = "idx_campaigns_profile", columnList = "profile_id"),
        @Index(name = "idx_campaigns_catalog", columnList = "catalog_id"),
        @Index(name = "idx_campaigns_unit_key", columnList = "unit_campaign_key")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Campaign {

    @Id
    @ToString.Include
    @Column(name = "campaign_id")
    private String campaignId;

    @ToString.Include
    @Column(name = "profile_id", nullable = false)
    private String profileId;

    @Column(nullable = false)
    private String campaignName;

    @Column(nullable = false)
    private Integer campaignYear;

    @Column(nullable = false)
    private LocalDate startDate;

    private LocalDate endDate;

    @Column(name = "catalog_id", nullable = false)
    private String catalogId;

    private String unitType;
    private String unitNumber;
    private String city;
    private String state;

    @Column(name = "unit_campaign_key")
    private String unitCampaignKey;

    private String sharedCampaignCode;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;
}
