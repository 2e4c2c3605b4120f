package com.kernelworx.fundraiserservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignResponse {

    private String campaignId;
    private String profileId;
    private String campaignName;
    private Integer campaignYear;
    private LocalDate startDate;
    private LocalDate endDate;
    private String catalogId;
    private String unitType;
    private String unitNumber;
    private String city;
    private String state;
    private String sharedCampaignCode;

    // derived from the campaign's orders on every read
    private Long totalOrders;
    private BigDecimal totalRevenue;

    private Instant createdAt;
    private Instant updatedAt;
}
