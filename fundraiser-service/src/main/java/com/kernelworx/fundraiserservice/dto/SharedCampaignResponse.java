package com.kernelworx.fundraiserservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SharedCampaignResponse {

    private String sharedCampaignCode;
    private String catalogId;
    private String campaignName;
    private Integer campaignYear;
    private LocalDate startDate;
    private LocalDate endDate;
    private String unitType;
    private String unitNumber;
    private String city;
    private String state;
    private String createdBy;
    private String createdByName;
    private String creatorMessage;
    private String description;
    private Boolean isActive;
    private Instant createdAt;
}
