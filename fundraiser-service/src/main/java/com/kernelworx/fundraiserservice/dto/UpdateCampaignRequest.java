package com.kernelworx.fundraiserservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

@Data
public class UpdateCampaignRequest {

    @Size(max = 100)
    private String campaignName;

    private Integer campaignYear;
    private LocalDate startDate;
    private LocalDate endDate;
    private String catalogId;
    private String unitType;
    private String unitNumber;
    private String city;
    private String state;
}
