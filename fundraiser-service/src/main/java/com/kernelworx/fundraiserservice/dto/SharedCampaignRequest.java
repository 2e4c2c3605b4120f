package com.kernelworx.fundraiserservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

@Data
public class SharedCampaignRequest {

    @NotBlank(message = "Catalog id is required")
    private String catalogId;

    @NotBlank(message = "Campaign name cannot be blank")
    @Size(max = 100)
    private String campaignName;

    @NotNull(message = "Campaign year is required")
    @Min(2000)
    @Max(2999)
    private Integer campaignYear;

    private LocalDate startDate;
    private LocalDate endDate;

    @NotBlank(message = "Unit type is required")
    private String unitType;

    @NotBlank(message = "Unit number is required")
    private String unitNumber;

    @NotBlank(message = "City is required")
    private String city;

    @NotBlank(message = "State is required")
    private String state;

    @Size(max = 300)
    private String creatorMessage;

    @Size(max = 1000)
    private String description;
}
