package com.kernelworx.fundraiserservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

/**
 * Input of campaign creation. Which fields are required depends on the
 * shared campaign preset, so presence is checked by the service.
 */
@Data
public class CampaignRequest {

    @NotBlank(message = "Profile id is required")
    private String profileId;

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

    // optional preset; its values fill whatever is left empty here
    private String sharedCampaignCode;

    // grant the preset's creator read access to this profile
    private Boolean shareWithCreator;
}
