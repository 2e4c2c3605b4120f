package com.kernelworx.fundraiserservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class UpdateSharedCampaignRequest {

    @Size(max = 300)
    private String creatorMessage;

    @Size(max = 1000)
    private String description;

    private Boolean isActive;
}
