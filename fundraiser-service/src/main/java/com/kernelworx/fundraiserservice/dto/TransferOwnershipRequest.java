package com.kernelworx.fundraiserservice.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TransferOwnershipRequest {

    @NotBlank(message = "New owner account id is required")
    private String newOwnerAccountId;
}
