package com.kernelworx.fundraiserservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ProfileRequest {

    @NotBlank(message = "Seller name cannot be blank")
    @Size(max = 100)
    private String sellerName;

    @Size(max = 50)
    private String unitType;

    @Size(max = 20)
    private String unitNumber;
}
