package com.kernelworx.fundraiserservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class UpdateAccountRequest {

    @Size(max = 100)
    private String givenName;

    @Size(max = 100)
    private String familyName;

    @Size(max = 100)
    private String city;

    @Size(max = 50)
    private String state;

    @Size(max = 50)
    private String unitType;

    @Size(max = 20)
    private String unitNumber;
}
