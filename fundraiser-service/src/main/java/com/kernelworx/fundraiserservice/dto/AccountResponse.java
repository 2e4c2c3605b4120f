package com.kernelworx.fundraiserservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountResponse {

    // raw identity provider subject, without prefix
    private String accountId;
    private String email;
    private String givenName;
    private String familyName;
    private String city;
    private String state;
    private String unitType;
    private String unitNumber;
    private Boolean isAdmin;
    private Instant createdAt;
    private Instant updatedAt;
}
