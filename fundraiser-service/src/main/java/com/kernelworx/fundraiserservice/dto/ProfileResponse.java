package com.kernelworx.fundraiserservice.dto;

import com.kernelworx.fundraiserservice.model.Permission;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {

    private String profileId;
    private String ownerAccountId;
    private String sellerName;
    private String unitType;
    private String unitNumber;
    private Boolean isOwner;
    // effective permissions of the caller
    private Set<Permission> permissions;
    private Instant createdAt;
    private Instant updatedAt;
}
