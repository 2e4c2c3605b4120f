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
public class ShareResponse {

    private String profileId;
    private String targetAccountId;
    private Set<Permission> permissions;
    private String createdByAccountId;
    private Instant createdAt;
}
