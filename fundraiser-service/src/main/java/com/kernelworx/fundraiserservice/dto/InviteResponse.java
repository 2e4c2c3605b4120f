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
public class InviteResponse {

    private String inviteCode;
    private String profileId;
    private Set<Permission> permissions;
    private String createdBy;
    private Instant createdAt;
    private Instant expiresAt;
    private Boolean used;
    private String usedBy;
    private Instant usedAt;
}
