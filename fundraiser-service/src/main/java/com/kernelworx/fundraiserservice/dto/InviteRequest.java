package com.kernelworx.fundraiserservice.dto;

import com.kernelworx.fundraiserservice.model.Permission;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.Set;

@Data
public class InviteRequest {

    @NotEmpty(message = "At least one permission is required")
    private Set<Permission> permissions;

    // falls back to the configured default when absent
    @Min(1)
    @Max(365)
    private Integer expiresInDays;
}
