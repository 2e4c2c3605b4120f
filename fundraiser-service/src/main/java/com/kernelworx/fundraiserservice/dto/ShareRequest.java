package com.kernelworx.fundraiserservice.dto;

import com.kernelworx.fundraiserservice.model.Permission;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.Set;

@Data
public class ShareRequest {

    @NotBlank(message = "Target account email is required")
    @Email
    private String targetAccountEmail;

    @NotEmpty(message = "At least one permission is required")
    private Set<Permission> permissions;
}
