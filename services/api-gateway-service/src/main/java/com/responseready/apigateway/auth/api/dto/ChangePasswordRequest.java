package com.responseready.apigateway.auth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
    @NotBlank(message = "Current password and new password are required") String currentPassword,
    @NotBlank(message = "Current password and new password are required") @Size(max = 128)
        String newPassword) {}
