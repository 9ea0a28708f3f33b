package com.responseready.apigateway.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ForcePasswordChangeRequest(
    @NotBlank(message = "New password is required") String newPassword) {}
