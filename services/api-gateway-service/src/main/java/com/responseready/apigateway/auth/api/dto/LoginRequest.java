package com.responseready.apigateway.auth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record LoginRequest(
    @NotBlank(message = "Username and password are required")
        @Size(max = 255, message = "Invalid email format")
        @Pattern(regexp = EmailFormat.REGEX, message = "Invalid email format")
        String username,
    @NotBlank(message = "Username and password are required") String password) {}
