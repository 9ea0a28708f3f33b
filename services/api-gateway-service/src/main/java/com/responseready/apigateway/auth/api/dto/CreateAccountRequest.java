package com.responseready.apigateway.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateAccountRequest(
    @NotBlank(message = "Username must be a valid email address")
        @Pattern(regexp = EmailFormat.REGEX, message = "Username must be a valid email address")
        String username,
    @NotBlank(message = "Password must be at least 6 characters")
        @Size(min = 6, max = 128, message = "Password must be at least 6 characters")
        String password,
    @Size(max = 255) @Pattern(regexp = EmailFormat.REGEX, message = "Invalid email format")
        String email,
    @JsonProperty("isAdmin") boolean admin) {}
