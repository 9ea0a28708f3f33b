package com.responseready.apigateway.auth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * @param email contact address, defaults to the username
 */
public record RegisterRequest(
    @NotBlank(message = "Username must be a valid email address")
        @Size(max = 255, message = "Username must be a valid email address")
        @Pattern(regexp = EmailFormat.REGEX, message = "Username must be a valid email address")
        String username,
    @NotBlank(message = "Password is required") @Size(max = 128) String password,
    @Size(max = 255) @Pattern(regexp = EmailFormat.REGEX, message = "Invalid email format")
        String email) {}
