package com.responseready.apigateway.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** Partial update; absent fields stay as they are. */
public record UpdateAccountRequest(
    @Pattern(regexp = EmailFormat.REGEX, message = "Username must be a valid email address")
        String username,
    @Size(max = 255) @Pattern(regexp = EmailFormat.REGEX, message = "Invalid email format")
        String email,
    @Size(max = 128) String password,
    @JsonProperty("isActive") Boolean active,
    @JsonProperty("isAdmin") Boolean admin) {}
