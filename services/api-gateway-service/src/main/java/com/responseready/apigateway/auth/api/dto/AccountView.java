package com.responseready.apigateway.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Account as shown to clients; never carries the password hash. */
public record AccountView(
    String id,
    String username,
    String email,
    Instant createdAt,
    Instant lastLoginAt,
    @JsonProperty("isActive") boolean active,
    @JsonProperty("isAdmin") boolean admin,
    boolean mustChangePassword) {}
