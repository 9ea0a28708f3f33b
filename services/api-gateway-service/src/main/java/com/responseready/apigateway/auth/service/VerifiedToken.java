package com.responseready.apigateway.auth.service;

import java.time.Instant;

public record VerifiedToken(TokenClaims claims, Instant issuedAt, Instant expiresAt) {}
