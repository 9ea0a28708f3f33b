package com.responseready.apigateway.auth.api.dto;

public record CredentialsResponse(AccountView user, String token, String refreshToken) {}
