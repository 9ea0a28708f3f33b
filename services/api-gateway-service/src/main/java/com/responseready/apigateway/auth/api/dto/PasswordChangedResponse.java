package com.responseready.apigateway.auth.api.dto;

public record PasswordChangedResponse(boolean success, AccountView user) {}
