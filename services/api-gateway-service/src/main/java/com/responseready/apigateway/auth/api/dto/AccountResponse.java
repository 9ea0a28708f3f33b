package com.responseready.apigateway.auth.api.dto;

public record AccountResponse(AccountView user) {}
