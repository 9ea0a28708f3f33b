package com.responseready.apigateway.auth.api.dto;

public record MessageResponse(boolean success, String message) {}
