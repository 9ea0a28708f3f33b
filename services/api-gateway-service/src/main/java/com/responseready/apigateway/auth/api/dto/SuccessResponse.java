package com.responseready.apigateway.auth.api.dto;

public record SuccessResponse(boolean success) {}
