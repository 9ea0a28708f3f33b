package com.responseready.apigateway.auth.api.dto;

import java.util.List;

public record AccountListResponse(List<AccountView> users) {}
