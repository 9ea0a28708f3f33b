package com.responseready.apigateway.auth.service;

import com.responseready.apigateway.auth.domain.AccountEntity;

/** An account together with a freshly signed access and refresh token. */
public record IssuedCredentials(AccountEntity account, String token, String refreshToken) {}
