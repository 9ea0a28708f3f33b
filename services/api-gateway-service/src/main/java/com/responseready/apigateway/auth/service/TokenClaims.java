package com.responseready.apigateway.auth.service;

/**
 * Identity carried by access and refresh tokens.
 *
 * @param userId account id, the JWT subject
 * @param admin administrative privilege at signing time; trusted only for the token's lifetime
 * @param email contact identifier (the account's username)
 */
public record TokenClaims(String userId, boolean admin, String email) {}
