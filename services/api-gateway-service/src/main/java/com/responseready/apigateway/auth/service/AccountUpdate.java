package com.responseready.apigateway.auth.service;

/** Admin edit of an account. Null fields are left unchanged; a blank password is ignored. */
public record AccountUpdate(
    String username, String email, String password, Boolean active, Boolean admin) {}
