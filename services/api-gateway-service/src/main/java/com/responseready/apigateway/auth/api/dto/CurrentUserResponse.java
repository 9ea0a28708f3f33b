package com.responseready.apigateway.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CurrentUserResponse(User user) {

  public record User(String id, String email, @JsonProperty("isAdmin") boolean admin) {}
}
