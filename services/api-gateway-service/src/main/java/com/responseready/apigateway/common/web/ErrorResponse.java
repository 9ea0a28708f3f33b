package com.responseready.apigateway.common.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** Uniform error body: {@code {"error": "..."}}, plus {@code retryAfter} seconds on 429. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, Long retryAfter) {

  public static ErrorResponse of(String error) {
    return new ErrorResponse(error, null);
  }

  public static ResponseEntity<ErrorResponse> entity(HttpStatus status, String error) {
    return ResponseEntity.status(status).body(of(error));
  }
}
