package com.responseready.apigateway.common.web;

import org.springframework.http.HttpStatus;

/**
 * Base type for errors whose message is safe to show to the client. The pipeline and {@link
 * ApiExceptionHandler} render them as {@code {"error": message}} with {@link #getStatus()}.
 */
public abstract class ApiException extends RuntimeException {

  private final HttpStatus status;

  protected ApiException(HttpStatus status, String message) {
    super(message);
    this.status = status;
  }

  public HttpStatus getStatus() {
    return status;
  }
}
