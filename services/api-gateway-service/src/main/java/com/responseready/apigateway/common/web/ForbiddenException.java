package com.responseready.apigateway.common.web;

import org.springframework.http.HttpStatus;

/** 403 with a stable JSON payload via ApiExceptionHandler. */
public class ForbiddenException extends ApiException {
  public ForbiddenException(String message) {
    super(HttpStatus.FORBIDDEN, message);
  }
}
