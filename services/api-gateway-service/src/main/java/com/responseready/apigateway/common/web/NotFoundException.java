package com.responseready.apigateway.common.web;

import org.springframework.http.HttpStatus;

/** 404 with a stable JSON payload via ApiExceptionHandler. */
public class NotFoundException extends ApiException {
  public NotFoundException(String message) {
    super(HttpStatus.NOT_FOUND, message);
  }
}
