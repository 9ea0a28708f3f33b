package com.responseready.apigateway.common.web;

import org.springframework.http.HttpStatus;

/** 401: missing, invalid or expired credentials. */
public class UnauthorizedException extends ApiException {
  public UnauthorizedException(String message) {
    super(HttpStatus.UNAUTHORIZED, message);
  }
}
