package com.responseready.apigateway.common.web;

import org.springframework.http.HttpStatus;

/** 400 for input the handler rejects after binding. */
public class BadRequestException extends ApiException {
  public BadRequestException(String message) {
    super(HttpStatus.BAD_REQUEST, message);
  }
}
