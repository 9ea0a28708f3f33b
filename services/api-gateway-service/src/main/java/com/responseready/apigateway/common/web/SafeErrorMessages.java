package com.responseready.apigateway.common.web;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Chooses the message an unexpected error shows to the client. Outside development only the
 * generic default is returned; the details stay in the server log.
 */
@Component
public class SafeErrorMessages {

  private final boolean exposeDetails;

  public SafeErrorMessages(@Value("${api.errors.expose-details:false}") boolean exposeDetails) {
    this.exposeDetails = exposeDetails;
  }

  public String forClient(Throwable error, String defaultMessage) {
    if (exposeDetails && error != null && StringUtils.hasText(error.getMessage())) {
      return error.getMessage();
    }
    return defaultMessage;
  }
}
