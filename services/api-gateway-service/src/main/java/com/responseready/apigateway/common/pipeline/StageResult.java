package com.responseready.apigateway.common.pipeline;

import org.springframework.http.ResponseEntity;

/** Either continue to the next stage or answer now with {@link #response()}. */
public record StageResult(ResponseEntity<?> response) {

  private static final StageResult PROCEED = new StageResult(null);

  public static StageResult proceed() {
    return PROCEED;
  }

  public static StageResult shortCircuit(ResponseEntity<?> response) {
    return new StageResult(response);
  }

  public boolean isShortCircuit() {
    return response != null;
  }
}
