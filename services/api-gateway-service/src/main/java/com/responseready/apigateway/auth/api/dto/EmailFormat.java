package com.responseready.apigateway.auth.api.dto;

/** Email shape accepted for usernames; surrounding whitespace is trimmed later. */
final class EmailFormat {

  static final String REGEX = "\\s*[^\\s@]+@[^\\s@]+\\.[^\\s@]+\\s*";

  private EmailFormat() {}
}
