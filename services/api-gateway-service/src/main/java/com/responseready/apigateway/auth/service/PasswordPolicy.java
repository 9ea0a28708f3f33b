package com.responseready.apigateway.auth.service;

import com.responseready.apigateway.common.web.BadRequestException;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Strength rules for self-chosen passwords: at least 12 characters with an upper-case letter, a
 * lower-case letter, a digit and one of {@code @$!%*?&}.
 */
@Component
public class PasswordPolicy {

  static final int MIN_LENGTH = 12;

  private static final Pattern UPPER = Pattern.compile("[A-Z]");
  private static final Pattern LOWER = Pattern.compile("[a-z]");
  private static final Pattern DIGIT = Pattern.compile("[0-9]");
  private static final Pattern SPECIAL = Pattern.compile("[@$!%*?&]");

  /**
   * @throws BadRequestException naming the first rule the password breaks
   */
  public void check(String password) {
    if (password == null || password.isEmpty()) {
      throw new BadRequestException("Password is required");
    }
    if (password.length() < MIN_LENGTH) {
      throw new BadRequestException("Password must be at least 12 characters");
    }
    if (!UPPER.matcher(password).find()) {
      throw new BadRequestException("Password must contain at least one uppercase letter");
    }
    if (!LOWER.matcher(password).find()) {
      throw new BadRequestException("Password must contain at least one lowercase letter");
    }
    if (!DIGIT.matcher(password).find()) {
      throw new BadRequestException("Password must contain at least one number");
    }
    if (!SPECIAL.matcher(password).find()) {
      throw new BadRequestException(
          "Password must contain at least one special character (@$!%*?&)");
    }
  }
}
