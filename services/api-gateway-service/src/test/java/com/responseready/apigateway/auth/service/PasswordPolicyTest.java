package com.responseready.apigateway.auth.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.responseready.apigateway.common.web.BadRequestException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class PasswordPolicyTest {

  private final PasswordPolicy policy = new PasswordPolicy();

  @ParameterizedTest
  @ValueSource(strings = {"Str0ng&Secret!", "Abcdefghij1@", "ZZZZzzzz1111$"})
  void acceptsStrongPasswords(String password) {
    assertThatCode(() -> policy.check(password)).doesNotThrowAnyException();
  }

  @ParameterizedTest
  @CsvSource({
    "Sh0rt@pw, Password must be at least 12 characters",
    "alllowercase1@, Password must contain at least one uppercase letter",
    "ALLUPPERCASE1@, Password must contain at least one lowercase letter",
    "NoDigitsHere@@, Password must contain at least one number",
    "NoSpecials1234, Password must contain at least one special character (@$!%*?&)"
  })
  void namesFirstBrokenRule(String password, String message) {
    assertThatThrownBy(() -> policy.check(password))
        .isInstanceOf(BadRequestException.class)
        .hasMessage(message);
  }
}
