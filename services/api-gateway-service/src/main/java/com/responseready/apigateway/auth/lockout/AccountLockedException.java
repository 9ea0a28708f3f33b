package com.responseready.apigateway.auth.lockout;

import com.responseready.apigateway.common.web.ApiException;
import org.springframework.http.HttpStatus;

/** 423: too many failed logins. The message states the wait, never the failure count. */
public class AccountLockedException extends ApiException {

  public AccountLockedException(long minutesRemaining) {
    super(
        HttpStatus.LOCKED,
        "Account temporarily locked due to too many failed login attempts. Please try again in "
            + minutesRemaining
            + " minute(s).");
  }
}
