package com.responseready.apigateway.auth.service;

import com.responseready.apigateway.auth.domain.AccountActivityEntity;
import com.responseready.apigateway.auth.domain.AccountEntity;
import com.responseready.apigateway.auth.repository.AccountActivityRepository;
import com.responseready.apigateway.common.ratelimit.ClientIdentifierResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AuthAuditService {

  public static final String LOGIN = "login";
  public static final String REGISTER = "register";
  public static final String PASSWORD_CHANGE = "password_change";
  public static final String PASSWORD_CHANGE_FORCED = "password_change_forced";
  public static final String ACCOUNT_CREATED = "account_created";

  private final AccountActivityRepository activityRepository;
  private final ClientIdentifierResolver identifiers;
  private final Clock clock;

  @Transactional
  public void log(AccountEntity account, String action, HttpServletRequest request) {
    AccountActivityEntity activity =
        new AccountActivityEntity(
            account,
            action,
            clock.instant(),
            identifiers.clientIp(request),
            truncate(request.getHeader(HttpHeaders.USER_AGENT), 256),
            truncate(request.getHeader(HttpHeaders.REFERER), 512));
    activityRepository.save(activity);
  }

  private static String truncate(String value, int max) {
    if (value == null || value.length() <= max) {
      return value;
    }
    return value.substring(0, max);
  }
}
